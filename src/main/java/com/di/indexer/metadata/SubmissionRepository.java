package com.di.indexer.metadata;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC repository for the {@code submissions} table.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class SubmissionRepository {

    /** Column limit for {@code error_message}. */
    static final int MAX_ERROR_LENGTH = 4000;

    private final JdbcTemplate jdbc;

    // ------------------------------------------------------------------
    // RowMapper
    // ------------------------------------------------------------------

    private static final RowMapper<Submission> ROW_MAPPER = (rs, n) -> {
        Submission s = new Submission();
        s.setUid(rs.getString("uid"));
        s.setSubmitter(rs.getString("submitter"));
        s.setJobId(rs.getString("job_id"));
        s.setNamespace(rs.getString("namespace"));
        s.setDatasetType(rs.getString("dataset_type"));
        s.setCid(rs.getString("cid"));
        s.setMerkleRoot(rs.getString("merkle_root"));
        s.setTargetSpecCid(rs.getString("target_spec_cid"));
        s.setStartedAt(nullableLong(rs.getLong("started_at"), rs.wasNull()));
        s.setFinishedAt(nullableLong(rs.getLong("finished_at"), rs.wasNull()));
        s.setTool(rs.getString("tool"));
        s.setToolVersion(rs.getString("tool_version"));
        s.setVantage(rs.getString("vantage"));
        s.setManifestSha256(rs.getString("manifest_sha256"));
        s.setExtra(rs.getBytes("extra"));
        s.setTimestamp(nullableLong(rs.getLong("attestation_timestamp"), rs.wasNull()));
        s.setStatus(SubmissionStatus.fromDb(rs.getString("status")));
        s.setErrorMessage(rs.getString("error_message"));
        s.setProcessedAt(toInstant(rs.getTimestamp("processed_at")));
        s.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
        return s;
    };

    private static final RowMapper<Submission> LISTING_MAPPER = (rs, n) -> {
        Submission s = ROW_MAPPER.mapRow(rs, n);
        s.setRecordCount(rs.getLong("record_count"));
        return s;
    };

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    /**
     * Update-by-uid, insert when absent. Portable across PostgreSQL and H2;
     * callers serialise writes per uid (single ingestion thread).
     */
    public void upsert(Submission s) {
        int updated = jdbc.update("""
            UPDATE submissions
               SET submitter = ?, job_id = ?, namespace = ?, dataset_type = ?,
                   cid = ?, merkle_root = ?, target_spec_cid = ?,
                   started_at = ?, finished_at = ?,
                   tool = ?, tool_version = ?, vantage = ?,
                   manifest_sha256 = ?, extra = ?, attestation_timestamp = ?,
                   status = ?, error_message = ?, processed_at = ?
             WHERE uid = ?
            """,
            s.getSubmitter(), s.getJobId(), s.getNamespace(), s.getDatasetType(),
            s.getCid(), s.getMerkleRoot(), s.getTargetSpecCid(),
            s.getStartedAt(), s.getFinishedAt(),
            s.getTool(), s.getToolVersion(), s.getVantage(),
            s.getManifestSha256(), s.getExtra(), s.getTimestamp(),
            s.getStatus().dbValue(), truncate(s.getErrorMessage()), toTimestamp(s.getProcessedAt()),
            s.getUid());
        if (updated > 0) {
            return;
        }
        jdbc.update("""
            INSERT INTO submissions
              (uid, submitter, job_id, namespace, dataset_type,
               cid, merkle_root, target_spec_cid,
               started_at, finished_at,
               tool, tool_version, vantage,
               manifest_sha256, extra, attestation_timestamp,
               status, error_message, processed_at, created_at)
            VALUES (?,?,?,?,?, ?,?,?, ?,?, ?,?,?, ?,?,?, ?,?,?, CURRENT_TIMESTAMP)
            """,
            s.getUid(), s.getSubmitter(), s.getJobId(), s.getNamespace(), s.getDatasetType(),
            s.getCid(), s.getMerkleRoot(), s.getTargetSpecCid(),
            s.getStartedAt(), s.getFinishedAt(),
            s.getTool(), s.getToolVersion(), s.getVantage(),
            s.getManifestSha256(), s.getExtra(), s.getTimestamp(),
            s.getStatus().dbValue(), truncate(s.getErrorMessage()), toTimestamp(s.getProcessedAt()));
    }

    /** Deletes the submission; {@code scan_records} rows cascade. */
    public int delete(String uid) {
        return jdbc.update("DELETE FROM submissions WHERE uid = ?", uid);
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    public Optional<Submission> findByUid(String uid) {
        List<Submission> rows = jdbc.query(
                "SELECT * FROM submissions WHERE uid = ?", ROW_MAPPER, uid);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<SubmissionStatus> findStatus(String uid) {
        List<String> rows = jdbc.queryForList(
                "SELECT status FROM submissions WHERE uid = ?", String.class, uid);
        return rows.isEmpty() ? Optional.empty() : Optional.of(SubmissionStatus.fromDb(rows.get(0)));
    }

    public List<String> findUidsByStatus(SubmissionStatus... statuses) {
        if (statuses.length == 0) {
            return List.of();
        }
        String placeholders = String.join(",", Collections.nCopies(statuses.length, "?"));
        Object[] args = new Object[statuses.length];
        for (int i = 0; i < statuses.length; i++) {
            args[i] = statuses[i].dbValue();
        }
        return jdbc.queryForList(
                "SELECT uid FROM submissions WHERE status IN (" + placeholders + ")",
                String.class, args);
    }

    /** Most recent first, with record counts. {@code status == null} lists every status. */
    public List<Submission> findRecent(SubmissionStatus status, int limit) {
        String base = """
            SELECT s.*, (SELECT COUNT(*) FROM scan_records r WHERE r.submission_uid = s.uid) AS record_count
              FROM submissions s
            """;
        if (status == null) {
            return jdbc.query(base + " ORDER BY s.created_at DESC, s.uid LIMIT ?", LISTING_MAPPER, limit);
        }
        return jdbc.query(base + " WHERE s.status = ? ORDER BY s.created_at DESC, s.uid LIMIT ?",
                          LISTING_MAPPER, status.dbValue(), limit);
    }

    /** Submissions with at least one record for {@code ip}, newest first. */
    public List<Submission> findContainingIp(String ip, int limit) {
        return jdbc.query("""
            SELECT s.*, (SELECT COUNT(*) FROM scan_records r WHERE r.submission_uid = s.uid) AS record_count
              FROM submissions s
             WHERE EXISTS (SELECT 1 FROM scan_records r
                            WHERE r.submission_uid = s.uid AND r.ip = ?)
             ORDER BY s.attestation_timestamp DESC, s.uid
             LIMIT ?
            """, LISTING_MAPPER, ip, limit);
    }

    public Map<SubmissionStatus, Long> countByStatus() {
        Map<SubmissionStatus, Long> counts = new LinkedHashMap<>();
        for (SubmissionStatus st : SubmissionStatus.values()) {
            counts.put(st, 0L);
        }
        jdbc.query("SELECT status, COUNT(*) AS cnt FROM submissions GROUP BY status", rs -> {
            counts.put(SubmissionStatus.fromDb(rs.getString("status")), rs.getLong("cnt"));
        });
        return counts;
    }

    public long count() {
        Long cnt = jdbc.queryForObject("SELECT COUNT(*) FROM submissions", Long.class);
        return cnt == null ? 0L : cnt;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
    private static Long nullableLong(long v, boolean wasNull) { return wasNull ? null : v; }
}
