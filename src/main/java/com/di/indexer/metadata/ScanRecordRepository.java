package com.di.indexer.metadata;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC repository for the {@code scan_records} table.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class ScanRecordRepository {

    private static final int BATCH_SIZE = 500;

    private final JdbcTemplate jdbc;

    // ------------------------------------------------------------------

    private static final RowMapper<ScanRecord> ROW_MAPPER = (rs, n) -> {
        ScanRecord r = new ScanRecord();
        r.setId(rs.getLong("id"));
        r.setSubmissionUid(rs.getString("submission_uid"));
        long ts = rs.getLong("observed_at");
        r.setTimestamp(rs.wasNull() ? null : ts);
        r.setIp(rs.getString("ip"));
        int port = rs.getInt("port");
        r.setPort(rs.wasNull() ? null : port);
        r.setProtocol(rs.getString("protocol"));
        r.setState(rs.getString("state"));
        r.setService(rs.getString("service"));
        r.setProduct(rs.getString("product"));
        r.setVersion(rs.getString("version"));
        r.setBannerSha256(rs.getString("banner_sha256"));
        r.setCertFpr(rs.getString("cert_fpr"));
        r.setTlsJa3(rs.getString("tls_ja3"));
        int latency = rs.getInt("latency_ms");
        r.setLatencyMs(rs.wasNull() ? null : latency);
        r.setTool(rs.getString("tool"));
        r.setToolVersion(rs.getString("tool_version"));
        r.setOptions(rs.getString("options"));
        r.setVantage(rs.getString("vantage"));
        return r;
    };

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    public int deleteBySubmission(String submissionUid) {
        return jdbc.update("DELETE FROM scan_records WHERE submission_uid = ?", submissionUid);
    }

    /** Inserts the records of one submission in batches. */
    public void insertAll(String submissionUid, List<ScanRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        jdbc.batchUpdate("""
            INSERT INTO scan_records
              (submission_uid, observed_at, ip, port, protocol, state,
               service, product, version, banner_sha256, cert_fpr, tls_ja3, latency_ms,
               tool, tool_version, options, vantage)
            VALUES (?,?,?,?,?,?, ?,?,?,?,?,?,?, ?,?,?,?)
            """,
            records,
            BATCH_SIZE,
            (ps, r) -> bind(ps, submissionUid, r));
    }

    private static void bind(PreparedStatement ps, String submissionUid, ScanRecord r) throws SQLException {
        ps.setString(1, submissionUid);
        if (r.getTimestamp() != null) ps.setLong(2, r.getTimestamp()); else ps.setNull(2, Types.BIGINT);
        ps.setString(3, r.getIp());
        if (r.getPort()      != null) ps.setInt(4, r.getPort());       else ps.setNull(4, Types.INTEGER);
        ps.setString(5, r.getProtocol());
        ps.setString(6, r.getState());
        ps.setString(7, r.getService());
        ps.setString(8, r.getProduct());
        ps.setString(9, r.getVersion());
        ps.setString(10, r.getBannerSha256());
        ps.setString(11, r.getCertFpr());
        ps.setString(12, r.getTlsJa3());
        if (r.getLatencyMs() != null) ps.setInt(13, r.getLatencyMs()); else ps.setNull(13, Types.INTEGER);
        ps.setString(14, r.getTool());
        ps.setString(15, r.getToolVersion());
        ps.setString(16, r.getOptions());
        ps.setString(17, r.getVantage());
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    public List<ScanRecord> findBySubmission(String submissionUid) {
        return jdbc.query(
                "SELECT * FROM scan_records WHERE submission_uid = ? ORDER BY id",
                ROW_MAPPER, submissionUid);
    }

    /** Observations of one host, newest first. */
    public List<ScanRecord> findByIp(String ip, int limit) {
        return jdbc.query(
                "SELECT * FROM scan_records WHERE ip = ? ORDER BY observed_at DESC, port LIMIT ?",
                ROW_MAPPER, ip, limit);
    }

    public long count() {
        Long cnt = jdbc.queryForObject("SELECT COUNT(*) FROM scan_records", Long.class);
        return cnt == null ? 0L : cnt;
    }

    public long countBySubmission(String submissionUid) {
        Long cnt = jdbc.queryForObject(
                "SELECT COUNT(*) FROM scan_records WHERE submission_uid = ?", Long.class, submissionUid);
        return cnt == null ? 0L : cnt;
    }

    public long countByIp(String ip) {
        Long cnt = jdbc.queryForObject("SELECT COUNT(*) FROM scan_records WHERE ip = ?", Long.class, ip);
        return cnt == null ? 0L : cnt;
    }

    public List<Integer> findOpenPorts(String ip) {
        return jdbc.queryForList(
                "SELECT DISTINCT port FROM scan_records WHERE ip = ? AND state = 'open' ORDER BY port",
                Integer.class, ip);
    }

    public List<String> findServices(String ip) {
        return jdbc.queryForList("""
            SELECT DISTINCT service FROM scan_records
             WHERE ip = ? AND service IS NOT NULL AND service <> ''
             ORDER BY service
            """, String.class, ip);
    }

    public long countDistinctIps() {
        Long cnt = jdbc.queryForObject("SELECT COUNT(DISTINCT ip) FROM scan_records", Long.class);
        return cnt == null ? 0L : cnt;
    }

    /** Most frequently observed services, {@code service -> count}. */
    public Map<String, Long> topServices(int limit) {
        Map<String, Long> out = new LinkedHashMap<>();
        jdbc.query("""
            SELECT service, COUNT(*) AS cnt
              FROM scan_records
             WHERE service IS NOT NULL AND service <> ''
             GROUP BY service
             ORDER BY cnt DESC, service
             LIMIT ?
            """,
            rs -> {
                out.put(rs.getString("service"), rs.getLong("cnt"));
            },
            limit);
        return out;
    }

    /** Most frequently observed open ports, {@code port -> count}. */
    public Map<Integer, Long> topPorts(int limit) {
        Map<Integer, Long> out = new LinkedHashMap<>();
        jdbc.query("""
            SELECT port, COUNT(*) AS cnt
              FROM scan_records
             WHERE state = 'open'
             GROUP BY port
             ORDER BY cnt DESC, port
             LIMIT ?
            """,
            rs -> {
                out.put(rs.getInt("port"), rs.getLong("cnt"));
            },
            limit);
        return out;
    }
}
