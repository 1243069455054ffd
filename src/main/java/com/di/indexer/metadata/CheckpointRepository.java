package com.di.indexer.metadata;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * JDBC repository for the singleton {@code indexer_state} row.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class CheckpointRepository {

    static final int STATE_ID = 1;

    private final JdbcTemplate jdbc;

    private static final RowMapper<CheckpointState> ROW_MAPPER = (rs, n) -> {
        Timestamp updated = rs.getTimestamp("updated_at");
        return CheckpointState.builder()
                .lastBlock(rs.getLong("last_block"))
                .lastAttestationUid(rs.getString("last_attestation_uid"))
                .processedCount(rs.getLong("processed_count"))
                .errorCount(rs.getLong("error_count"))
                .updatedAt(updated == null ? null : updated.toInstant())
                .build();
    };

    public Optional<CheckpointState> load() {
        List<CheckpointState> rows = jdbc.query(
                "SELECT * FROM indexer_state WHERE id = ?", ROW_MAPPER, STATE_ID);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /** Creates the singleton row when missing. */
    public void ensureRow() {
        Long cnt = jdbc.queryForObject(
                "SELECT COUNT(*) FROM indexer_state WHERE id = ?", Long.class, STATE_ID);
        if (cnt == null || cnt == 0) {
            jdbc.update("""
                INSERT INTO indexer_state
                  (id, last_block, last_attestation_uid, processed_count, error_count, updated_at)
                VALUES (?, -1, '', 0, 0, CURRENT_TIMESTAMP)
                """, STATE_ID);
        }
    }

    /** Counts one terminal submission and records it as the latest processed uid. */
    public void recordTerminal(String uid, boolean failed) {
        jdbc.update("""
            UPDATE indexer_state
               SET last_attestation_uid = ?,
                   processed_count      = processed_count + 1,
                   error_count          = error_count + ?,
                   updated_at           = CURRENT_TIMESTAMP
             WHERE id = ?
            """, uid, failed ? 1 : 0, STATE_ID);
    }

    /** Moves {@code last_block} forward; lower positions leave it unchanged. */
    public void advanceBlock(long position) {
        jdbc.update("""
            UPDATE indexer_state
               SET last_block = CASE WHEN last_block < ? THEN ? ELSE last_block END,
                   updated_at = CURRENT_TIMESTAMP
             WHERE id = ?
            """, position, position, STATE_ID);
    }
}
