package com.di.indexer.config;

import com.di.indexer.contentstore.ContentStore;
import com.di.indexer.ledger.LedgerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Checks every external dependency once all beans exist and before the
 * ingestion loop starts. Any failure aborts startup.
 *
 * <p>Stats mode only needs the database.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexerStartupVerifier implements SmartInitializingSingleton {

    private final LedgerClient      ledger;
    private final ContentStore      contentStore;
    private final JdbcTemplate      jdbc;
    private final IndexerProperties props;

    @Override
    public void afterSingletonsInstantiated() {
        if (!props.isVerifyOnStartup()) {
            log.info("[STARTUP] verify-on-startup=false; skipping dependency checks");
            return;
        }
        verifyDatabase();
        if (props.isStatsMode()) {
            return;
        }
        verifyLedger();
        verifyContentStore();
        requireConfigured("indexer.ledger.attestor-address", props.getLedger().getAttestorAddress());
        requireConfigured("indexer.ledger.attestation-event-topic", props.getLedger().getAttestationEventTopic());
        requireConfigured("indexer.ledger.get-attestation-selector", props.getLedger().getGetAttestationSelector());
        requireConfigured("indexer.ledger.scan-submission-schema-uid", props.getLedger().getScanSubmissionSchemaUid());
    }

    void verifyDatabase() {
        try {
            jdbc.queryForObject("SELECT COUNT(*) FROM indexer_state", Long.class);
            log.info("[STARTUP] database ok");
        } catch (RuntimeException e) {
            throw new IllegalStateException("database unreachable: " + e.getMessage(), e);
        }
    }

    void verifyLedger() {
        try {
            long head = ledger.currentHead();
            log.info("[STARTUP] ledger ok: head={}", head);
        } catch (RuntimeException e) {
            throw new IllegalStateException("ledger unreachable at " + props.getLedger().getRpcUrl()
                    + ": " + e.getMessage(), e);
        }
    }

    void verifyContentStore() {
        try {
            String version = contentStore.version();
            log.info("[STARTUP] content store ok: version={}", version);
        } catch (RuntimeException e) {
            throw new IllegalStateException("content store unreachable at " + props.getContentStore().getApiUrl()
                    + ": " + e.getMessage(), e);
        }
    }

    private static void requireConfigured(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(key + " is not configured");
        }
    }
}
