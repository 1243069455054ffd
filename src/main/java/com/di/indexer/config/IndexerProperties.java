package com.di.indexer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Single binding for ALL indexer configuration.
 *
 * <p>Endpoints, poll cadence, window size, retry policy and fetch limits are
 * supplied externally (YAML or environment); nothing here is a hardcoded
 * pipeline constant.
 *
 * <pre>
 * indexer:
 *   mode: run
 *   verify-on-startup: true
 *   ledger:
 *     rpc-url: http://127.0.0.1:8545
 *     attestor-address: 0x...
 *     attestation-event-topic: 0x...
 *     get-attestation-selector: 0xa3112a64
 *     scan-submission-schema-uid: 0x...
 *   content-store:
 *     api-url: http://127.0.0.1:5001
 *     pin-completed: false
 *   scan:
 *     poll-interval: 10s
 *     window-size: 100
 *     rescan-overlap: 0
 *     initial-lookback: 1000
 *   retry:
 *     max-retries: 3
 *     delay: 1s
 *   fetch:
 *     timeout: 30s
 *     max-bundle-size: 104857600
 *     concurrency: 1
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "indexer")
public class IndexerProperties {

    /** {@code run} drives the ingestion loop; {@code stats} prints statistics and exits. */
    @NotBlank
    private String mode = "run";

    /** Fail startup when the ledger, content store or database is unreachable. */
    private boolean verifyOnStartup = true;

    @Valid
    private Ledger ledger = new Ledger();

    @Valid
    private ContentStore contentStore = new ContentStore();

    @Valid
    private Scan scan = new Scan();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Fetch fetch = new Fetch();

    public boolean isStatsMode() {
        return "stats".equalsIgnoreCase(mode == null ? "" : mode.trim());
    }

    // ------------------------------------------------------------------ //
    // Ledger                                                              //
    // ------------------------------------------------------------------ //

    @Data
    public static class Ledger {

        @NotBlank
        private String rpcUrl = "http://127.0.0.1:8545";

        /** Attestor contract emitting {@code AttestationMade(uid, attester, subject)}. */
        private String attestorAddress = "";

        /** topic0 of the {@code AttestationMade} event (keccak of its signature). */
        private String attestationEventTopic = "";

        /** 4-byte selector of {@code getAttestation(bytes32)}. */
        private String getAttestationSelector = "";

        /** Schema uid that marks an attestation as a scan submission. */
        private String scanSubmissionSchemaUid = "";
    }

    // ------------------------------------------------------------------ //
    // Content store                                                       //
    // ------------------------------------------------------------------ //

    @Data
    public static class ContentStore {

        @NotBlank
        private String apiUrl = "http://127.0.0.1:5001";

        /** Pin bundles of completed submissions on the local node. */
        private boolean pinCompleted = false;
    }

    // ------------------------------------------------------------------ //
    // Scan windowing                                                      //
    // ------------------------------------------------------------------ //

    @Data
    public static class Scan {

        @NotNull
        private Duration pollInterval = Duration.ofSeconds(10);

        /** Blocks per scan window. */
        @Positive
        private int windowSize = 100;

        /** Blocks re-scanned behind the checkpoint on startup to absorb shallow reorgs. */
        @Min(0)
        private int rescanOverlap = 0;

        /** Blocks behind head to start from when no checkpoint exists. */
        @Min(0)
        private long initialLookback = 1000;
    }

    // ------------------------------------------------------------------ //
    // Retry                                                               //
    // ------------------------------------------------------------------ //

    @Data
    public static class Retry {

        @Min(0)
        private int maxRetries = 3;

        @NotNull
        private Duration delay = Duration.ofSeconds(1);
    }

    // ------------------------------------------------------------------ //
    // Bundle fetch limits                                                 //
    // ------------------------------------------------------------------ //

    @Data
    public static class Fetch {

        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /** Upper bound in bytes for any single fetched object. */
        @Positive
        private long maxBundleSize = 100L * 1024 * 1024;

        /** Bundles fetched in parallel per window; commits stay in source order. */
        @Positive
        private int concurrency = 1;
    }
}
