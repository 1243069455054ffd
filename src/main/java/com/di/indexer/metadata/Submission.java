package com.di.indexer.metadata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Domain model for the {@code submissions} table.
 *
 * <p>One row per scan-submission attestation, keyed by the attestation uid.
 * Attested fields are written once; {@link #status}, {@link #errorMessage},
 * {@link #manifestSha256} and {@link #processedAt} follow the ingestion.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Submission {

    private String  uid;
    private String  submitter;

    // ---- attested payload ---------------------------------------------------
    private String  jobId;
    private String  namespace;
    private String  datasetType;
    private String  cid;
    private String  merkleRoot;
    private String  targetSpecCid;
    private Long    startedAt;
    private Long    finishedAt;
    private String  tool;
    private String  toolVersion;
    private String  vantage;
    private String  manifestSha256;
    private byte[]  extra;

    /** Attestation timestamp, epoch seconds. */
    private Long    timestamp;

    // ---- lifecycle ---------------------------------------------------------
    @Builder.Default
    private SubmissionStatus status = SubmissionStatus.PENDING;
    private String  errorMessage;
    private Instant processedAt;
    private Instant createdAt;

    /** Record count; populated by listing queries only. */
    private Long    recordCount;
}
