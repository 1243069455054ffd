package com.di.indexer.stats;

import com.di.indexer.metadata.Submission;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * API projection of a {@link Submission} (no raw {@code extra} bytes).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionSummary {

    private String  uid;
    private String  submitter;
    private String  jobId;
    private String  namespace;
    private String  datasetType;
    private String  cid;
    private String  merkleRoot;
    private String  manifestSha256;
    private String  tool;
    private String  toolVersion;
    private String  vantage;
    private Long    startedAt;
    private Long    finishedAt;
    private Long    timestamp;
    private String  status;
    private String  errorMessage;
    private Long    recordCount;
    private Instant processedAt;
    private Instant createdAt;

    public static SubmissionSummary from(Submission s) {
        return SubmissionSummary.builder()
                .uid(s.getUid())
                .submitter(s.getSubmitter())
                .jobId(s.getJobId())
                .namespace(s.getNamespace())
                .datasetType(s.getDatasetType())
                .cid(s.getCid())
                .merkleRoot(s.getMerkleRoot())
                .manifestSha256(s.getManifestSha256())
                .tool(s.getTool())
                .toolVersion(s.getToolVersion())
                .vantage(s.getVantage())
                .startedAt(s.getStartedAt())
                .finishedAt(s.getFinishedAt())
                .timestamp(s.getTimestamp())
                .status(s.getStatus() == null ? null : s.getStatus().dbValue())
                .errorMessage(s.getErrorMessage())
                .recordCount(s.getRecordCount())
                .processedAt(s.getProcessedAt())
                .createdAt(s.getCreatedAt())
                .build();
    }
}
