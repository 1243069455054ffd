package com.di.indexer.stats;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view of what has been indexed so far.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexerStats {

    // ---- submissions -------------------------------------------------------
    private long              totalSubmissions;
    /** {@code pending|processing|completed|failed -> count}. */
    private Map<String, Long> submissions;

    // ---- records -----------------------------------------------------------
    private long              totalRecords;
    private long              distinctHosts;
    private Map<String, Long> topServices;
    private Map<Integer, Long> topPorts;

    // ---- checkpoint --------------------------------------------------------
    private long              lastBlock;
    private String            lastAttestationUid;
    private long              processedCount;
    private long              errorCount;
    private Instant           lastUpdated;

    /** Latest failures with their reasons. */
    private List<SubmissionSummary> recentFailures;
}
