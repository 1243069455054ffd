package com.di.indexer.stats;

import com.di.indexer.exception.SubmissionNotFoundException;
import com.di.indexer.metadata.CheckpointRepository;
import com.di.indexer.metadata.CheckpointState;
import com.di.indexer.metadata.ScanRecordRepository;
import com.di.indexer.metadata.SubmissionRepository;
import com.di.indexer.metadata.SubmissionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only queries over the indexed data.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatsService {

    static final int MAX_LIMIT        = 500;
    static final int TOP_N            = 10;
    static final int RECENT_FAILURES  = 10;
    static final int HOST_RECENT      = 50;
    static final int HOST_SUBMISSIONS = 20;

    private final SubmissionRepository submissionRepo;
    private final ScanRecordRepository recordRepo;
    private final CheckpointRepository checkpointRepo;

    public IndexerStats stats() {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        long total = 0;
        for (Map.Entry<SubmissionStatus, Long> e : submissionRepo.countByStatus().entrySet()) {
            byStatus.put(e.getKey().dbValue(), e.getValue());
            total += e.getValue();
        }
        CheckpointState state = checkpointRepo.load().orElseGet(CheckpointState::empty);

        return IndexerStats.builder()
                .totalSubmissions(total)
                .submissions(byStatus)
                .totalRecords(recordRepo.count())
                .distinctHosts(recordRepo.countDistinctIps())
                .topServices(recordRepo.topServices(TOP_N))
                .topPorts(recordRepo.topPorts(TOP_N))
                .lastBlock(Math.max(0L, state.getLastBlock()))
                .lastAttestationUid(state.getLastAttestationUid())
                .processedCount(state.getProcessedCount())
                .errorCount(state.getErrorCount())
                .lastUpdated(state.getUpdatedAt())
                .recentFailures(submissions("failed", RECENT_FAILURES))
                .build();
    }

    /**
     * @param status {@code null} or blank for every status
     * @throws IllegalArgumentException on an unknown status or non-positive limit
     */
    public List<SubmissionSummary> submissions(String status, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        SubmissionStatus filter = parseStatus(status);
        return submissionRepo.findRecent(filter, Math.min(limit, MAX_LIMIT)).stream()
                .map(SubmissionSummary::from)
                .toList();
    }

    /** Uids are stored lowercased, so the lookup ignores case. */
    public SubmissionSummary submission(String uid) {
        String key = uid == null ? "" : uid.trim().toLowerCase(Locale.ROOT);
        return submissionRepo.findByUid(key)
                .map(s -> {
                    s.setRecordCount(recordRepo.countBySubmission(key));
                    return SubmissionSummary.from(s);
                })
                .orElseThrow(() -> new SubmissionNotFoundException(uid));
    }

    public HostReport host(String ip) {
        if (ip == null || ip.isBlank()) {
            throw new IllegalArgumentException("ip is required");
        }
        String key = ip.trim();
        return HostReport.builder()
                .ip(key)
                .totalRecords(recordRepo.countByIp(key))
                .openPorts(recordRepo.findOpenPorts(key))
                .services(recordRepo.findServices(key))
                .recent(recordRepo.findByIp(key, HOST_RECENT))
                .submissions(submissionRepo.findContainingIp(key, HOST_SUBMISSIONS).stream()
                        .map(SubmissionSummary::from)
                        .toList())
                .build();
    }

    private static SubmissionStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return SubmissionStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status '" + status
                    + "'; expected pending, processing, completed or failed", e);
        }
    }
}
