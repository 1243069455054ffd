package com.di.indexer.stats;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Map;

/**
 * {@code indexer.mode=stats}: prints aggregate statistics once; the
 * application then exits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "indexer", name = "mode", havingValue = "stats")
public class StatsCommand implements ApplicationRunner {

    private final StatsService statsService;

    @Override
    public void run(ApplicationArguments args) {
        print(statsService.stats(), System.out);
    }

    static void print(IndexerStats stats, PrintStream out) {
        Map<String, Long> byStatus = stats.getSubmissions();
        out.println("Indexer Statistics");
        out.println("------------------");
        row(out, "Total Submissions", stats.getTotalSubmissions());
        row(out, "Completed", byStatus.getOrDefault("completed", 0L));
        row(out, "Processing", byStatus.getOrDefault("processing", 0L));
        row(out, "Pending", byStatus.getOrDefault("pending", 0L));
        row(out, "Failed", byStatus.getOrDefault("failed", 0L));
        row(out, "Total Records", stats.getTotalRecords());
        row(out, "Distinct Hosts", stats.getDistinctHosts());
        row(out, "Last Block", stats.getLastBlock());
        row(out, "Last Updated", stats.getLastUpdated() == null ? "N/A" : stats.getLastUpdated());
        if (stats.getRecentFailures() != null && !stats.getRecentFailures().isEmpty()) {
            out.println();
            out.println("Recent failures:");
            stats.getRecentFailures().forEach(f ->
                    out.printf("  %s  %s%n", f.getUid(), f.getErrorMessage()));
        }
        out.flush();
    }

    private static void row(PrintStream out, String metric, Object value) {
        out.printf("%-18s %s%n", metric, value);
    }
}
