package com.di.indexer.ingest;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the ingestion pipeline.
 */
@Slf4j
@Component
public class IngestionMetrics {

    // Submissions
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter duplicateCounter;
    private final Counter ignoredCounter;
    private final DistributionSummary recordsPerSubmission;

    // Scanning
    private final Counter windowCounter;
    private final Counter unavailableWindowCounter;
    private final Counter loopErrorCounter;
    private final Timer   windowTimer;
    private final AtomicLong checkpoint = new AtomicLong(-1);

    public IngestionMetrics(MeterRegistry meterRegistry) {
        this.completedCounter = Counter.builder("indexer.submissions.total")
                .description("Submissions that reached a terminal status")
                .tag("status", "completed")
                .register(meterRegistry);

        this.failedCounter = Counter.builder("indexer.submissions.total")
                .description("Submissions that reached a terminal status")
                .tag("status", "failed")
                .register(meterRegistry);

        this.duplicateCounter = Counter.builder("indexer.events.skipped")
                .description("Events skipped without writing")
                .tag("reason", "duplicate")
                .register(meterRegistry);

        this.ignoredCounter = Counter.builder("indexer.events.skipped")
                .description("Events skipped without writing")
                .tag("reason", "ignored")
                .register(meterRegistry);

        this.recordsPerSubmission = DistributionSummary.builder("indexer.submission.records")
                .description("Scan records ingested per completed submission")
                .baseUnit("records")
                .register(meterRegistry);

        this.windowCounter = Counter.builder("indexer.scan.windows")
                .description("Scan windows processed")
                .tag("available", "true")
                .register(meterRegistry);

        this.unavailableWindowCounter = Counter.builder("indexer.scan.windows")
                .description("Scan windows processed")
                .tag("available", "false")
                .register(meterRegistry);

        this.loopErrorCounter = Counter.builder("indexer.loop.errors")
                .description("Transient errors caught by the ingestion loop")
                .register(meterRegistry);

        this.windowTimer = Timer.builder("indexer.scan.window.duration")
                .description("Time to scan, ingest and checkpoint one window")
                .register(meterRegistry);

        meterRegistry.gauge("indexer.checkpoint.block", checkpoint);
    }

    public void recordTerminal(boolean completed, int recordCount) {
        if (completed) {
            completedCounter.increment();
            recordsPerSubmission.record(recordCount);
        } else {
            failedCounter.increment();
        }
    }

    public void recordSkipped(IngestOutcome outcome, int count) {
        if (outcome == IngestOutcome.DUPLICATE) {
            duplicateCounter.increment(count);
        } else if (outcome == IngestOutcome.IGNORED) {
            ignoredCounter.increment(count);
        }
    }

    public void recordWindow(boolean available, long durationMs) {
        (available ? windowCounter : unavailableWindowCounter).increment();
        windowTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordLoopError() {
        loopErrorCounter.increment();
    }

    public void recordCheckpoint(long block) {
        checkpoint.set(block);
        log.debug("Recorded checkpoint block={}", block);
    }
}
