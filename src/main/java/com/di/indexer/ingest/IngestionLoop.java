package com.di.indexer.ingest;

import com.di.indexer.checkpoint.CheckpointStore;
import com.di.indexer.config.IndexerProperties;
import com.di.indexer.exception.ErrorCategory;
import com.di.indexer.ledger.LedgerClient;
import com.di.indexer.scan.EventScanner;
import com.di.indexer.scan.ScanWindow;
import com.di.indexer.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded poll loop ({@code indexer-loop}).
 *
 * <pre>
 *   reload processed uids
 *   cursor = startPosition(head), anchored on the first run
 *   loop:
 *     window = scan(cursor, head)
 *     handle window events in order
 *     window complete → advanceCheckpoint(window end), cursor = nextCursor
 *     caught up → wait poll-interval (or shutdown)
 * </pre>
 *
 * Transient ledger, content-store and database errors are logged with their
 * {@link ErrorCategory}, followed by a {@code retry.delay} pause; the same
 * window is scanned again. Stopping lets the in-flight commit finish.
 */
@Slf4j
@Component
public class IngestionLoop implements SmartLifecycle {

    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(60);

    private final LedgerClient          ledger;
    private final EventScanner          scanner;
    private final IngestionOrchestrator orchestrator;
    private final PersistenceCoordinator persistence;
    private final CheckpointStore       checkpoints;
    private final IngestionMetrics      metrics;
    private final IndexerProperties     props;

    private volatile CountDownLatch shutdown = new CountDownLatch(1);
    private volatile Thread         worker;
    private volatile long           cursor = -1;

    public IngestionLoop(LedgerClient ledger,
                         EventScanner scanner,
                         IngestionOrchestrator orchestrator,
                         PersistenceCoordinator persistence,
                         CheckpointStore checkpoints,
                         IngestionMetrics metrics,
                         IndexerProperties props) {
        this.ledger       = ledger;
        this.scanner      = scanner;
        this.orchestrator = orchestrator;
        this.persistence  = persistence;
        this.checkpoints  = checkpoints;
        this.metrics      = metrics;
        this.props        = props;
    }

    /* ==================================================================== */
    /* Lifecycle                                                             */
    /* ==================================================================== */

    @Override
    public synchronized void start() {
        if (worker != null) {
            return;
        }
        shutdown = new CountDownLatch(1);
        Thread t = new Thread(this::run, "indexer-loop");
        t.setDaemon(false);
        worker = t;
        t.start();
        log.info("[LOOP] started (window={} poll={})",
                 props.getScan().getWindowSize(), props.getScan().getPollInterval());
    }

    @Override
    public void stop() {
        Thread t;
        synchronized (this) {
            t = worker;
            if (t == null) {
                return;
            }
            shutdown.countDown();
        }
        try {
            t.join(JOIN_TIMEOUT.toMillis());
            if (t.isAlive()) {
                log.warn("[LOOP] did not stop within {}; interrupting", JOIN_TIMEOUT);
                t.interrupt();
                t.join(JOIN_TIMEOUT.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            synchronized (this) {
                worker = null;
            }
        }
        log.info("[LOOP] stopped at cursor={}", cursor);
    }

    @Override
    public boolean isRunning() {
        Thread t = worker;
        return t != null && t.isAlive();
    }

    @Override
    public boolean isAutoStartup() {
        return !props.isStatsMode();
    }

    /** Stops before the web server and datasource go away. */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1024;
    }

    public long getCursor() {
        return cursor;
    }

    /* ==================================================================== */
    /* Loop                                                                  */
    /* ==================================================================== */

    void run() {
        boolean initialised = false;
        while (!isStopping()) {
            try {
                if (!initialised) {
                    initialise();
                    initialised = true;
                    log.info("[LOOP] resuming at block {}", cursor);
                }
                boolean caughtUp = pollOnce();
                if (caughtUp && await(props.getScan().getPollInterval())) {
                    break;
                }
            } catch (RuntimeException e) {
                ErrorCategory category = ErrorCategory.categorize(e);
                metrics.recordLoopError();
                if (category.isRetryable()) {
                    log.warn("[LOOP] {} at cursor={}: {}; retrying in {}",
                             category.getName(), cursor, e.getMessage(), props.getRetry().getDelay());
                } else {
                    log.error("[LOOP] {} at cursor={}: {}; retrying in {}",
                              category.getName(), cursor, e.getMessage(), props.getRetry().getDelay(), e);
                }
                if (await(props.getRetry().getDelay())) {
                    break;
                }
            }
        }
    }

    /**
     * Scans and ingests one window.
     *
     * @return {@code true} when caught up with head (or the window was not
     *         available), so the caller should wait before polling again
     */
    boolean pollOnce() {
        long head = ledger.currentHead();
        long started = System.currentTimeMillis();
        ScanWindow window = scanner.scan(cursor, head);
        if (!window.available() || !window.advances()) {
            metrics.recordWindow(window.available(), System.currentTimeMillis() - started);
            return true;
        }

        BatchResult result;
        MDC.put(MdcPropagation.WINDOW, window.label());
        try {
            result = orchestrator.handleAll(window.events(), this::isStopping);
        } finally {
            MDC.remove(MdcPropagation.WINDOW);
        }
        for (IngestOutcome outcome : IngestOutcome.values()) {
            if (!outcome.isTerminal() && result.count(outcome) > 0) {
                metrics.recordSkipped(outcome, result.count(outcome));
            }
        }
        if (!result.isComplete()) {
            log.info("[LOOP] window {} interrupted; not checkpointed", window.label());
            return true;
        }

        persistence.advanceCheckpoint(window.toPosition());
        cursor = window.nextCursor();
        metrics.recordCheckpoint(window.toPosition());
        metrics.recordWindow(true, System.currentTimeMillis() - started);
        if (!window.events().isEmpty()) {
            log.info("[LOOP] window {} committed: {}", window.label(), result);
        }
        return cursor > head;
    }

    private boolean isStopping() {
        return shutdown.getCount() == 0 || Thread.currentThread().isInterrupted();
    }

    /** @return {@code true} if shutdown was requested while waiting */
    private boolean await(Duration duration) {
        try {
            return shutdown.await(Math.max(0L, duration.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    /** Reloads the dedup set and positions the cursor from the checkpoint. */
    void initialise() {
        checkpoints.reload();
        long start = checkpoints.startPosition(ledger.currentHead());
        if (!checkpoints.isAnchored()) {
            persistence.advanceCheckpoint(start - 1);
            log.info("[LOOP] no checkpoint; anchored at block {}", start - 1);
        }
        cursor = start;
    }
}
