package com.di.indexer.support;

import com.di.indexer.bundle.BundleFetcher;
import com.di.indexer.checkpoint.CheckpointStore;
import com.di.indexer.config.IndexerProperties;
import com.di.indexer.ingest.IngestionLoop;
import com.di.indexer.ingest.IngestionMetrics;
import com.di.indexer.ingest.IngestionOrchestrator;
import com.di.indexer.ingest.MetricsSubmissionObserver;
import com.di.indexer.ingest.PersistenceCoordinator;
import com.di.indexer.ingest.SubmissionObserver;
import com.di.indexer.ledger.decode.AttestationDecoderRegistry;
import com.di.indexer.ledger.decode.ScanSubmissionDecoder;
import com.di.indexer.scan.EventScanner;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * The ingestion components wired by hand over fakes and an H2 store, the way
 * the application context wires them.
 */
public final class Pipeline {

    public static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    public final H2Store                h2;
    public final FakeLedgerClient       ledger;
    public final FakeContentStore       store;
    public final IndexerProperties      props;
    public final SimpleMeterRegistry    meters = new SimpleMeterRegistry();
    public final IngestionMetrics       metrics;
    public final CheckpointStore        checkpoints;
    public final PersistenceCoordinator persistence;
    public final IngestionOrchestrator  orchestrator;
    public final IngestionLoop          loop;

    public Pipeline(H2Store h2, FakeLedgerClient ledger, FakeContentStore store,
                    IndexerProperties props, List<SubmissionObserver> extraObservers) {
        this.h2     = h2;
        this.ledger = ledger;
        this.store  = store;
        this.props  = props;

        this.metrics     = new IngestionMetrics(meters);
        this.checkpoints = new CheckpointStore(h2.checkpoints(), h2.submissions(), props);
        this.persistence = new PersistenceCoordinator(h2.submissions(), h2.records(), h2.checkpoints(), h2.tx());

        List<SubmissionObserver> observers = new ArrayList<>();
        observers.add(new MetricsSubmissionObserver(metrics));
        observers.addAll(extraObservers);

        this.orchestrator = new IngestionOrchestrator(
                ledger,
                new AttestationDecoderRegistry(List.of(new ScanSubmissionDecoder(Attestations.SCHEMA))),
                new BundleFetcher(store, new ObjectMapper(), props.getFetch(), props.getRetry()),
                persistence,
                checkpoints,
                observers,
                Clock.fixed(NOW, ZoneOffset.UTC),
                props);
        this.loop = new IngestionLoop(ledger, new EventScanner(ledger, props), orchestrator,
                                      persistence, checkpoints, metrics, props);
    }

    public static Pipeline fresh() {
        return new Pipeline(new H2Store(), new FakeLedgerClient(), new FakeContentStore(),
                            defaultProps(), List.of());
    }

    public static IndexerProperties defaultProps() {
        IndexerProperties props = new IndexerProperties();
        props.getScan().setWindowSize(10);
        props.getScan().setInitialLookback(1000);
        props.getRetry().setMaxRetries(1);
        props.getRetry().setDelay(Duration.ZERO);
        return props;
    }

    /** Same store, ledger and content store; fresh in-memory state, as after a restart. */
    public Pipeline restart() {
        return new Pipeline(h2, ledger, store, props, List.of());
    }

    public void close() {
        orchestrator.close();
        h2.close();
    }
}
