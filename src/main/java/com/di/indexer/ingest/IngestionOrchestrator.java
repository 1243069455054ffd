package com.di.indexer.ingest;

import com.di.indexer.bundle.BundleException;
import com.di.indexer.bundle.BundleFetcher;
import com.di.indexer.bundle.FetchedBundle;
import com.di.indexer.checkpoint.CheckpointStore;
import com.di.indexer.config.IndexerProperties;
import com.di.indexer.contentstore.ContentStoreException;
import com.di.indexer.ledger.AbiDecodingException;
import com.di.indexer.ledger.Attestation;
import com.di.indexer.ledger.AttestationEvent;
import com.di.indexer.ledger.LedgerClient;
import com.di.indexer.ledger.decode.AttestationDecoder;
import com.di.indexer.ledger.decode.AttestationDecoderRegistry;
import com.di.indexer.ledger.decode.ScanSubmissionPayload;
import com.di.indexer.metadata.ScanRecord;
import com.di.indexer.metadata.Submission;
import com.di.indexer.metadata.SubmissionStatus;
import com.di.indexer.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Drives one attestation event through the submission status machine.
 *
 * <pre>
 *   known terminal uid ────────────────────────────► DUPLICATE
 *   not found / revoked / unknown schema ──────────► IGNORED
 *   attestation or payload undecodable ────────────► failed
 *   decoded ─► processing ─┬─ no content address ──► failed
 *                          ├─ bundle verified ─────► completed
 *                          ├─ content error ───────► failed
 *                          └─ store unreachable ───► stays processing, rethrown
 * </pre>
 *
 * <p>Content problems end in {@code failed} with a reason and are never
 * re-raised. Ledger, database and exhausted content-store transport errors
 * propagate: the window is not checkpointed and the loop retries it.
 *
 * <p>With {@code indexer.fetch.concurrency > 1}, bundles of a window are
 * fetched in parallel in chunks of that size; resolution and commits stay on
 * the calling thread in event order.
 */
@Slf4j
@Service
public class IngestionOrchestrator implements AutoCloseable {

    static final String NO_CONTENT_ADDRESS = "no content address";

    private final LedgerClient               ledger;
    private final AttestationDecoderRegistry decoders;
    private final BundleFetcher              fetcher;
    private final PersistenceCoordinator     persistence;
    private final CheckpointStore            checkpoints;
    private final List<SubmissionObserver>   observers;
    private final Clock                      clock;
    private final int                        concurrency;
    private final ExecutorService            fetchPool;

    public IngestionOrchestrator(LedgerClient ledger,
                                 AttestationDecoderRegistry decoders,
                                 BundleFetcher fetcher,
                                 PersistenceCoordinator persistence,
                                 CheckpointStore checkpoints,
                                 List<SubmissionObserver> observers,
                                 Clock clock,
                                 IndexerProperties props) {
        this.ledger      = ledger;
        this.decoders    = decoders;
        this.fetcher     = fetcher;
        this.persistence = persistence;
        this.checkpoints = checkpoints;
        this.observers   = List.copyOf(observers);
        this.clock       = clock;
        this.concurrency = Math.max(1, props.getFetch().getConcurrency());
        this.fetchPool   = concurrency > 1
                ? Executors.newFixedThreadPool(concurrency, namedThreads("bundle-fetch-"))
                : null;
    }

    /* ==================================================================== */
    /* Entry points                                                          */
    /* ==================================================================== */

    public IngestOutcome handle(AttestationEvent event) {
        return withUid(event.uid(), () -> {
            Begun begun = begin(event);
            if (begun.outcome() != null) {
                return begun.outcome();
            }
            return finish(begun.pending(), fetch(begun.pending()));
        });
    }

    /**
     * Handles a window's events in order. {@code stopRequested} is checked
     * before each chunk; when it fires the result is marked incomplete.
     */
    public BatchResult handleAll(List<AttestationEvent> events, BooleanSupplier stopRequested) {
        BatchResult result = new BatchResult();
        for (int from = 0; from < events.size(); from += concurrency) {
            if (stopRequested.getAsBoolean()) {
                log.info("[INGEST] stop requested; {} of {} events handled", result.handled(), events.size());
                result.markIncomplete();
                return result;
            }
            List<AttestationEvent> chunk = events.subList(from, Math.min(events.size(), from + concurrency));
            if (fetchPool == null || chunk.size() == 1) {
                for (AttestationEvent event : chunk) {
                    result.add(handle(event));
                }
            } else if (!handleChunk(chunk, result)) {
                result.markIncomplete();
                return result;
            }
        }
        return result;
    }

    /* ==================================================================== */
    /* Phases                                                                */
    /* ==================================================================== */

    /** Dedup, resolve, decode and mark processing. */
    private Begun begin(AttestationEvent event) {
        String uid = event.uid();
        if (checkpoints.isProcessed(uid)) {
            log.debug("[INGEST] uid={} already processed", uid);
            return Begun.skipped(IngestOutcome.DUPLICATE);
        }

        Optional<Attestation> resolved;
        try {
            resolved = ledger.resolveAttestation(uid);
        } catch (AbiDecodingException e) {
            log.warn("[INGEST] uid={} attestation undecodable: {}", uid, e.getMessage());
            return Begun.skipped(terminate(Submission.builder().uid(uid).build(), SubmissionStatus.FAILED,
                                           "attestation undecodable: " + e.getMessage(), List.of()));
        }
        if (resolved.isEmpty()) {
            log.warn("[INGEST] uid={} attestation not found; ignored", uid);
            return Begun.skipped(IngestOutcome.IGNORED);
        }
        Attestation attestation = resolved.get();
        if (attestation.revoked()) {
            log.info("[INGEST] uid={} attestation revoked; ignored", uid);
            return Begun.skipped(IngestOutcome.IGNORED);
        }
        Optional<AttestationDecoder<?>> decoder = decoders.find(attestation.schemaId());
        if (decoder.isEmpty()) {
            log.debug("[INGEST] uid={} schema {} not recognised; ignored", uid, attestation.schemaId());
            return Begun.skipped(IngestOutcome.IGNORED);
        }

        Submission submission = Submission.builder()
                .uid(uid)
                .submitter(attestation.attester())
                .timestamp(attestation.timestamp())
                .build();

        Object decoded;
        try {
            decoded = decoder.get().decode(attestation);
        } catch (AbiDecodingException | IllegalArgumentException e) {
            log.warn("[INGEST] uid={} payload undecodable: {}", uid, e.getMessage());
            return Begun.skipped(terminate(submission, SubmissionStatus.FAILED,
                                           "payload decode failed: " + e.getMessage(), List.of()));
        }
        if (!(decoded instanceof ScanSubmissionPayload payload)) {
            log.debug("[INGEST] uid={} decoded to {}; not a scan submission", uid,
                      decoded == null ? "null" : decoded.getClass().getSimpleName());
            return Begun.skipped(IngestOutcome.IGNORED);
        }

        apply(submission, payload);
        submission.setStatus(SubmissionStatus.PROCESSING);
        persistence.markProcessing(submission);
        log.info("[INGEST] uid={} processing cid={} job={}", uid, submission.getCid(), submission.getJobId());
        return new Begun(null, new Pending(submission, payload));
    }

    /**
     * Content failures become a {@link Fetched#error}; a content store still
     * unreachable after the fetcher's retries is rethrown as a retryable
     * {@link ContentStoreException}.
     */
    private Fetched fetch(Pending pending) {
        ScanSubmissionPayload payload = pending.payload();
        if (!payload.hasContentAddress()) {
            return Fetched.failed(NO_CONTENT_ADDRESS);
        }
        try {
            return Fetched.ok(fetcher.fetch(payload.cid(), payload.merkleRoot(), payload.manifestSha256()));
        } catch (BundleException e) {
            if (e.getFailure().isRetryable()) {
                log.warn("[INGEST] uid={} left processing: {}", pending.submission().getUid(), e.getMessage());
                throw new ContentStoreException(e.getMessage(), e, true);
            }
            log.warn("[INGEST] uid={} bundle rejected ({}): {}",
                     pending.submission().getUid(), e.getFailure(), e.getMessage());
            return Fetched.failed(e.getMessage());
        } catch (RuntimeException e) {
            log.error("[INGEST] uid={} unexpected bundle error: {}", pending.submission().getUid(), e.toString(), e);
            return Fetched.failed("bundle processing error: " + e);
        }
    }

    private IngestOutcome finish(Pending pending, Fetched fetched) {
        Submission submission = pending.submission();
        if (fetched.error() != null) {
            return terminate(submission, SubmissionStatus.FAILED, fetched.error(), List.of());
        }
        FetchedBundle bundle = fetched.bundle();
        submission.setManifestSha256(bundle.manifestSha256());
        return terminate(submission, SubmissionStatus.COMPLETED, null, bundle.records());
    }

    private IngestOutcome terminate(Submission submission, SubmissionStatus status,
                                    String error, List<ScanRecord> records) {
        submission.setStatus(status);
        submission.setErrorMessage(error);
        submission.setProcessedAt(clock.instant());
        persistence.commit(submission, records);
        checkpoints.markProcessed(submission.getUid());
        notifyObservers(submission, records.size());
        if (status == SubmissionStatus.COMPLETED) {
            log.info("[INGEST] uid={} completed records={}", submission.getUid(), records.size());
            return IngestOutcome.COMPLETED;
        }
        log.warn("[INGEST] uid={} failed: {}", submission.getUid(), error);
        return IngestOutcome.FAILED;
    }

    private void notifyObservers(Submission submission, int recordCount) {
        for (SubmissionObserver observer : observers) {
            try {
                observer.onTerminal(submission, recordCount);
            } catch (RuntimeException e) {
                log.error("[INGEST] uid={} observer {} failed: {}", submission.getUid(),
                          observer.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    /* ==================================================================== */
    /* Parallel prefetch                                                     */
    /* ==================================================================== */

    /** @return {@code false} if interrupted before the chunk was committed */
    private boolean handleChunk(List<AttestationEvent> chunk, BatchResult result) {
        List<Pending>           pendings = new ArrayList<>();
        List<Future<Fetched>>   futures  = new ArrayList<>();
        for (AttestationEvent event : chunk) {
            Begun begun = withUid(event.uid(), () -> begin(event));
            if (begun.outcome() != null) {
                result.add(begun.outcome());
                continue;
            }
            Pending pending = begun.pending();
            pendings.add(pending);
            futures.add(fetchPool.submit(MdcPropagation.wrapCallable(
                    () -> withUid(pending.submission().getUid(), () -> fetch(pending)))));
        }
        for (int i = 0; i < pendings.size(); i++) {
            Pending pending = pendings.get(i);
            Fetched fetched;
            try {
                fetched = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                log.warn("[INGEST] interrupted while waiting for bundle fetches");
                return false;
            } catch (ExecutionException e) {
                if (e.getCause() instanceof ContentStoreException unreachable) {
                    futures.forEach(f -> f.cancel(true));
                    throw unreachable;
                }
                fetched = Fetched.failed("bundle processing error: " + e.getCause());
            }
            Fetched outcome = fetched;
            result.add(withUid(pending.submission().getUid(), () -> finish(pending, outcome)));
        }
        return true;
    }

    @Override
    public void close() {
        if (fetchPool == null) {
            return;
        }
        fetchPool.shutdown();
        try {
            if (!fetchPool.awaitTermination(30, TimeUnit.SECONDS)) {
                fetchPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            fetchPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /* ==================================================================== */
    /* Helpers                                                               */
    /* ==================================================================== */

    private static void apply(Submission s, ScanSubmissionPayload p) {
        s.setJobId(p.jobId());
        s.setNamespace(p.namespace());
        s.setDatasetType(p.datasetType());
        s.setCid(p.cid());
        s.setMerkleRoot(p.merkleRoot());
        s.setTargetSpecCid(p.targetSpecCid());
        s.setStartedAt(p.startedAt());
        s.setFinishedAt(p.finishedAt());
        s.setTool(p.tool());
        s.setToolVersion(p.toolVersion());
        s.setVantage(p.vantage());
        s.setManifestSha256(p.manifestSha256());
        s.setExtra(p.extra());
    }

    private static <T> T withUid(String uid, Supplier<T> body) {
        return MdcPropagation.callWith(MdcPropagation.UID, uid, body);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record Pending(Submission submission, ScanSubmissionPayload payload) {
    }

    private record Begun(IngestOutcome outcome, Pending pending) {
        static Begun skipped(IngestOutcome outcome) {
            return new Begun(outcome, null);
        }
    }

    private record Fetched(FetchedBundle bundle, String error) {
        static Fetched ok(FetchedBundle bundle) {
            return new Fetched(bundle, null);
        }

        static Fetched failed(String error) {
            return new Fetched(null, error);
        }
    }
}
