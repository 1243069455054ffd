package com.di.indexer.ingest;

import com.di.indexer.bundle.ScanprintDigest;
import com.di.indexer.contentstore.ContentStoreException;
import com.di.indexer.ledger.AttestationEvent;
import com.di.indexer.metadata.CheckpointState;
import com.di.indexer.metadata.Submission;
import com.di.indexer.metadata.SubmissionStatus;
import com.di.indexer.support.AbiEncoder;
import com.di.indexer.support.Attestations;
import com.di.indexer.support.Bundles;
import com.di.indexer.support.FakeContentStore;
import com.di.indexer.support.FakeLedgerClient;
import com.di.indexer.support.H2Store;
import com.di.indexer.support.Pipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IngestionOrchestrator Tests")
class IngestionOrchestratorTest {

    private static final String CID = "bafyBundle";

    private Pipeline p;

    @BeforeEach
    void setUp() {
        p = Pipeline.fresh();
    }

    @AfterEach
    void tearDown() {
        p.close();
    }

    private AttestationEvent attestValid(int n, String cid, int records) {
        String uid = Attestations.uid(n);
        Bundles.Stored stored = Bundles.store(p.store, cid, Bundles.records(records));
        p.ledger.attest(Attestations.scanSubmission(uid, cid, stored.streamDigest(), stored.manifestSha256()));
        return Attestations.event(uid, 10 + n);
    }

    // ============================================================================
    // Terminal outcomes
    // ============================================================================

    @Test
    @DisplayName("A valid bundle completes with all its records")
    void testCompleted() {
        AttestationEvent event = attestValid(1, CID, 3);

        assertEquals(IngestOutcome.COMPLETED, p.orchestrator.handle(event));

        Submission s = p.h2.submissions().findByUid(event.uid()).orElseThrow();
        assertEquals(SubmissionStatus.COMPLETED, s.getStatus());
        assertNull(s.getErrorMessage());
        assertEquals(Pipeline.NOW, s.getProcessedAt());
        assertEquals(CID, s.getCid());
        assertEquals("acme", s.getNamespace());
        assertEquals(Attestations.ATTESTER, s.getSubmitter());
        assertEquals(3, p.h2.records().countBySubmission(event.uid()));

        CheckpointState state = p.h2.checkpoints().load().orElseThrow();
        assertEquals(event.uid(), state.getLastAttestationUid());
        assertEquals(1, state.getProcessedCount());
        assertTrue(p.checkpoints.isProcessed(event.uid()));
        assertEquals(1.0, p.meters.counter("indexer.submissions.total", "status", "completed").count());
    }

    @Test
    @DisplayName("A tampered stream fails with an integrity mismatch and stores no records")
    void testTamperedStream() {
        AttestationEvent event = attestValid(2, CID, 3);
        List<String> lines = new ArrayList<>(Bundles.records(3));
        lines.set(0, Bundles.record("192.0.2.1", 3389, "open", "rdp"));
        p.store.put(CID + "/" + Bundles.STREAM_PATH, Bundles.stream(lines).getBytes(StandardCharsets.UTF_8));

        assertEquals(IngestOutcome.FAILED, p.orchestrator.handle(event));

        Submission s = p.h2.submissions().findByUid(event.uid()).orElseThrow();
        assertEquals(SubmissionStatus.FAILED, s.getStatus());
        assertTrue(s.getErrorMessage().startsWith("integrity mismatch"), s.getErrorMessage());
        assertEquals(0, p.h2.records().countBySubmission(event.uid()));
        assertEquals(1, p.h2.checkpoints().load().orElseThrow().getErrorCount());
    }

    @Test
    @DisplayName("An empty content address fails without touching the content store")
    void testNoContentAddress() {
        String uid = Attestations.uid(3);
        p.ledger.attest(Attestations.scanSubmission(uid, "", "", ""));

        assertEquals(IngestOutcome.FAILED, p.orchestrator.handle(Attestations.event(uid, 13)));

        Submission s = p.h2.submissions().findByUid(uid).orElseThrow();
        assertEquals(SubmissionStatus.FAILED, s.getStatus());
        assertEquals(IngestionOrchestrator.NO_CONTENT_ADDRESS, s.getErrorMessage());
        assertTrue(p.store.fetched().isEmpty());
    }

    @Test
    @DisplayName("An undecodable payload of a recognised schema is recorded as failed")
    void testDecodeFailure() {
        String uid = Attestations.uid(4);
        p.ledger.attest(Attestations.attestation(uid, Attestations.SCHEMA, new byte[40], false));

        assertEquals(IngestOutcome.FAILED, p.orchestrator.handle(Attestations.event(uid, 14)));

        Submission s = p.h2.submissions().findByUid(uid).orElseThrow();
        assertEquals(SubmissionStatus.FAILED, s.getStatus());
        assertTrue(s.getErrorMessage().startsWith("payload decode failed"));
    }

    @Test
    @DisplayName("An attestation the ledger returns malformed is recorded as failed")
    void testUndecodableAttestation() {
        String uid = Attestations.uid(10);
        p.ledger.undecodable(uid);

        assertEquals(IngestOutcome.FAILED, p.orchestrator.handle(Attestations.event(uid, 20)));

        Submission s = p.h2.submissions().findByUid(uid).orElseThrow();
        assertEquals(SubmissionStatus.FAILED, s.getStatus());
        assertTrue(s.getErrorMessage().startsWith("attestation undecodable"), s.getErrorMessage());
    }

    @Test
    @DisplayName("An unreachable content store leaves the submission processing and is rethrown")
    void testContentStoreUnreachable() {
        AttestationEvent event = attestValid(11, CID, 2);
        p.store.failNext(CID, new ContentStoreException("stat timeout", true))
               .failNext(CID, new ContentStoreException("stat timeout", true));

        assertThrows(ContentStoreException.class, () -> p.orchestrator.handle(event));

        assertEquals(SubmissionStatus.PROCESSING, p.h2.submissions().findStatus(event.uid()).orElseThrow());
        assertFalse(p.checkpoints.isProcessed(event.uid()));
        assertEquals(IngestOutcome.COMPLETED, p.orchestrator.handle(event));
    }

    // ============================================================================
    // Skipped events
    // ============================================================================

    @Test
    @DisplayName("A second delivery of a processed uid is a no-op")
    void testDuplicate() {
        AttestationEvent event = attestValid(5, CID, 2);
        p.orchestrator.handle(event);
        int resolves = p.ledger.resolveCalls();

        assertEquals(IngestOutcome.DUPLICATE, p.orchestrator.handle(event));

        assertEquals(resolves, p.ledger.resolveCalls());
        assertEquals(2, p.h2.records().countBySubmission(event.uid()));
        assertEquals(1, p.h2.checkpoints().load().orElseThrow().getProcessedCount());
    }

    @Test
    @DisplayName("Unknown schemas, revoked and missing attestations are ignored without writes")
    void testIgnored() {
        String unknown = Attestations.uid(6);
        String revoked = Attestations.uid(7);
        String missing = Attestations.uid(8);
        p.ledger.attest(Attestations.attestation(unknown, AbiEncoder.word(0x77),
                                                 Attestations.payload(CID, "", ""), false));
        p.ledger.attest(Attestations.attestation(revoked, Attestations.SCHEMA,
                                                 Attestations.payload(CID, "", ""), true));

        assertEquals(IngestOutcome.IGNORED, p.orchestrator.handle(Attestations.event(unknown, 16)));
        assertEquals(IngestOutcome.IGNORED, p.orchestrator.handle(Attestations.event(revoked, 17)));
        assertEquals(IngestOutcome.IGNORED, p.orchestrator.handle(Attestations.event(missing, 18)));

        assertEquals(0, p.h2.submissions().count());
        assertTrue(p.h2.checkpoints().load().isEmpty());
    }

    // ============================================================================
    // Observers and batches
    // ============================================================================

    @Test
    @DisplayName("A failing observer does not affect ingestion or later observers")
    void testObserverIsolation() {
        List<String> seen = new ArrayList<>();
        SubmissionObserver broken = (s, n) -> {
            throw new IllegalStateException("observer down");
        };
        SubmissionObserver recording = (s, n) -> seen.add(s.getUid() + ":" + n);
        p.close();
        p = new Pipeline(new H2Store(), new FakeLedgerClient(), new FakeContentStore(),
                         Pipeline.defaultProps(), List.of(broken, recording));
        AttestationEvent event = attestValid(9, CID, 2);

        assertEquals(IngestOutcome.COMPLETED, p.orchestrator.handle(event));

        assertEquals(List.of(event.uid() + ":2"), seen);
        assertEquals(SubmissionStatus.COMPLETED, p.h2.submissions().findStatus(event.uid()).orElseThrow());
    }

    @Test
    @DisplayName("Parallel prefetch keeps commit order and outcomes")
    void testConcurrentFetch() {
        p.close();
        var props = Pipeline.defaultProps();
        props.getFetch().setConcurrency(3);
        p = new Pipeline(new H2Store(), new FakeLedgerClient(), new FakeContentStore(), props, List.of());

        List<AttestationEvent> events = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            events.add(attestValid(i, "bafy" + i, i));
        }
        String ignored = Attestations.uid(42);
        events.add(2, Attestations.event(ignored, 12));

        BatchResult result = p.orchestrator.handleAll(events, () -> false);

        assertTrue(result.isComplete());
        assertEquals(5, result.count(IngestOutcome.COMPLETED));
        assertEquals(1, result.count(IngestOutcome.IGNORED));
        assertEquals(1 + 2 + 3 + 4 + 5, p.h2.records().count());
        assertEquals(events.get(events.size() - 1).uid(),
                     p.h2.checkpoints().load().orElseThrow().getLastAttestationUid());
    }

    @Test
    @DisplayName("Parallel prefetch rethrows an unreachable content store")
    void testConcurrentFetchStoreUnreachable() {
        p.close();
        var props = Pipeline.defaultProps();
        props.getFetch().setConcurrency(2);
        p = new Pipeline(new H2Store(), new FakeLedgerClient(), new FakeContentStore(), props, List.of());
        AttestationEvent first = attestValid(1, "bafy1", 1);
        AttestationEvent second = attestValid(2, "bafy2", 1);
        p.store.failNext("bafy2", new ContentStoreException("503", true))
               .failNext("bafy2", new ContentStoreException("503", true));

        assertThrows(ContentStoreException.class,
                     () -> p.orchestrator.handleAll(List.of(first, second), () -> false));

        assertEquals(SubmissionStatus.COMPLETED, p.h2.submissions().findStatus(first.uid()).orElseThrow());
        assertEquals(SubmissionStatus.PROCESSING, p.h2.submissions().findStatus(second.uid()).orElseThrow());
    }

    @Test
    @DisplayName("A stop request leaves the batch incomplete")
    void testStopRequested() {
        AttestationEvent event = attestValid(1, CID, 1);
        BatchResult result = p.orchestrator.handleAll(List.of(event), () -> true);
        assertFalse(result.isComplete());
        assertEquals(0, result.handled());
        assertTrue(p.h2.submissions().findByUid(event.uid()).isEmpty());
    }

    @Test
    @DisplayName("The stored manifest digest is the one computed from the fetched bytes")
    void testManifestDigestStored() {
        AttestationEvent event = attestValid(10, CID, 1);
        p.orchestrator.handle(event);
        byte[] manifest = p.store.fetch(CID + "/manifest.json", Long.MAX_VALUE);
        assertEquals(ScanprintDigest.sha256Hex(manifest),
                     p.h2.submissions().findByUid(event.uid()).orElseThrow().getManifestSha256());
    }
}
