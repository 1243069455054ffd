package com.di.indexer.ingest;

import com.di.indexer.metadata.CheckpointState;
import com.di.indexer.metadata.ScanRecord;
import com.di.indexer.metadata.Submission;
import com.di.indexer.metadata.SubmissionStatus;
import com.di.indexer.support.Attestations;
import com.di.indexer.support.H2Store;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PersistenceCoordinator Tests")
class PersistenceCoordinatorTest {

    private H2Store h2;
    private PersistenceCoordinator persistence;

    @BeforeEach
    void setUp() {
        h2 = new H2Store();
        persistence = new PersistenceCoordinator(h2.submissions(), h2.records(), h2.checkpoints(), h2.tx());
    }

    @AfterEach
    void tearDown() {
        h2.close();
    }

    private static Submission submission(String uid, SubmissionStatus status) {
        return Submission.builder()
                .uid(uid)
                .submitter(Attestations.ATTESTER)
                .cid("bafyCid")
                .tool("nmap")
                .timestamp(1_700_000_000L)
                .status(status)
                .build();
    }

    private static ScanRecord record(String ip, int port) {
        return ScanRecord.builder()
                .timestamp(1_700_000_000L).ip(ip).port(port).protocol("tcp").state("open")
                .service("ssh").tool("nmap").toolVersion("7.94").options("-sS").vantage("eu-1")
                .build();
    }

    @Test
    @DisplayName("Should commit a completed submission with its records and counters")
    void testCommitCompleted() {
        String uid = Attestations.uid(1);
        persistence.markProcessing(submission(uid, SubmissionStatus.PROCESSING));

        Submission done = submission(uid, SubmissionStatus.COMPLETED);
        done.setProcessedAt(Instant.parse("2024-01-01T00:00:00Z"));
        persistence.commit(done, List.of(record("10.0.0.1", 22), record("10.0.0.2", 80)));

        Submission stored = h2.submissions().findByUid(uid).orElseThrow();
        assertEquals(SubmissionStatus.COMPLETED, stored.getStatus());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), stored.getProcessedAt());
        assertNotNull(stored.getCreatedAt());
        assertEquals(2, h2.records().countBySubmission(uid));

        CheckpointState state = h2.checkpoints().load().orElseThrow();
        assertEquals(uid, state.getLastAttestationUid());
        assertEquals(1, state.getProcessedCount());
        assertEquals(0, state.getErrorCount());
    }

    @Test
    @DisplayName("Failed submissions are counted as errors and keep no records")
    void testCommitFailed() {
        String uid = Attestations.uid(2);
        Submission failed = submission(uid, SubmissionStatus.FAILED);
        failed.setErrorMessage("integrity mismatch: root differs");
        persistence.commit(failed, List.of());

        Submission stored = h2.submissions().findByUid(uid).orElseThrow();
        assertEquals(SubmissionStatus.FAILED, stored.getStatus());
        assertEquals("integrity mismatch: root differs", stored.getErrorMessage());
        assertEquals(0, h2.records().countBySubmission(uid));
        assertEquals(1, h2.checkpoints().load().orElseThrow().getErrorCount());
    }

    @Test
    @DisplayName("A terminal submission is never rewritten")
    void testTerminalIsFinal() {
        String uid = Attestations.uid(3);
        persistence.commit(submission(uid, SubmissionStatus.COMPLETED), List.of(record("10.0.0.1", 22)));

        assertThrows(IllegalStateException.class,
                () -> persistence.commit(submission(uid, SubmissionStatus.FAILED), List.of()));
        assertThrows(IllegalStateException.class,
                () -> persistence.markProcessing(submission(uid, SubmissionStatus.PROCESSING)));

        assertEquals(SubmissionStatus.COMPLETED, h2.submissions().findStatus(uid).orElseThrow());
        assertEquals(1, h2.records().countBySubmission(uid));
        assertEquals(1, h2.checkpoints().load().orElseThrow().getProcessedCount());
    }

    @Test
    @DisplayName("Should reject non-terminal commits and non-processing marks")
    void testStatusPreconditions() {
        String uid = Attestations.uid(4);
        assertThrows(IllegalArgumentException.class,
                () -> persistence.commit(submission(uid, SubmissionStatus.PROCESSING), List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> persistence.markProcessing(submission(uid, SubmissionStatus.PENDING)));
        assertTrue(h2.submissions().findByUid(uid).isEmpty());
    }

    @Test
    @DisplayName("A failed record insert rolls back the whole commit")
    void testCommitIsAtomic() {
        String uid = Attestations.uid(5);
        persistence.markProcessing(submission(uid, SubmissionStatus.PROCESSING));
        List<ScanRecord> broken = Arrays.asList(record("10.0.0.1", 22), null);

        assertThrows(RuntimeException.class,
                () -> persistence.commit(submission(uid, SubmissionStatus.COMPLETED), broken));

        assertEquals(SubmissionStatus.PROCESSING, h2.submissions().findStatus(uid).orElseThrow());
        assertEquals(0, h2.records().countBySubmission(uid));
        assertTrue(h2.checkpoints().load().isEmpty());
    }

    @Test
    @DisplayName("The checkpoint never moves backwards")
    void testCheckpointMonotonic() {
        persistence.advanceCheckpoint(100);
        persistence.advanceCheckpoint(50);
        assertEquals(100, h2.checkpoints().load().orElseThrow().getLastBlock());
        persistence.advanceCheckpoint(150);
        assertEquals(150, h2.checkpoints().load().orElseThrow().getLastBlock());
    }

    @Test
    @DisplayName("Deleting a submission cascades to its records")
    void testDeleteCascades() {
        String uid = Attestations.uid(6);
        persistence.commit(submission(uid, SubmissionStatus.COMPLETED), List.of(record("10.0.0.1", 22)));

        assertTrue(persistence.deleteSubmission(uid));
        assertFalse(persistence.deleteSubmission(uid));
        assertEquals(0, h2.records().count());
    }
}
