package com.di.indexer.checkpoint;

import com.di.indexer.config.IndexerProperties;
import com.di.indexer.metadata.Submission;
import com.di.indexer.metadata.SubmissionStatus;
import com.di.indexer.support.Attestations;
import com.di.indexer.support.H2Store;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CheckpointStore Tests")
class CheckpointStoreTest {

    private H2Store h2;
    private IndexerProperties props;
    private CheckpointStore store;

    @BeforeEach
    void setUp() {
        h2 = new H2Store();
        props = new IndexerProperties();
        props.getScan().setInitialLookback(1000);
        store = new CheckpointStore(h2.checkpoints(), h2.submissions(), props);
    }

    @AfterEach
    void tearDown() {
        h2.close();
    }

    private void insert(String uid, SubmissionStatus status) {
        h2.submissions().upsert(Submission.builder().uid(uid).status(status).build());
    }

    @Test
    @DisplayName("Without a checkpoint, start initial-lookback behind head")
    void testStartPositionFresh() {
        assertFalse(store.isAnchored());
        assertEquals(4000, store.startPosition(5000));
        assertEquals(0, store.startPosition(10));
    }

    @Test
    @DisplayName("A row anchored before block 0 resumes at 0 whatever head is")
    void testStartPositionAnchoredAtGenesis() {
        h2.checkpoints().ensureRow();
        assertTrue(store.isAnchored());
        assertEquals(0, store.startPosition(5000));
    }

    @Test
    @DisplayName("With a checkpoint, resume after the last block minus the rescan overlap")
    void testStartPositionResume() {
        h2.checkpoints().ensureRow();
        h2.checkpoints().advanceBlock(250);
        assertEquals(251, store.startPosition(5000));

        props.getScan().setRescanOverlap(20);
        assertEquals(231, store.startPosition(5000));
    }

    @Test
    @DisplayName("Reload seeds the processed set from terminal submissions only")
    void testReload() {
        insert(Attestations.uid(1), SubmissionStatus.COMPLETED);
        insert(Attestations.uid(2), SubmissionStatus.FAILED);
        insert(Attestations.uid(3), SubmissionStatus.PROCESSING);

        assertEquals(2, store.reload());
        assertTrue(store.isProcessed(Attestations.uid(1)));
        assertTrue(store.isProcessed(Attestations.uid(2)));
        assertFalse(store.isProcessed(Attestations.uid(3)));
    }

    @Test
    @DisplayName("A cache miss falls back to the durable status")
    void testIsProcessedFallsBackToStore() {
        store.reload();
        insert(Attestations.uid(4), SubmissionStatus.COMPLETED);

        assertTrue(store.isProcessed(Attestations.uid(4)));
        assertEquals(1, store.processedCount());
    }

    @Test
    @DisplayName("Processed uids compare case-insensitively")
    void testCaseInsensitive() {
        store.markProcessed("0xABCDEF");
        assertTrue(store.isProcessed("0xabcdef"));
        store.forget("0xabcdef");
        assertFalse(store.isProcessed("0xABCDEF"));
    }
}
