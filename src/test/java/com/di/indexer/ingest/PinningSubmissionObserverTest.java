package com.di.indexer.ingest;

import com.di.indexer.metadata.Submission;
import com.di.indexer.metadata.SubmissionStatus;
import com.di.indexer.support.FakeContentStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PinningSubmissionObserver Tests")
class PinningSubmissionObserverTest {

    private final FakeContentStore          store    = new FakeContentStore();
    private final PinningSubmissionObserver observer = new PinningSubmissionObserver(store);

    @Test
    @DisplayName("Completed submissions have their bundle pinned")
    void testPinsCompleted() {
        observer.onTerminal(Submission.builder().uid("0x01").cid("bafyok").status(SubmissionStatus.COMPLETED).build(), 3);
        assertEquals(List.of("bafyok"), store.pinned());
    }

    @Test
    @DisplayName("Failed submissions are not pinned")
    void testSkipsFailed() {
        observer.onTerminal(Submission.builder().uid("0x02").cid("bafybad").status(SubmissionStatus.FAILED).build(), 0);
        assertTrue(store.pinned().isEmpty());
    }
}
