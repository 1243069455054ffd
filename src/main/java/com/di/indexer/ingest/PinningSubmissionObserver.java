package com.di.indexer.ingest;

import com.di.indexer.contentstore.ContentStore;
import com.di.indexer.metadata.Submission;
import com.di.indexer.metadata.SubmissionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Pins the bundle of every completed submission on the local content-store node.
 * Enabled with {@code indexer.content-store.pin-completed=true}.
 */
@Slf4j
@Component
@Order(10)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "indexer.content-store", name = "pin-completed", havingValue = "true")
public class PinningSubmissionObserver implements SubmissionObserver {

    private final ContentStore contentStore;

    @Override
    public void onTerminal(Submission submission, int recordCount) {
        if (submission.getStatus() != SubmissionStatus.COMPLETED) {
            return;
        }
        contentStore.pin(submission.getCid());
        log.debug("[INGEST] uid={} pinned cid={}", submission.getUid(), submission.getCid());
    }
}
