package com.di.indexer.ingest;

import com.di.indexer.metadata.Submission;
import com.di.indexer.metadata.SubmissionStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(0)
@RequiredArgsConstructor
public class MetricsSubmissionObserver implements SubmissionObserver {

    private final IngestionMetrics metrics;

    @Override
    public void onTerminal(Submission submission, int recordCount) {
        metrics.recordTerminal(submission.getStatus() == SubmissionStatus.COMPLETED, recordCount);
    }
}
