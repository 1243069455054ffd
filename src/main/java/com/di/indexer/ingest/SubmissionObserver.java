package com.di.indexer.ingest;

import com.di.indexer.metadata.Submission;

/**
 * Notified synchronously after a submission's terminal status is committed.
 * Exceptions are logged by the caller and never affect ingestion.
 */
public interface SubmissionObserver {

    void onTerminal(Submission submission, int recordCount);
}
