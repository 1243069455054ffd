package com.di.indexer.ingest;

import com.di.indexer.metadata.CheckpointRepository;
import com.di.indexer.metadata.ScanRecord;
import com.di.indexer.metadata.ScanRecordRepository;
import com.di.indexer.metadata.Submission;
import com.di.indexer.metadata.SubmissionRepository;
import com.di.indexer.metadata.SubmissionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Single writer of {@code submissions}, {@code scan_records} and
 * {@code indexer_state}.
 *
 * <ul>
 *   <li>{@link #markProcessing} upserts in its own transaction.</li>
 *   <li>{@link #commit} upserts the terminal submission, replaces its record
 *       set and counts it in the checkpoint, all in one transaction.</li>
 *   <li>{@link #advanceCheckpoint} moves the cursor forward only.</li>
 * </ul>
 *
 * A submission already in a terminal status is never rewritten.
 */
@Slf4j
@Component
public class PersistenceCoordinator {

    private final SubmissionRepository submissionRepo;
    private final ScanRecordRepository recordRepo;
    private final CheckpointRepository checkpointRepo;
    private final TransactionTemplate  tx;

    public PersistenceCoordinator(SubmissionRepository submissionRepo,
                                  ScanRecordRepository recordRepo,
                                  CheckpointRepository checkpointRepo,
                                  TransactionTemplate tx) {
        this.submissionRepo = submissionRepo;
        this.recordRepo     = recordRepo;
        this.checkpointRepo = checkpointRepo;
        this.tx             = tx;
    }

    public void markProcessing(Submission submission) {
        if (submission.getStatus() != SubmissionStatus.PROCESSING) {
            throw new IllegalArgumentException("markProcessing requires status processing, got "
                                               + submission.getStatus());
        }
        tx.executeWithoutResult(status -> {
            requireNotTerminal(submission.getUid());
            submissionRepo.upsert(submission);
        });
        log.debug("[PERSIST] uid={} processing", submission.getUid());
    }

    /**
     * Commits a terminal submission together with its records and the
     * checkpoint counters. Records of a previous attempt are replaced.
     */
    public void commit(Submission submission, List<ScanRecord> records) {
        if (submission.getStatus() == null || !submission.getStatus().isTerminal()) {
            throw new IllegalArgumentException("commit requires a terminal status, got "
                                               + submission.getStatus());
        }
        String uid = submission.getUid();
        tx.executeWithoutResult(status -> {
            requireNotTerminal(uid);
            submissionRepo.upsert(submission);
            recordRepo.deleteBySubmission(uid);
            recordRepo.insertAll(uid, records);
            checkpointRepo.ensureRow();
            checkpointRepo.recordTerminal(uid, submission.getStatus() == SubmissionStatus.FAILED);
        });
        log.info("[PERSIST] uid={} {} records={}", uid, submission.getStatus().dbValue(), records.size());
    }

    /** Removes a submission and, by cascade, its records. */
    public boolean deleteSubmission(String uid) {
        Integer deleted = tx.execute(status -> submissionRepo.delete(uid));
        boolean removed = deleted != null && deleted > 0;
        log.info("[PERSIST] uid={} delete removed={}", uid, removed);
        return removed;
    }

    /** Records that every event up to {@code position} is committed. */
    public void advanceCheckpoint(long position) {
        tx.executeWithoutResult(status -> {
            checkpointRepo.ensureRow();
            checkpointRepo.advanceBlock(position);
        });
        log.debug("[PERSIST] checkpoint advanced to {}", position);
    }

    private void requireNotTerminal(String uid) {
        submissionRepo.findStatus(uid).ifPresent(existing -> {
            if (existing.isTerminal()) {
                throw new IllegalStateException("submission " + uid + " is already " + existing.dbValue());
            }
        });
    }
}
