package com.di.indexer.checkpoint;

import com.di.indexer.config.IndexerProperties;
import com.di.indexer.metadata.CheckpointRepository;
import com.di.indexer.metadata.CheckpointState;
import com.di.indexer.metadata.SubmissionRepository;
import com.di.indexer.metadata.SubmissionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable scan cursor plus the set of attestation uids that reached a terminal
 * status.
 *
 * <p>The in-memory set is a cache of the durable one: it is seeded by
 * {@link #reload()} from {@code submissions} rows in {@code completed} or
 * {@code failed}, and a miss falls back to the store. A row left in
 * {@code processing} by a crash is not terminal and is picked up again when
 * its window is re-scanned.
 *
 * <p>Read-only towards {@code indexer_state}; the cursor and counters move only
 * through {@link com.di.indexer.ingest.PersistenceCoordinator}.
 */
@Slf4j
@Component
public class CheckpointStore {

    private final CheckpointRepository    checkpointRepo;
    private final SubmissionRepository    submissionRepo;
    private final IndexerProperties.Scan  scanConfig;
    private final Set<String>             processed = ConcurrentHashMap.newKeySet();

    public CheckpointStore(CheckpointRepository checkpointRepo,
                           SubmissionRepository submissionRepo,
                           IndexerProperties props) {
        this.checkpointRepo = checkpointRepo;
        this.submissionRepo = submissionRepo;
        this.scanConfig     = props.getScan();
    }

    /** Reloads the processed-uid set from the store; returns its size. */
    public int reload() {
        processed.clear();
        for (String uid : submissionRepo.findUidsByStatus(SubmissionStatus.COMPLETED, SubmissionStatus.FAILED)) {
            processed.add(key(uid));
        }
        log.info("[CHECKPOINT] loaded {} processed uids; cursor={}", processed.size(), state().getLastBlock());
        return processed.size();
    }

    public CheckpointState state() {
        return checkpointRepo.load().orElseGet(CheckpointState::empty);
    }

    /**
     * First block to scan: {@code lastBlock + 1 - rescanOverlap}, or
     * {@code head - initialLookback} when no checkpoint row exists yet; never below 0.
     */
    public long startPosition(long head) {
        Optional<CheckpointState> st = checkpointRepo.load();
        long start = st.isEmpty()
                ? head - scanConfig.getInitialLookback()
                : st.get().getLastBlock() + 1 - scanConfig.getRescanOverlap();
        return Math.max(0L, start);
    }

    /**
     * Whether a checkpoint row exists. The first run anchors one at
     * {@code start - 1} so a restart resumes there instead of re-deriving
     * the start from a later head.
     */
    public boolean isAnchored() {
        return checkpointRepo.load().isPresent();
    }

    public boolean isProcessed(String uid) {
        String key = key(uid);
        if (processed.contains(key)) {
            return true;
        }
        boolean terminal = submissionRepo.findStatus(uid)
                .map(SubmissionStatus::isTerminal)
                .orElse(false);
        if (terminal) {
            processed.add(key);
        }
        return terminal;
    }

    /** Call only after the terminal status is committed. */
    public void markProcessed(String uid) {
        processed.add(key(uid));
    }

    /** Drops a uid so it is ingested again, e.g. after its submission was deleted. */
    public void forget(String uid) {
        processed.remove(key(uid));
    }

    public int processedCount() {
        return processed.size();
    }

    private static String key(String uid) {
        return uid == null ? "" : uid.toLowerCase(Locale.ROOT);
    }
}
