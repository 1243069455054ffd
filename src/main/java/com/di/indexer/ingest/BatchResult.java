package com.di.indexer.ingest;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome counts for a window of events.
 *
 * <p>{@code complete} is {@code false} when handling stopped early (shutdown),
 * in which case the window must not be checkpointed.
 */
public final class BatchResult {

    private final Map<IngestOutcome, Integer> outcomes = new EnumMap<>(IngestOutcome.class);
    private boolean complete = true;

    void add(IngestOutcome outcome) {
        outcomes.merge(outcome, 1, Integer::sum);
    }

    void markIncomplete() {
        this.complete = false;
    }

    public int count(IngestOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    public int handled() {
        return outcomes.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean isComplete() {
        return complete;
    }

    public Map<IngestOutcome, Integer> outcomes() {
        return Collections.unmodifiableMap(outcomes);
    }

    @Override
    public String toString() {
        return "BatchResult" + outcomes + (complete ? "" : " (stopped early)");
    }
}
