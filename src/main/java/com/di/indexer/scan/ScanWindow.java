package com.di.indexer.scan;

import com.di.indexer.ledger.AttestationEvent;

import java.util.List;

/**
 * Result of scanning {@code [fromPosition, toPosition]}.
 *
 * @param events     deduplicated by uid, ascending position
 * @param nextCursor first position of the next window; equals {@code fromPosition}
 *                   when the window was not scanned
 * @param available  {@code false} when the ledger could not serve the range
 */
public record ScanWindow(long fromPosition,
                         long toPosition,
                         List<AttestationEvent> events,
                         long nextCursor,
                         boolean available) {

    public static ScanWindow idle(long start, long head) {
        return new ScanWindow(start, head, List.of(), start, true);
    }

    public static ScanWindow unavailable(long from, long to) {
        return new ScanWindow(from, to, List.of(), from, false);
    }

    /** {@code true} when the cursor moves forward once this window is committed. */
    public boolean advances() {
        return nextCursor > fromPosition;
    }

    public String label() {
        return fromPosition + "-" + toPosition;
    }
}
