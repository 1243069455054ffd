package com.di.indexer.scan;

import com.di.indexer.config.IndexerProperties;
import com.di.indexer.ledger.AttestationEvent;
import com.di.indexer.ledger.LedgerClient;
import com.di.indexer.ledger.LedgerException;
import com.di.indexer.ledger.LedgerRangeUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns the ledger's event log into bounded, deduplicated windows.
 *
 * <p>Each window reads events through two paths: the filter path (cheap, may
 * miss events) and the range query (authoritative). The union is deduplicated
 * by uid, first occurrence wins, and stably sorted by position.
 *
 * <pre>
 *   window     = [start, min(start + windowSize - 1, head)]
 *   nextCursor = min(start + windowSize, head + 1)
 * </pre>
 *
 * A range the ledger cannot serve yields an empty window whose cursor does not
 * move, so the same range is retried on the next poll.
 */
@Slf4j
@Component
public class EventScanner {

    private final LedgerClient ledger;
    private final int          windowSize;

    public EventScanner(LedgerClient ledger, IndexerProperties props) {
        this.ledger     = ledger;
        this.windowSize = props.getScan().getWindowSize();
    }

    public ScanWindow scan(long start, long head) {
        if (start > head) {
            return ScanWindow.idle(start, head);
        }
        long end = Math.min(start + windowSize - 1, head);

        List<AttestationEvent> filtered;
        List<AttestationEvent> queried;
        try {
            filtered = pollFilter(start, end);
            queried  = ledger.queryEvents(start, end);
        } catch (LedgerRangeUnavailableException e) {
            log.warn("[SCAN] range {}-{} not available yet: {}", start, end, e.getMessage());
            return ScanWindow.unavailable(start, end);
        }

        List<AttestationEvent> events = union(filtered, queried);
        long next = Math.min(start + windowSize, head + 1);
        if (!events.isEmpty()) {
            log.info("[SCAN] window {}-{} events={} (filter={} query={})",
                     start, end, events.size(), filtered.size(), queried.size());
        } else {
            log.debug("[SCAN] window {}-{} empty", start, end);
        }
        return new ScanWindow(start, end, events, next, true);
    }

    public int getWindowSize() {
        return windowSize;
    }

    /** Filter-path failures other than an unavailable range fall back to the range query alone. */
    private List<AttestationEvent> pollFilter(long start, long end) {
        try {
            return ledger.pollFilter(start, end);
        } catch (LedgerRangeUnavailableException e) {
            throw e;
        } catch (LedgerException e) {
            log.warn("[SCAN] filter path failed for {}-{}, using range query only: {}",
                     start, end, e.getMessage());
            return List.of();
        }
    }

    static List<AttestationEvent> union(List<AttestationEvent> first, List<AttestationEvent> second) {
        Map<String, AttestationEvent> byUid = new LinkedHashMap<>();
        for (List<AttestationEvent> source : List.of(first, second)) {
            for (AttestationEvent e : source) {
                byUid.putIfAbsent(e.uid().toLowerCase(Locale.ROOT), e);
            }
        }
        List<AttestationEvent> out = new ArrayList<>(byUid.values());
        out.sort(Comparator.comparingLong(AttestationEvent::position));
        return out;
    }
}
