package com.di.indexer.ledger;

/**
 * The requested block range is momentarily not served by the node (block not
 * found, header not yet available). The scanner reports "no events this round".
 */
public class LedgerRangeUnavailableException extends LedgerException {

    public LedgerRangeUnavailableException(String message) {
        super(message);
    }
}
