package com.di.indexer.ledger;

/**
 * Transport or protocol failure talking to the ledger node. Treated as
 * transient by the ingestion loop.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
