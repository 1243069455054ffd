package com.di.indexer.ingest;

/**
 * What handling one attestation event did.
 */
public enum IngestOutcome {

    /** uid already reached a terminal status; nothing written. */
    DUPLICATE,
    /** Not found, revoked, or not a recognised schema; nothing written. */
    IGNORED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
