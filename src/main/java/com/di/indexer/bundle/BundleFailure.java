package com.di.indexer.bundle;

/**
 * Reasons a bundle cannot be ingested. Only {@link #TRANSPORT} is retried.
 */
public enum BundleFailure {

    NOT_A_DIRECTORY("content address is not a directory"),
    MANIFEST_UNAVAILABLE("manifest unavailable"),
    MANIFEST_MALFORMED("manifest malformed"),
    RECORD_STREAM_MALFORMED("record stream malformed"),
    INTEGRITY_MISMATCH("integrity mismatch"),
    OVERSIZED("bundle object exceeds size limit"),
    TRANSPORT("content store unreachable");

    private final String description;

    BundleFailure(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetryable() {
        return this == TRANSPORT;
    }
}
