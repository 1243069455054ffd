package com.di.indexer.contentstore;

/**
 * Content-store failure. {@link #isRetryable()} separates transport trouble
 * (connection refused, timeouts, gateway errors) from lookups the node
 * answered definitively (missing path, invalid address).
 */
public class ContentStoreException extends RuntimeException {

    private final boolean retryable;

    public ContentStoreException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ContentStoreException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
