package com.di.indexer.bundle;

/**
 * Bundle fetch/verification failure; the message is what gets recorded as
 * the submission's error.
 */
public class BundleException extends RuntimeException {

    private final BundleFailure failure;

    public BundleException(BundleFailure failure, String detail) {
        super(failure.getDescription() + ": " + detail);
        this.failure = failure;
    }

    public BundleException(BundleFailure failure, String detail, Throwable cause) {
        super(failure.getDescription() + ": " + detail, cause);
        this.failure = failure;
    }

    public BundleFailure getFailure() {
        return failure;
    }
}
