package com.di.indexer.exception;

public class SubmissionNotFoundException extends RuntimeException {

    public SubmissionNotFoundException(String uid) {
        super("submission not found: " + uid);
    }
}
