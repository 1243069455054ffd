package com.di.indexer.ledger;

/** Thrown when ABI-encoded ledger data does not match the expected layout. */
public class AbiDecodingException extends RuntimeException {

    public AbiDecodingException(String message) {
        super(message);
    }

    public AbiDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
