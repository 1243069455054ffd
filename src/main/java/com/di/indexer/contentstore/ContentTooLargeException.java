package com.di.indexer.contentstore;

import lombok.Getter;

@Getter
public class ContentTooLargeException extends ContentStoreException {

    private final String address;
    private final long   maxBytes;

    public ContentTooLargeException(String address, long maxBytes) {
        super("object " + address + " exceeds " + maxBytes + " bytes", false);
        this.address  = address;
        this.maxBytes = maxBytes;
    }
}
