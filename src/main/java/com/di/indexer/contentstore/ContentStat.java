package com.di.indexer.contentstore;

/**
 * Object metadata as reported by the content store.
 */
public record ContentStat(String hash, int numLinks, long cumulativeSize) {

    public boolean isDirectory() {
        return numLinks > 0;
    }
}
