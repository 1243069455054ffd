package com.di.indexer.contentstore;

/**
 * Content-addressed store holding submission bundles.
 *
 * <p>Addresses are either a bare content id or {@code <cid>/<path>} inside a
 * directory object.
 */
public interface ContentStore {

    ContentStat stat(String address);

    /**
     * Reads the object at {@code address}.
     *
     * @throws ContentTooLargeException when the object exceeds {@code maxBytes}
     * @throws ContentStoreException    on transport or lookup failure
     */
    byte[] fetch(String address, long maxBytes);

    void pin(String address);

    /** Version string reported by the node; used as a reachability probe. */
    String version();
}
