package com.di.indexer.bundle;

import com.di.indexer.metadata.ScanRecord;

import java.util.List;
import java.util.Map;

/**
 * A bundle that passed verification.
 *
 * @param manifestSha256 {@code 0x}-hex SHA-256 of the raw manifest bytes
 * @param streamDigest   canonical digest of the record stream
 * @param artifacts      auxiliary artifacts that could be fetched, keyed by path
 */
public record FetchedBundle(
        String                 cid,
        BundleManifest         manifest,
        String                 manifestSha256,
        String                 streamDigest,
        List<ScanRecord>       records,
        Map<String, byte[]>    artifacts) {
}
