package com.di.indexer.bundle;

import com.di.indexer.config.IndexerProperties;
import com.di.indexer.contentstore.ContentStat;
import com.di.indexer.contentstore.ContentStore;
import com.di.indexer.contentstore.ContentStoreException;
import com.di.indexer.contentstore.ContentTooLargeException;
import com.di.indexer.metadata.ScanRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Fetches a submission bundle from the content store and verifies it.
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li>{@code stat(cid)}: the address must be a directory.</li>
 *   <li>Fetch and parse {@code cid/manifest.json}.</li>
 *   <li>Fetch {@code cid/<scanprint.path>} and parse every JSON line; one bad
 *       line rejects the whole stream.</li>
 *   <li>Recompute the stream digest and compare it to the manifest's declared
 *       root and the attested root; compare the attested manifest digest to the
 *       SHA-256 of the manifest bytes.</li>
 *   <li>Fetch auxiliary artifacts best-effort.</li>
 * </ol>
 *
 * <p>Every read is bounded by {@code indexer.fetch.max-bundle-size}. Retryable
 * content-store failures are retried {@code indexer.retry.max-retries} times,
 * {@code indexer.retry.delay} apart.
 */
@Slf4j
public class BundleFetcher {

    static final String MANIFEST_PATH = "manifest.json";

    private final ContentStore            store;
    private final ObjectMapper            om;
    private final IndexerProperties.Fetch fetchConfig;
    private final IndexerProperties.Retry retryConfig;

    public BundleFetcher(ContentStore store,
                         ObjectMapper om,
                         IndexerProperties.Fetch fetchConfig,
                         IndexerProperties.Retry retryConfig) {
        this.store       = store;
        this.om          = om;
        this.fetchConfig = fetchConfig;
        this.retryConfig = retryConfig;
    }

    /**
     * @param attestedRoot           root carried by the attestation, {@code ""} if absent
     * @param attestedManifestDigest manifest SHA-256 carried by the attestation, {@code ""} if absent
     * @throws BundleException on any failure; never partially succeeds
     */
    public FetchedBundle fetch(String cid, String attestedRoot, String attestedManifestDigest) {
        long maxBytes = fetchConfig.getMaxBundleSize();

        // 1. directory check
        ContentStat stat;
        try {
            stat = withRetry("stat " + cid, () -> store.stat(cid));
        } catch (ContentStoreException e) {
            throw new BundleException(BundleFailure.MANIFEST_UNAVAILABLE,
                    "cannot resolve " + cid + ": " + e.getMessage(), e);
        }
        if (!stat.isDirectory()) {
            throw new BundleException(BundleFailure.NOT_A_DIRECTORY, cid);
        }

        // 2. manifest
        byte[] manifestBytes = read(cid + "/" + MANIFEST_PATH, maxBytes, BundleFailure.MANIFEST_UNAVAILABLE);
        BundleManifest manifest = parseManifest(cid, manifestBytes);
        String streamPath = manifest.getScanprint().getPath();

        // 3. record stream
        byte[] streamBytes = read(cid + "/" + streamPath, maxBytes, BundleFailure.RECORD_STREAM_MALFORMED);
        String stream = decodeUtf8(cid, streamPath, streamBytes);
        List<ScanRecord> records = parseRecords(cid, streamPath, stream);

        // 4. integrity
        String digest = ScanprintDigest.compute(stream);
        verifyRoot("manifest root", manifest.getScanprint().getMerkleRoot(), digest, cid);
        verifyRoot("attested root", attestedRoot, digest, cid);

        String manifestSha256 = ScanprintDigest.sha256Hex(manifestBytes);
        if (isPresent(attestedManifestDigest)
                && !ScanprintDigest.matches(attestedManifestDigest, manifestSha256)) {
            throw new BundleException(BundleFailure.INTEGRITY_MISMATCH,
                    "manifest digest expected " + attestedManifestDigest + ", got " + manifestSha256);
        }

        // 5. auxiliary artifacts
        Map<String, byte[]> artifacts = fetchArtifacts(cid, manifest, maxBytes);

        log.info("[BUNDLE] cid={} verified: records={} digest={} artifacts={}",
                 cid, records.size(), digest, artifacts.size());
        return new FetchedBundle(cid, manifest, manifestSha256, digest,
                                 Collections.unmodifiableList(records),
                                 Collections.unmodifiableMap(artifacts));
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    private BundleManifest parseManifest(String cid, byte[] bytes) {
        BundleManifest manifest;
        try {
            manifest = om.readValue(bytes, BundleManifest.class);
        } catch (IOException e) {
            throw new BundleException(BundleFailure.MANIFEST_MALFORMED,
                    cid + "/" + MANIFEST_PATH + ": " + e.getMessage(), e);
        }
        if (manifest == null) {
            throw new BundleException(BundleFailure.MANIFEST_MALFORMED, cid + ": empty manifest");
        }
        String missing = manifest.missingRequiredField();
        if (missing != null) {
            throw new BundleException(BundleFailure.MANIFEST_MALFORMED, cid + ": missing " + missing);
        }
        String path = manifest.getScanprint().getPath();
        if (!isSafeRelativePath(path)) {
            throw new BundleException(BundleFailure.MANIFEST_MALFORMED,
                    cid + ": invalid scanprint path '" + path + "'");
        }
        return manifest;
    }

    private List<ScanRecord> parseRecords(String cid, String path, String stream) {
        List<ScanRecord> records = new ArrayList<>();
        int lineNo = 0;
        for (String line : stream.split("\n", -1)) {
            lineNo++;
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            ScanRecord record;
            try {
                record = om.readValue(trimmed, ScanRecord.class);
            } catch (JsonProcessingException e) {
                throw new BundleException(BundleFailure.RECORD_STREAM_MALFORMED,
                        cid + "/" + path + " line " + lineNo + ": " + e.getOriginalMessage(), e);
            }
            String missing = record == null ? "record" : record.missingRequiredField();
            if (missing != null) {
                throw new BundleException(BundleFailure.RECORD_STREAM_MALFORMED,
                        cid + "/" + path + " line " + lineNo + ": missing " + missing);
            }
            records.add(record);
        }
        return records;
    }

    private void verifyRoot(String label, String declared, String digest, String cid) {
        if (!isPresent(declared)) {
            return;
        }
        if (!ScanprintDigest.matches(declared, digest)) {
            throw new BundleException(BundleFailure.INTEGRITY_MISMATCH,
                    cid + " " + label + " expected " + declared + ", got "
                    + (digest.isEmpty() ? "<empty stream>" : digest));
        }
    }

    private Map<String, byte[]> fetchArtifacts(String cid, BundleManifest manifest, long maxBytes) {
        Map<String, byte[]> out = new LinkedHashMap<>();
        if (manifest.getArtifacts() == null) {
            return out;
        }
        String streamPath = manifest.getScanprint().getPath();
        for (BundleManifest.Artifact artifact : manifest.getArtifacts()) {
            String path = artifact == null ? null : artifact.getPath();
            if (!isSafeRelativePath(path) || path.equals(streamPath) || path.equals(MANIFEST_PATH)) {
                continue;
            }
            try {
                byte[] bytes = withRetry("cat " + cid + "/" + path, () -> store.fetch(cid + "/" + path, maxBytes));
                if (isPresent(artifact.getSha256())
                        && !ScanprintDigest.matches(artifact.getSha256(), ScanprintDigest.sha256Hex(bytes))) {
                    log.warn("[BUNDLE] cid={} artifact {} sha256 mismatch; skipped", cid, path);
                    continue;
                }
                out.put(path, bytes);
            } catch (ContentStoreException | BundleException e) {
                log.warn("[BUNDLE] cid={} artifact {} not fetched: {}", cid, path, e.getMessage());
            }
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Transport
    // ------------------------------------------------------------------

    /** Bounded read mapping definitive store failures to {@code unavailable}. */
    private byte[] read(String address, long maxBytes, BundleFailure unavailable) {
        try {
            return withRetry("cat " + address, () -> store.fetch(address, maxBytes));
        } catch (ContentTooLargeException e) {
            throw new BundleException(BundleFailure.OVERSIZED, address + " > " + maxBytes + " bytes", e);
        } catch (ContentStoreException e) {
            throw new BundleException(unavailable, address + ": " + e.getMessage(), e);
        }
    }

    /**
     * Runs {@code call}, retrying retryable {@link ContentStoreException}s.
     * Exhaustion raises {@link BundleFailure#TRANSPORT}; non-retryable store
     * failures propagate to the caller.
     */
    <T> T withRetry(String what, Supplier<T> call) {
        int attempts = retryConfig.getMaxRetries() + 1;
        ContentStoreException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return call.get();
            } catch (ContentStoreException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                last = e;
                log.warn("[BUNDLE] {} failed (attempt {}/{}): {}", what, attempt, attempts, e.getMessage());
                if (attempt < attempts) {
                    pause(retryConfig.getDelay(), what);
                }
            }
        }
        throw new BundleException(BundleFailure.TRANSPORT,
                what + " after " + attempts + " attempts: " + last.getMessage(), last);
    }

    private static void pause(Duration delay, String what) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BundleException(BundleFailure.TRANSPORT, what + " interrupted", e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String decodeUtf8(String cid, String path, byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new BundleException(BundleFailure.RECORD_STREAM_MALFORMED,
                    cid + "/" + path + " is not valid UTF-8", e);
        }
    }

    static boolean isSafeRelativePath(String path) {
        if (path == null || path.isBlank() || path.startsWith("/") || path.contains("\\")) {
            return false;
        }
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                return false;
            }
        }
        return true;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
