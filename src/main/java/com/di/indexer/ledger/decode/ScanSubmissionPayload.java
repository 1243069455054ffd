package com.di.indexer.ledger.decode;

/**
 * Typed payload of a scan-submission attestation.
 *
 * <p>{@code bytes32} fields ({@code jobId}, {@code merkleRoot},
 * {@code manifestSha256}) are {@code 0x}-hex or {@code ""} when zero.
 */
public record ScanSubmissionPayload(
        String jobId,
        String namespace,
        String datasetType,
        String cid,
        String merkleRoot,
        String targetSpecCid,
        long   startedAt,
        long   finishedAt,
        String tool,
        String toolVersion,
        String vantage,
        String manifestSha256,
        byte[] extra) {

    public boolean hasContentAddress() {
        return cid != null && !cid.isBlank();
    }
}
