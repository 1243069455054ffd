package com.di.indexer.ledger.decode;

import com.di.indexer.ledger.AbiDecodingException;
import com.di.indexer.ledger.AbiReader;
import com.di.indexer.ledger.Attestation;

/**
 * Decodes scan-submission payloads, ABI-encoded as
 *
 * <pre>
 * (bytes32 jobId, string namespace, string datasetType, string cid,
 *  bytes32 merkleRoot, string targetSpecCid, uint64 startedAt,
 *  uint64 finishedAt, string tool, string toolVersion, string vantage,
 *  bytes32 manifestSha256, bytes extra)
 * </pre>
 */
public class ScanSubmissionDecoder implements AttestationDecoder<ScanSubmissionPayload> {

    static final int HEAD_WORDS = 13;

    private final String schemaId;

    public ScanSubmissionDecoder(String schemaId) {
        this.schemaId = schemaId;
    }

    @Override
    public String schemaId() {
        return schemaId;
    }

    @Override
    public ScanSubmissionPayload decode(Attestation attestation) {
        byte[] payload = attestation.payload();
        AbiReader abi = new AbiReader(payload);
        if (abi.wordCount() < HEAD_WORDS) {
            throw new AbiDecodingException("scan submission payload too short: "
                    + (payload == null ? 0 : payload.length) + " bytes");
        }
        return new ScanSubmissionPayload(
                abi.bytes32OrEmpty(0),
                abi.string(1),
                abi.string(2),
                abi.string(3),
                abi.bytes32OrEmpty(4),
                abi.string(5),
                abi.uint64(6),
                abi.uint64(7),
                abi.string(8),
                abi.string(9),
                abi.string(10),
                abi.bytes32OrEmpty(11),
                abi.dynamicBytes(12));
    }
}
