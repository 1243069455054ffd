package com.di.indexer.ledger.decode;

import com.di.indexer.ledger.AbiDecodingException;
import com.di.indexer.ledger.Attestation;
import com.di.indexer.support.AbiEncoder;
import com.di.indexer.support.Attestations;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScanSubmissionDecoder Tests")
class ScanSubmissionDecoderTest {

    private final ScanSubmissionDecoder decoder = new ScanSubmissionDecoder(Attestations.SCHEMA);

    @Test
    @DisplayName("Should decode every field of a scan submission")
    void testDecode() {
        String root = AbiEncoder.word(0xaa);
        String manifest = AbiEncoder.word(0xbb);
        Attestation a = Attestations.scanSubmission(Attestations.uid(1), "bafyCid", root, manifest);

        ScanSubmissionPayload p = decoder.decode(a);

        assertEquals(AbiEncoder.word(0x0b), p.jobId());
        assertEquals("acme", p.namespace());
        assertEquals("ports", p.datasetType());
        assertEquals("bafyCid", p.cid());
        assertEquals(root, p.merkleRoot());
        assertEquals("", p.targetSpecCid());
        assertEquals(1_700_000_000L, p.startedAt());
        assertEquals(1_700_000_100L, p.finishedAt());
        assertEquals("nmap", p.tool());
        assertEquals("7.94", p.toolVersion());
        assertEquals("eu-1", p.vantage());
        assertEquals(manifest, p.manifestSha256());
        assertEquals(0, p.extra().length);
        assertTrue(p.hasContentAddress());
    }

    @Test
    @DisplayName("Zero bytes32 fields decode to empty strings")
    void testZeroWordsAreEmpty() {
        Attestation a = Attestations.scanSubmission(Attestations.uid(2), "", "", "");
        ScanSubmissionPayload p = decoder.decode(a);
        assertEquals("", p.merkleRoot());
        assertEquals("", p.manifestSha256());
        assertFalse(p.hasContentAddress());
    }

    @Test
    @DisplayName("Should reject a payload shorter than the head")
    void testTruncatedPayload() {
        byte[] full = Attestations.payload("cid", "", "");
        Attestation a = Attestations.attestation(Attestations.uid(3), Attestations.SCHEMA,
                                                 Arrays.copyOf(full, 32 * 5), false);
        assertThrows(AbiDecodingException.class, () -> decoder.decode(a));
    }

    @Test
    @DisplayName("Should reject a dynamic offset pointing outside the payload")
    void testBadOffset() {
        byte[] payload = Attestations.payload("cid", "", "");
        payload[32 + 31] = (byte) 0xff;
        payload[32 + 30] = (byte) 0xff;
        Attestation a = Attestations.attestation(Attestations.uid(4), Attestations.SCHEMA, payload, false);
        assertThrows(AbiDecodingException.class, () -> decoder.decode(a));
    }

    @Test
    @DisplayName("Registry finds decoders by schema id, case-insensitively")
    void testRegistryLookup() {
        AttestationDecoderRegistry registry = new AttestationDecoderRegistry(List.of(decoder));
        assertTrue(registry.find(Attestations.SCHEMA.toUpperCase().replace("0X", "0x")).isPresent());
        assertTrue(registry.isRecognized(Attestations.SCHEMA));
        assertFalse(registry.isRecognized(AbiEncoder.word(0x01)));
    }

    @Test
    @DisplayName("Registry skips decoders without a configured schema id")
    void testRegistrySkipsUnconfigured() {
        AttestationDecoderRegistry registry = new AttestationDecoderRegistry(List.of(new ScanSubmissionDecoder("")));
        assertFalse(registry.isRecognized(""));
        assertTrue(registry.find(null).isEmpty());
    }
}
