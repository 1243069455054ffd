package com.di.indexer.ledger.decode;

import com.di.indexer.ledger.Attestation;

/**
 * Decodes the payload of attestations made under one schema.
 *
 * @param <T> typed payload
 */
public interface AttestationDecoder<T> {

    /** Schema uid ({@code 0x}-hex) this decoder understands. */
    String schemaId();

    /**
     * @throws com.di.indexer.ledger.AbiDecodingException when the payload does
     *         not match the schema layout
     */
    T decode(Attestation attestation);
}
