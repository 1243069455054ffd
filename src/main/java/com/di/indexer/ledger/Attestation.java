package com.di.indexer.ledger;

/**
 * Attestation as stored by the attestor contract. {@code payload} is the raw
 * schema-specific data, decoded by {@link com.di.indexer.ledger.decode.AttestationDecoderRegistry}.
 */
public record Attestation(
        String uid,
        String schemaId,
        String attester,
        String subject,
        long timestamp,
        long expirationTime,
        boolean revoked,
        byte[] payload) {
}
