package com.di.indexer.ledger;

/**
 * One {@code AttestationMade} log as observed on the ledger.
 *
 * @param uid      attestation uid, {@code 0x} + 64 hex chars
 * @param position block number the log was emitted in
 * @param logIndex index of the log within its block
 */
public record AttestationEvent(String uid, String attester, String subject, long position, long logIndex) {
}
