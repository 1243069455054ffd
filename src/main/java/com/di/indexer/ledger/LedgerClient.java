package com.di.indexer.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the attestor contract.
 *
 * <p>All methods may throw {@link LedgerException}; range methods throw
 * {@link LedgerRangeUnavailableException} when the window is not served.
 */
public interface LedgerClient {

    /** Latest confirmed block number. */
    long currentHead();

    /** Events for {@code [fromPos, toPos]} through an installed log filter. */
    List<AttestationEvent> pollFilter(long fromPos, long toPos);

    /** Events for {@code [fromPos, toPos]} through a direct range query. */
    List<AttestationEvent> queryEvents(long fromPos, long toPos);

    /** Empty when the contract holds no attestation for {@code uid}. */
    Optional<Attestation> resolveAttestation(String uid);
}
