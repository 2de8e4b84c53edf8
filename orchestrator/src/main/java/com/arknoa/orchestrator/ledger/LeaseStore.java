package com.arknoa.orchestrator.ledger;

import com.arknoa.orchestrator.model.Lease;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Time-bounded, fenced ownership of requests.
 *
 * At most one live lease exists per request. Every acquisition hands out a
 * token that is larger than any token issued before it, and renew/release
 * only act when the caller's token still matches.
 */
public interface LeaseStore {

    /**
     * Acquire the lease if nobody holds it or the current lease has expired.
     *
     * @return the new lease, or empty if a live lease is held by someone else
     */
    Optional<Lease> tryAcquire(UUID requestId, String holderId, Duration ttl);

    /**
     * Extend a live lease to now + ttl.
     *
     * @throws LeaseExpiredException if the lease expired or was taken over
     */
    Lease renew(UUID requestId, long token, Duration ttl);

    /** @return true if the lease held under {@code token} was removed */
    boolean release(UUID requestId, long token);

    /** Drop whatever lease the request has (abort). */
    void forceRelease(UUID requestId);

    Optional<Lease> find(UUID requestId);

    /** Leases whose expiry is at or before {@code now}, oldest first. */
    List<Lease> findExpired(Instant now, int limit);
}
