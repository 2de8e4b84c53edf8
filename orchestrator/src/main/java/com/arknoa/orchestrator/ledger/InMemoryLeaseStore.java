package com.arknoa.orchestrator.ledger;

import com.arknoa.orchestrator.model.Lease;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lease store held in memory. Every mutation is a single atomic
 * {@link ConcurrentHashMap#compute} on the request's entry.
 */
public class InMemoryLeaseStore implements LeaseStore {

    private final Map<UUID, Lease> leases = new ConcurrentHashMap<>();
    private final AtomicLong       tokens = new AtomicLong();
    private final Clock            clock;

    public InMemoryLeaseStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Lease> tryAcquire(UUID requestId, String holderId, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean acquired = new AtomicBoolean();
        Lease result = leases.compute(requestId, (id, current) -> {
            if (current != null && !current.isExpired(now)) {
                return current;
            }
            acquired.set(true);
            return new Lease(id, holderId, tokens.incrementAndGet(), now, now.plus(ttl));
        });
        return acquired.get() ? Optional.of(result) : Optional.empty();
    }

    @Override
    public Lease renew(UUID requestId, long token, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean renewed = new AtomicBoolean();
        Lease result = leases.computeIfPresent(requestId, (id, current) -> {
            if (current.token() != token || current.isExpired(now)) {
                return current;
            }
            renewed.set(true);
            return new Lease(id, current.holderId(), token, current.acquiredAt(), now.plus(ttl));
        });
        if (!renewed.get()) {
            throw new LeaseExpiredException(requestId, token);
        }
        return result;
    }

    @Override
    public boolean release(UUID requestId, long token) {
        AtomicBoolean released = new AtomicBoolean();
        leases.computeIfPresent(requestId, (id, current) -> {
            if (current.token() != token) {
                return current;
            }
            released.set(true);
            return null;
        });
        return released.get();
    }

    @Override
    public void forceRelease(UUID requestId) {
        leases.remove(requestId);
    }

    @Override
    public Optional<Lease> find(UUID requestId) {
        return Optional.ofNullable(leases.get(requestId));
    }

    @Override
    public List<Lease> findExpired(Instant now, int limit) {
        return leases.values().stream()
                .filter(l -> l.isExpired(now))
                .sorted(Comparator.comparing(Lease::expiresAt))
                .limit(limit)
                .toList();
    }
}
