package com.arknoa.orchestrator.ledger;

import com.arknoa.orchestrator.model.Lease;
import com.arknoa.orchestrator.model.LeaseRecord;
import com.arknoa.orchestrator.repository.LeaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lease store on the request_leases table.
 *
 * Acquisition is "insert, else take over if expired": the primary key on
 * request_id rejects a second live lease, the conditional UPDATE rejects a
 * takeover of a live one. Each statement commits on its own; a duplicate-key
 * failure must not poison a caller's transaction.
 */
@Component
@Transactional(propagation = Propagation.NOT_SUPPORTED)
public class JpaLeaseStore implements LeaseStore {

    private static final Logger log = LoggerFactory.getLogger(JpaLeaseStore.class);

    private final LeaseRepository leaseRepo;
    private final Clock           clock;

    public JpaLeaseStore(LeaseRepository leaseRepo, Clock clock) {
        this.leaseRepo = leaseRepo;
        this.clock     = clock;
    }

    @Override
    public Optional<Lease> tryAcquire(UUID requestId, String holderId, Duration ttl) {
        Instant now       = clock.instant();
        Instant expiresAt = now.plus(ttl);
        long    token     = leaseRepo.nextToken();

        if (leaseRepo.takeOverExpired(requestId, holderId, token, now, expiresAt) == 1) {
            log.info("Lease on {} taken over by {} (token={})", requestId, holderId, token);
            return Optional.of(new Lease(requestId, holderId, token, now, expiresAt));
        }
        if (leaseRepo.existsById(requestId)) {
            return Optional.empty();
        }
        try {
            leaseRepo.saveAndFlush(new LeaseRecord(requestId, holderId, token, now, expiresAt));
            return Optional.of(new Lease(requestId, holderId, token, now, expiresAt));
        } catch (DataIntegrityViolationException e) {
            log.debug("Lease on {} acquired concurrently by another holder", requestId);
            return Optional.empty();
        }
    }

    @Override
    public Lease renew(UUID requestId, long token, Duration ttl) {
        Instant now = clock.instant();
        if (leaseRepo.renew(requestId, token, now, now.plus(ttl)) == 0) {
            throw new LeaseExpiredException(requestId, token);
        }
        return leaseRepo.findById(requestId)
                .map(LeaseRecord::toLease)
                .orElseThrow(() -> new LeaseExpiredException(requestId, token));
    }

    @Override
    public boolean release(UUID requestId, long token) {
        return leaseRepo.release(requestId, token) == 1;
    }

    @Override
    public void forceRelease(UUID requestId) {
        leaseRepo.forceRelease(requestId);
    }

    @Override
    public Optional<Lease> find(UUID requestId) {
        return leaseRepo.findById(requestId).map(LeaseRecord::toLease);
    }

    @Override
    public List<Lease> findExpired(Instant now, int limit) {
        return leaseRepo.findByExpiresAtLessThanEqualOrderByExpiresAtAsc(now, PageRequest.of(0, limit))
                .stream()
                .map(LeaseRecord::toLease)
                .toList();
    }
}
