package com.arknoa.orchestrator.repository;

import com.arknoa.orchestrator.model.LeaseRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Conditional writes on the request_leases table.
 *
 * Every mutation is a single UPDATE/DELETE guarded by expiry or token, so no
 * lock is held between statements.
 */
public interface LeaseRepository extends JpaRepository<LeaseRecord, UUID> {

    /** Next fencing token. Tokens never repeat, even after a lease row is deleted. */
    @Query(value = "SELECT nextval('lease_token_seq')", nativeQuery = true)
    long nextToken();

    /** Take over an expired lease under a fresh fencing token. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE LeaseRecord l
               SET l.holderId   = :holder,
                   l.token      = :token,
                   l.acquiredAt = :now,
                   l.expiresAt  = :expiresAt
             WHERE l.requestId = :id
               AND l.expiresAt <= :now
            """)
    int takeOverExpired(@Param("id") UUID requestId,
                        @Param("holder") String holderId,
                        @Param("token") long token,
                        @Param("now") Instant now,
                        @Param("expiresAt") Instant expiresAt);

    /** Push out the expiry of a live lease held under the given token. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE LeaseRecord l
               SET l.expiresAt = :expiresAt
             WHERE l.requestId = :id
               AND l.token = :token
               AND l.expiresAt > :now
            """)
    int renew(@Param("id") UUID requestId,
              @Param("token") long token,
              @Param("now") Instant now,
              @Param("expiresAt") Instant expiresAt);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM LeaseRecord l WHERE l.requestId = :id AND l.token = :token")
    int release(@Param("id") UUID requestId, @Param("token") long token);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM LeaseRecord l WHERE l.requestId = :id")
    int forceRelease(@Param("id") UUID requestId);

    List<LeaseRecord> findByExpiresAtLessThanEqualOrderByExpiresAtAsc(Instant now, Pageable page);
}
