package com.arknoa.orchestrator.repository;

import com.arknoa.orchestrator.model.LedgerEntry;
import com.arknoa.orchestrator.model.RequestStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Ledger queries for the digest_requests table.
 */
public interface RequestRepository extends JpaRepository<LedgerEntry, UUID> {

    /**
     * Compare-and-set on the state label.
     *
     * The WHERE clause is the whole concurrency story: two orchestrator
     * instances racing on the same request both issue this UPDATE, the
     * database serialises them on the row, and only the first still sees the
     * expected label. The loser gets 0 rows and must re-read.
     *
     * @return number of rows updated (0 or 1)
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE LedgerEntry r
               SET r.state         = :toState,
                   r.status        = :toStatus,
                   r.stage         = :toStage,
                   r.attemptCount  = :attemptCount,
                   r.notBefore     = :notBefore,
                   r.failureReason = :failureReason,
                   r.updatedAt     = :now
             WHERE r.id = :id
               AND r.state = :expectedState
            """)
    int compareAndSet(@Param("id")            UUID id,
                      @Param("expectedState") String expectedState,
                      @Param("toState")       String toState,
                      @Param("toStatus")      RequestStatus toStatus,
                      @Param("toStage")       String toStage,
                      @Param("attemptCount")  int attemptCount,
                      @Param("notBefore")     Instant notBefore,
                      @Param("failureReason") String failureReason,
                      @Param("now")           Instant now);

    /**
     * Requests the dispatcher may advance: status in the ready set and past
     * any backoff deadline. Oldest-updated first so nothing starves.
     */
    @Query("""
            SELECT r FROM LedgerEntry r
             WHERE r.status IN :statuses
               AND (r.notBefore IS NULL OR r.notBefore <= :now)
             ORDER BY r.updatedAt ASC
            """)
    List<LedgerEntry> findReady(@Param("statuses") Collection<RequestStatus> statuses,
                                @Param("now") Instant now,
                                Pageable page);

    /** All requests in a given status (monitoring and tests). */
    List<LedgerEntry> findByStatus(RequestStatus status);
}
