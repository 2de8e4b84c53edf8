package com.arknoa.orchestrator.repository;

import com.arknoa.orchestrator.model.BusOffset;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Consumer-group offsets for the bus_events table.
 */
public interface BusOffsetRepository extends JpaRepository<BusOffset, BusOffset.Key> {

    /**
     * Claim a partition for one consumer of a group.
     *
     * SELECT FOR UPDATE SKIP LOCKED: if another instance of the same group is
     * already draining this partition the row is skipped and the result is
     * empty, so partitions are shared out without blocking.
     *
     * Must run inside a transaction; the claim lasts until it commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT o FROM BusOffset o
             WHERE o.consumerGroup = :group
               AND o.topic = :topic
               AND o.partitionNo = :partition
            """)
    Optional<BusOffset> claimPartition(@Param("group") String group,
                                       @Param("topic") String topic,
                                       @Param("partition") int partition);

    /**
     * Move the committed offset of a claimed partition.
     *
     * An explicit UPDATE rather than a dirty-checked entity: handlers running
     * in the same transaction may clear the persistence context, which would
     * detach the claimed row and drop the change.
     *
     * @return number of rows updated (0 or 1)
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE BusOffset o
               SET o.committedId = :committedId
             WHERE o.consumerGroup = :group
               AND o.topic = :topic
               AND o.partitionNo = :partition
            """)
    int commitOffset(@Param("group")       String group,
                     @Param("topic")       String topic,
                     @Param("partition")   int partition,
                     @Param("committedId") long committedId);
}
