package com.arknoa.orchestrator.repository;

import com.arknoa.orchestrator.model.BusEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface BusEventRepository extends JpaRepository<BusEvent, Long> {

    /** Next batch of a partition after the committed offset, in publish order. */
    List<BusEvent> findByTopicAndPartitionNoAndIdGreaterThanOrderByIdAsc(
            String topic, int partitionNo, long afterId, Pageable page);

    /** Every retained event for a request, across topics (audit). */
    List<BusEvent> findByRequestIdOrderByIdAsc(UUID requestId);
}
