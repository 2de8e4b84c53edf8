package com.arknoa.orchestrator.repository;

import com.arknoa.orchestrator.model.HistoryRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only stage history rows.
 */
public interface HistoryRepository extends JpaRepository<HistoryRecord, Long> {

    List<HistoryRecord> findByRequestIdOrderByIdAsc(UUID requestId);

    Optional<HistoryRecord> findFirstByRequestIdOrderByIdDesc(UUID requestId);

    boolean existsByRequestIdAndStageAndAttempt(UUID requestId, String stage, int attempt);
}
