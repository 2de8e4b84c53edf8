package com.arknoa.orchestrator.repository;

import com.arknoa.orchestrator.model.InvocationRecord;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Terminal-event markers, keyed by (request_id, stage, attempt).
 */
public interface InvocationRepository extends JpaRepository<InvocationRecord, InvocationRecord.Key> {
}
