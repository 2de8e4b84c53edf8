package com.arknoa.orchestrator.service;

import com.arknoa.orchestrator.model.EventType;
import com.arknoa.orchestrator.model.InvocationRecord;
import com.arknoa.orchestrator.repository.InvocationRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Invocation log on the invocation_outcomes table; the composite primary key
 * is the dedup check.
 */
@Component
@Transactional(propagation = Propagation.NOT_SUPPORTED)
public class JpaInvocationLog implements InvocationLog {

    private final InvocationRepository invocationRepo;
    private final Clock                clock;

    public JpaInvocationLog(InvocationRepository invocationRepo, Clock clock) {
        this.invocationRepo = invocationRepo;
        this.clock          = clock;
    }

    @Override
    public boolean recordIfAbsent(UUID requestId, String stage, int attempt, EventType outcome) {
        if (isRecorded(requestId, stage, attempt)) {
            return false;
        }
        try {
            invocationRepo.saveAndFlush(new InvocationRecord(requestId, stage, attempt, outcome, clock.instant()));
            return true;
        } catch (DataIntegrityViolationException e) {
            return false;
        }
    }

    @Override
    public boolean isRecorded(UUID requestId, String stage, int attempt) {
        return invocationRepo.existsById(new InvocationRecord.Key(requestId, stage, attempt));
    }
}
