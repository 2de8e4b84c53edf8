package com.arknoa.orchestrator.service;

import com.arknoa.orchestrator.model.EventType;

import java.util.UUID;

/**
 * Remembers which (request, stage, attempt) already produced a terminal
 * event, so a redelivered dispatch never yields a second one.
 */
public interface InvocationLog {

    /** @return true if this call recorded the outcome, false if one was already recorded */
    boolean recordIfAbsent(UUID requestId, String stage, int attempt, EventType outcome);

    boolean isRecorded(UUID requestId, String stage, int attempt);
}
