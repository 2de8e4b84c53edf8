package com.arknoa.orchestrator.model;

import java.time.Instant;

/**
 * One resolved attempt in a request's stage history.
 *
 * @param stage    stage name
 * @param position pipeline position of the stage when the entry was written;
 *                 the ledger rejects entries that move backwards
 * @param attempt  1-based attempt number within the stage
 * @param outcome  how the attempt ended
 * @param error    failure detail, null on success
 * @param at       when the outcome was recorded
 */
public record HistoryEntry(
        String       stage,
        int          position,
        int          attempt,
        StageOutcome outcome,
        String       error,
        Instant      at
) {}
