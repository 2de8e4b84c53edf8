package com.arknoa.orchestrator.ledger;

import com.arknoa.orchestrator.model.HistoryEntry;
import com.arknoa.orchestrator.model.PipelineState;

import java.time.Instant;

/**
 * One conditional state change, applied atomically by the ledger.
 *
 * @param from          state the caller read; the write fails if it has moved on
 * @param to            target state
 * @param attemptCount  new failed-attempt count; null keeps the current count,
 *                      or resets it to 0 when {@code to} names a different stage
 * @param notBefore     backoff deadline (RETRY_PENDING only)
 * @param failureReason reason recorded with FAILED / ABORTED
 * @param entry         history entry appended in the same write, may be null
 */
public record Transition(
        PipelineState from,
        PipelineState to,
        Integer       attemptCount,
        Instant       notBefore,
        String        failureReason,
        HistoryEntry  entry) {

    public static Transition of(PipelineState from, PipelineState to) {
        return new Transition(from, to, null, null, null, null);
    }

    public Transition recording(HistoryEntry e) {
        return new Transition(from, to, attemptCount, notBefore, failureReason, e);
    }

    public static Transition retry(PipelineState from, int attemptCount, Instant notBefore) {
        return new Transition(from, PipelineState.retryPending(from.stage()), attemptCount, notBefore, null, null);
    }

    public static Transition fail(PipelineState from, int attemptCount, String reason) {
        return new Transition(from, PipelineState.failed(from.stage()), attemptCount, null, reason, null);
    }

    /** Attempt count after the write, given the count stored before it. */
    public int resolveAttemptCount(int current) {
        if (attemptCount != null) {
            return attemptCount;
        }
        boolean stageChanges = to.stage() != null && !to.stage().equals(from.stage());
        return stageChanges ? 0 : current;
    }
}
