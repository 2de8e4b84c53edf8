package com.arknoa.orchestrator.model;

/**
 * Lifecycle status of a digest request.
 *
 * Transitions (happy path):
 *   INTAKE_PENDING → IN_PROGRESS → SUCCEEDED → IN_PROGRESS (next stage) → … → COMPLETED
 *
 * RETRY_PENDING is the backoff wait between a failed attempt and the next
 * IN_PROGRESS of the same stage. FAILED is reachable from IN_PROGRESS once
 * retries are exhausted; ABORTED only through an explicit abort.
 */
public enum RequestStatus {
    INTAKE_PENDING,
    IN_PROGRESS,
    SUCCEEDED,
    RETRY_PENDING,
    COMPLETED,
    FAILED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ABORTED;
    }

    /** True for states the dispatcher picks up (subject to the backoff deadline). */
    public boolean isReady() {
        return this == INTAKE_PENDING || this == SUCCEEDED || this == RETRY_PENDING;
    }
}
