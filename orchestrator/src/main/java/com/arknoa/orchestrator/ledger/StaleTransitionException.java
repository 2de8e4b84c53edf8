package com.arknoa.orchestrator.ledger;

import com.arknoa.orchestrator.model.PipelineState;

import java.util.UUID;

/**
 * A conditional ledger write found the request in a different state than the
 * caller expected: another orchestrator instance (or an abort) got there first.
 *
 * Checked on purpose: every caller has to decide how to re-read and retry.
 * It is never surfaced to the submitter.
 */
public class StaleTransitionException extends Exception {

    private final UUID          requestId;
    private final PipelineState expected;

    public StaleTransitionException(UUID requestId, PipelineState expected, String actual) {
        super("Request " + requestId + " is not in " + expected.label() + " (found " + actual + ")");
        this.requestId = requestId;
        this.expected  = expected;
    }

    public UUID          getRequestId() { return requestId; }
    public PipelineState getExpected()  { return expected; }
}
