package com.arknoa.orchestrator.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable message on the event bus.
 *
 * DISPATCHED events travel on pipeline.dispatch.&lt;stage&gt; (orchestrator → invoker)
 * and, as a start notice, on pipeline.result.&lt;stage&gt;; terminal events travel on
 * pipeline.result.&lt;stage&gt; (invoker → orchestrator).
 *
 * @param payloadRef input reference on dispatch, output reference on success
 * @param permanent  true when a FAILED event must not be retried
 * @param leaseToken fencing token of the lease the dispatch was issued under
 */
public record PipelineEvent(
        UUID      requestId,
        String    stage,
        int       attempt,
        EventType type,
        String    payloadRef,
        String    error,
        boolean   permanent,
        long      leaseToken,
        Instant   occurredAt
) {
    public PipelineEvent {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(type, "type");
    }

    public static PipelineEvent dispatched(UUID requestId, String stage, int attempt,
                                           String payloadRef, long leaseToken, Instant at) {
        return new PipelineEvent(requestId, stage, attempt, EventType.DISPATCHED,
                payloadRef, null, false, leaseToken, at);
    }

    public static PipelineEvent succeeded(PipelineEvent dispatch, String outputRef, Instant at) {
        return new PipelineEvent(dispatch.requestId, dispatch.stage, dispatch.attempt,
                EventType.SUCCEEDED, outputRef, null, false, dispatch.leaseToken, at);
    }

    public static PipelineEvent failed(PipelineEvent dispatch, String error, boolean permanent, Instant at) {
        return new PipelineEvent(dispatch.requestId, dispatch.stage, dispatch.attempt,
                EventType.FAILED, null, error, permanent, dispatch.leaseToken, at);
    }

    public static PipelineEvent timedOut(PipelineEvent dispatch, String error, Instant at) {
        return new PipelineEvent(dispatch.requestId, dispatch.stage, dispatch.attempt,
                EventType.TIMED_OUT, null, error, false, dispatch.leaseToken, at);
    }

    /** Same dispatch, re-stamped as the invoker's start notice. */
    public PipelineEvent startedAt(Instant at) {
        return new PipelineEvent(requestId, stage, attempt, EventType.DISPATCHED,
                payloadRef, null, false, leaseToken, at);
    }
}
