package com.arknoa.orchestrator.api.dto;

import com.arknoa.orchestrator.model.EventType;
import com.arknoa.orchestrator.model.PipelineEvent;

import java.time.Instant;

/**
 * One retained bus event, as returned by GET /requests/{id}/events.
 * Each attempt normally shows up as DISPATCHED twice (the orchestrator's
 * dispatch and the invoker's start notice) followed by one terminal event.
 */
public record EventResponse(
        String    stage,
        int       attempt,
        EventType type,
        String    payloadRef,
        String    error,
        boolean   permanent,
        long      leaseToken,
        Instant   occurredAt
) {
    public static EventResponse from(PipelineEvent e) {
        return new EventResponse(e.stage(), e.attempt(), e.type(), e.payloadRef(),
                e.error(), e.permanent(), e.leaseToken(), e.occurredAt());
    }
}
