package com.arknoa.orchestrator.api.dto;

import com.arknoa.orchestrator.model.DigestRequest;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /requests, GET /requests/{id} and the abort call.
 *
 * state is the ledger label ("embeddings_IN_PROGRESS", "COMPLETED", ...);
 * stage and failureReason are filled in for FAILED and ABORTED requests.
 */
public record RequestResponse(
        UUID    id,
        String  state,
        String  currentStage,
        String  stage,
        int     attemptCount,
        Instant notBefore,
        String  failureReason,
        String  payloadRef,
        Instant createdAt,
        Instant updatedAt
) {
    public static RequestResponse from(DigestRequest r) {
        return new RequestResponse(
                r.id(),
                r.state().label(),
                r.currentStage(),
                r.state().stage(),
                r.attemptCount(),
                r.notBefore(),
                r.failureReason(),
                r.payloadRef(),
                r.createdAt(),
                r.updatedAt()
        );
    }
}
