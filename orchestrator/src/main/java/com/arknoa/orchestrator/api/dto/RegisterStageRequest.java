package com.arknoa.orchestrator.api.dto;

import com.arknoa.orchestrator.stage.BackoffPolicy;
import com.arknoa.orchestrator.stage.StageDescriptor;

import java.time.Duration;

/**
 * Request body for PUT /stages/{name}.
 *
 * Required: position, endpoint
 * Optional: timeoutMs (60000), maxRetries (2), backoffBaseMs (1000),
 *   backoffCapMs (30000), jitter (0.5), idempotent (true)
 */
public record RegisterStageRequest(
        Integer position,
        String  endpoint,
        Long    timeoutMs,
        Integer maxRetries,
        Long    backoffBaseMs,
        Long    backoffCapMs,
        Double  jitter,
        Boolean idempotent
) {
    public StageDescriptor toDescriptor(String name) {
        if (position == null) {
            throw new IllegalArgumentException("position is required");
        }
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint is required");
        }
        BackoffPolicy backoff = new BackoffPolicy(
                Duration.ofMillis(backoffBaseMs != null ? backoffBaseMs : 1_000),
                Duration.ofMillis(backoffCapMs  != null ? backoffCapMs  : 30_000),
                jitter != null ? jitter : 0.5);
        return new StageDescriptor(
                name,
                position,
                endpoint,
                Duration.ofMillis(timeoutMs != null ? timeoutMs : 60_000),
                maxRetries != null ? maxRetries : 2,
                backoff,
                idempotent == null || idempotent);
    }
}
