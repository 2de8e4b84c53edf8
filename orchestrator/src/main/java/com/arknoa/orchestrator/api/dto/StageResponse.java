package com.arknoa.orchestrator.api.dto;

import com.arknoa.orchestrator.stage.StageDescriptor;

/** Entry of GET /stages. */
public record StageResponse(
        String  name,
        int     position,
        String  endpoint,
        long    timeoutMs,
        int     maxRetries,
        long    backoffBaseMs,
        long    backoffCapMs,
        double  jitter,
        boolean idempotent
) {
    public static StageResponse from(StageDescriptor d) {
        return new StageResponse(
                d.name(),
                d.position(),
                d.endpoint(),
                d.timeout().toMillis(),
                d.maxRetries(),
                d.backoff().base().toMillis(),
                d.backoff().cap().toMillis(),
                d.backoff().jitter(),
                d.idempotent()
        );
    }
}
