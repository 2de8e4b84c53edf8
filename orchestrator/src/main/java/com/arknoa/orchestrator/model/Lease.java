package com.arknoa.orchestrator.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Time-bounded ownership claim on a request.
 *
 * token increases on every acquisition, so a holder whose lease was taken over
 * after expiry cannot release or renew the new one.
 */
public record Lease(
        UUID    requestId,
        String  holderId,
        long    token,
        Instant acquiredAt,
        Instant expiresAt
) {
    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
