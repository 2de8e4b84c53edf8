package com.arknoa.orchestrator.ledger;

import java.util.UUID;

/**
 * The caller's lease on a request is gone: it expired, or another holder took
 * it over. Informational; the recovery sweep deals with the request.
 */
public class LeaseExpiredException extends RuntimeException {

    public LeaseExpiredException(UUID requestId, long token) {
        super("Lease token " + token + " no longer holds request " + requestId);
    }
}
