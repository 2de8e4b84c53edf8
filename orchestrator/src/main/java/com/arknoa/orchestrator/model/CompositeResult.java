package com.arknoa.orchestrator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Integrated output of a request: one output reference per completed stage,
 * in pipeline order. This is what the registrar stage receives as input and
 * what GET /requests/{id}/result returns once the request is COMPLETED.
 */
public record CompositeResult(UUID requestId, Map<String, String> outputs, Instant assembledAt) {

    public CompositeResult {
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }
}
