package com.arknoa.orchestrator.service;

import com.arknoa.orchestrator.model.CompositeResult;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only store of stage outputs, keyed by (request, stage).
 *
 * Merging the same output twice is a no-op, so replayed SUCCEEDED events
 * can never change what a request produced.
 */
public interface ResultAccumulator {

    /**
     * Record the output of a stage.
     *
     * @return true if this call stored the output; false if the stage already
     *         had one (the first output wins)
     */
    boolean merge(UUID requestId, String stage, String outputRef);

    /** Outputs merged so far, stage name → output reference. */
    Map<String, String> outputs(UUID requestId);

    /** Integrated result with the outputs arranged in the given stage order. */
    CompositeResult composite(UUID requestId, List<String> order);
}
