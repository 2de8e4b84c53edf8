package com.arknoa.orchestrator.bus;

import java.util.UUID;

/**
 * Topic naming and partitioning for the pipeline bus.
 *
 *   pipeline.dispatch.&lt;stage&gt;  orchestrator → invoker
 *   pipeline.result.&lt;stage&gt;    invoker → orchestrator
 *
 * Every event of a request lands in the same partition of a topic, which is
 * what gives per-request ordering.
 */
public final class Topics {

    public static final String DISPATCH_PREFIX = "pipeline.dispatch.";
    public static final String RESULT_PREFIX   = "pipeline.result.";

    /** Consumer group of the orchestrator instances (result topics). */
    public static final String ORCHESTRATOR_GROUP = "pipeline-orchestrator";

    /** Consumer group of the stage invokers (dispatch topics). */
    public static final String INVOKER_GROUP = "stage-invoker";

    private Topics() {}

    public static String dispatch(String stage) {
        return DISPATCH_PREFIX + stage;
    }

    public static String result(String stage) {
        return RESULT_PREFIX + stage;
    }

    public static int partitionFor(UUID requestId, int partitions) {
        return Math.floorMod(requestId.hashCode(), partitions);
    }
}
