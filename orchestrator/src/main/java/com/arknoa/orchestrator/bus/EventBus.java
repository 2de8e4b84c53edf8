package com.arknoa.orchestrator.bus;

import com.arknoa.orchestrator.model.PipelineEvent;

import java.util.List;
import java.util.UUID;

/**
 * Durable, partitioned, consumer-group event log.
 *
 * Delivery is at-least-once: an offset moves past an event only after the
 * handler returned. Within a partition events are handed out in publish order,
 * and a partition is drained by at most one consumer of a group at a time.
 */
public interface EventBus {

    /** Append the event to the partition of {@code topic} owned by its request id. */
    void publish(String topic, PipelineEvent event);

    /**
     * Hand up to {@code maxEvents} uncommitted events of {@code topic} to the
     * handler, across all partitions this consumer can claim. A handler
     * exception stops the partition's batch at the failing event.
     *
     * @return number of events handled and committed
     */
    int consume(String group, String topic, int maxEvents, EventHandler handler);

    /** Every retained event of a request in publish order, across all topics. */
    List<PipelineEvent> replay(UUID requestId);
}
