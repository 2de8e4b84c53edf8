package com.arknoa.orchestrator.bus;

import com.arknoa.orchestrator.model.PipelineEvent;

/**
 * Callback for consumed events. Returning normally commits the event's offset;
 * throwing leaves it uncommitted so the event is delivered again.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(PipelineEvent event);
}
