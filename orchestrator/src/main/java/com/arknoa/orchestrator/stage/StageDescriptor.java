package com.arknoa.orchestrator.stage;

import java.time.Duration;

/**
 * Static capability descriptor of one pipeline stage.
 *
 * @param name       unique stage name, also the topic suffix
 * @param position   ordering key; the pipeline runs stages in ascending position
 * @param endpoint   base URL of the stage worker
 * @param timeout    deadline for one invocation
 * @param maxRetries retries after the first attempt (max attempts = maxRetries + 1)
 * @param backoff    delay between a failed attempt and the next one
 * @param idempotent the worker tolerates repeated calls for the same request;
 *                   the orchestrator retries ambiguous outcomes, so this must be true
 */
public record StageDescriptor(
        String        name,
        int           position,
        String        endpoint,
        Duration      timeout,
        int           maxRetries,
        BackoffPolicy backoff,
        boolean       idempotent) {

    /** Reject descriptors the orchestrator cannot run safely. */
    public StageDescriptor validated() {
        if (name == null || name.isBlank() || !name.matches("[a-z][a-z0-9_-]*")) {
            throw new ConfigurationException("Invalid stage name: '" + name + "'");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ConfigurationException("Stage '" + name + "' needs a positive timeout");
        }
        if (maxRetries < 0) {
            throw new ConfigurationException("Stage '" + name + "' has negative max-retries");
        }
        if (backoff == null) {
            throw new ConfigurationException("Stage '" + name + "' has no backoff policy");
        }
        if (!idempotent) {
            throw new ConfigurationException("Stage '" + name + "' is not idempotent; "
                    + "timed-out attempts are re-invoked, so every stage must tolerate repeats");
        }
        return this;
    }
}
