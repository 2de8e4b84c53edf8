package com.arknoa.orchestrator.stage;

/**
 * The declared pipeline cannot run: unknown stage in the order, duplicate
 * positions, non-idempotent stage, nonsensical timeouts.
 *
 * Raised while the context starts (fatal) or when a stage is registered at
 * runtime (rejected). Never raised while a request is being processed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
