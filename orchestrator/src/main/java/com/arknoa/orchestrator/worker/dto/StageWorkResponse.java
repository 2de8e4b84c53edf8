package com.arknoa.orchestrator.worker.dto;

/**
 * Response from POST {endpoint}/process.
 *
 * @param status    "success" or "failure"
 * @param retryable only read on failure; false makes the failure permanent
 */
public record StageWorkResponse(
        String  status,
        String  output_ref,
        String  error,
        Boolean retryable
) {
    public boolean succeeded() {
        return "success".equalsIgnoreCase(status);
    }
}
