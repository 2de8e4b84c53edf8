package com.arknoa.orchestrator.api.dto;

/**
 * Request body for POST /requests.
 *
 * payloadRef is opaque to the orchestrator: a blob key, a repository URL,
 * whatever the intake stage knows how to fetch.
 */
public record SubmitRequest(String payloadRef) {}
