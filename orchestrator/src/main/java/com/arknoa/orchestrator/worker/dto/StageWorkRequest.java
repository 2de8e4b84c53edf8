package com.arknoa.orchestrator.worker.dto;

import java.util.Map;

/**
 * Request body for POST {endpoint}/process on a stage worker.
 *
 * stage_config carries the descriptor settings plus "inputs": the outputs of
 * the stages that already completed, keyed by stage name.
 */
public record StageWorkRequest(
        String              request_id,
        String              payload_ref,
        String              stage,
        int                 attempt,
        Map<String, Object> stage_config
) {}
