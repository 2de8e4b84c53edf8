package com.arknoa.orchestrator.api.dto;

import com.arknoa.orchestrator.model.HistoryEntry;
import com.arknoa.orchestrator.model.StageOutcome;

import java.time.Instant;

/** One row of GET /requests/{id}/history. */
public record HistoryResponse(
        String       stage,
        int          attempt,
        StageOutcome outcome,
        String       error,
        Instant      at
) {
    public static HistoryResponse from(HistoryEntry h) {
        return new HistoryResponse(h.stage(), h.attempt(), h.outcome(), h.error(), h.at());
    }
}
