package com.arknoa.orchestrator.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only snapshot of a request as stored in the ledger.
 *
 * attemptCount is the number of failed attempts in the current stage and is
 * reset to 0 whenever the request enters a new stage.
 */
public record DigestRequest(
        UUID               id,
        String             payloadRef,
        PipelineState      state,
        int                attemptCount,
        Instant            notBefore,
        String             failureReason,
        List<HistoryEntry> history,
        Instant            createdAt,
        Instant            updatedAt
) {
    public DigestRequest {
        history = history == null ? List.of() : List.copyOf(history);
    }

    /** Stage name, or the terminal marker once the request has finished. */
    public String currentStage() {
        if (state.isTerminal() || state.status() == RequestStatus.INTAKE_PENDING) {
            return state.status().name();
        }
        return state.stage();
    }

    /** 1-based number of the attempt currently running (or next to run) in the stage. */
    public int currentAttempt() {
        return attemptCount + 1;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
