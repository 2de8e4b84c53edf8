package com.arknoa.orchestrator.ledger;

import com.arknoa.orchestrator.model.DigestRequest;
import com.arknoa.orchestrator.model.HistoryEntry;
import com.arknoa.orchestrator.model.PipelineState;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Source of truth for request state and history.
 *
 * Every mutation except {@link #abort} is conditional on the state the caller
 * last read. Nothing is ever silently ignored: a mismatch is a
 * {@link StaleTransitionException}.
 */
public interface RequestLedger {

    /** Record a new request in INTAKE_PENDING and return its id. */
    UUID create(String payloadRef);

    /** @throws RequestNotFoundException if no request has this id */
    DigestRequest get(UUID id);

    /**
     * Append one resolved attempt to the history.
     *
     * @throws HistoryConflictException if (stage, attempt) already has an
     *                                  outcome or the entry moves backwards
     */
    void appendHistory(UUID id, HistoryEntry entry) throws HistoryConflictException;

    default void transition(UUID id, PipelineState from, PipelineState to) throws StaleTransitionException {
        try {
            transition(id, Transition.of(from, to));
        } catch (HistoryConflictException e) {
            throw new IllegalStateException("Transition without history entry reported a history conflict", e);
        }
    }

    /**
     * Apply a transition if the request is still in {@code t.from()}. The state
     * change and the optional history entry are written together or not at all.
     */
    void transition(UUID id, Transition t) throws StaleTransitionException, HistoryConflictException;

    /**
     * Mark the request ABORTED regardless of its stage. A request that already
     * reached a terminal state is left unchanged.
     *
     * @return the request after the call
     */
    DigestRequest abort(UUID id, String reason);

    /**
     * Requests the dispatcher may advance: INTAKE_PENDING, *_SUCCEEDED and
     * *_RETRY_PENDING whose backoff deadline has passed.
     */
    List<DigestRequest> findReady(Instant now, int limit);
}
