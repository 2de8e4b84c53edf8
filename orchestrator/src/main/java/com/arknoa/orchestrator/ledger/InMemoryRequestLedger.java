package com.arknoa.orchestrator.ledger;

import com.arknoa.orchestrator.model.DigestRequest;
import com.arknoa.orchestrator.model.HistoryEntry;
import com.arknoa.orchestrator.model.PipelineState;
import com.arknoa.orchestrator.model.RequestStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ledger held in memory. Same conditional-write contract as the JPA ledger;
 * each request row is its own monitor, so unrelated requests never contend.
 *
 * Used by tests and single-process embeddings; state does not survive a restart.
 */
public class InMemoryRequestLedger implements RequestLedger {

    private final Map<UUID, Row> rows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRequestLedger(Clock clock) {
        this.clock = clock;
    }

    private static final class Row {
        final UUID    id;
        final String  payloadRef;
        final Instant createdAt;
        final List<HistoryEntry> history = new ArrayList<>();
        PipelineState state = PipelineState.intakePending();
        int     attemptCount;
        Instant notBefore;
        String  failureReason;
        Instant updatedAt;

        Row(UUID id, String payloadRef, Instant now) {
            this.id         = id;
            this.payloadRef = payloadRef;
            this.createdAt  = now;
            this.updatedAt  = now;
        }

        DigestRequest snapshot() {
            return new DigestRequest(id, payloadRef, state, attemptCount, notBefore,
                    failureReason, history, createdAt, updatedAt);
        }
    }

    @Override
    public UUID create(String payloadRef) {
        UUID id = UUID.randomUUID();
        rows.put(id, new Row(id, payloadRef, clock.instant()));
        return id;
    }

    @Override
    public DigestRequest get(UUID id) {
        Row row = row(id);
        synchronized (row) {
            return row.snapshot();
        }
    }

    @Override
    public void appendHistory(UUID id, HistoryEntry entry) throws HistoryConflictException {
        Row row = row(id);
        synchronized (row) {
            checkAppend(row, entry);
            row.history.add(entry);
        }
    }

    @Override
    public void transition(UUID id, Transition t) throws StaleTransitionException, HistoryConflictException {
        Row row = row(id);
        synchronized (row) {
            if (!row.state.label().equals(t.from().label())) {
                throw new StaleTransitionException(id, t.from(), row.state.label());
            }
            if (t.entry() != null) {
                checkAppend(row, t.entry());
                row.history.add(t.entry());
            }
            row.attemptCount  = t.resolveAttemptCount(row.attemptCount);
            row.state         = t.to();
            row.notBefore     = t.notBefore();
            row.failureReason = t.failureReason();
            row.updatedAt     = clock.instant();
        }
    }

    @Override
    public DigestRequest abort(UUID id, String reason) {
        Row row = row(id);
        synchronized (row) {
            if (!row.state.isTerminal()) {
                row.state         = PipelineState.aborted(row.state.stage());
                row.notBefore     = null;
                row.failureReason = reason;
                row.updatedAt     = clock.instant();
            }
            return row.snapshot();
        }
    }

    @Override
    public List<DigestRequest> findReady(Instant now, int limit) {
        List<DigestRequest> ready = new ArrayList<>();
        for (Row row : rows.values()) {
            synchronized (row) {
                RequestStatus status = row.state.status();
                if (status.isReady() && (row.notBefore == null || !row.notBefore.isAfter(now))) {
                    ready.add(row.snapshot());
                }
            }
        }
        return ready.stream()
                .sorted(Comparator.comparing(DigestRequest::updatedAt))
                .limit(limit)
                .toList();
    }

    private Row row(UUID id) {
        Row row = rows.get(id);
        if (row == null) {
            throw new RequestNotFoundException(id);
        }
        return row;
    }

    private static void checkAppend(Row row, HistoryEntry entry) throws HistoryConflictException {
        for (HistoryEntry e : row.history) {
            if (e.stage().equals(entry.stage()) && e.attempt() == entry.attempt()) {
                throw new HistoryConflictException(row.id, HistoryConflictException.Kind.ALREADY_RESOLVED,
                        entry.stage() + " attempt " + entry.attempt() + " already resolved as " + e.outcome());
            }
        }
        if (!row.history.isEmpty()) {
            HistoryEntry last = row.history.get(row.history.size() - 1);
            if (entry.position() < last.position()) {
                throw new HistoryConflictException(row.id, HistoryConflictException.Kind.OUT_OF_ORDER,
                        "stage " + entry.stage() + " comes before already recorded stage " + last.stage());
            }
        }
    }
}
