package com.arknoa.orchestrator.ledger;

import com.arknoa.orchestrator.model.DigestRequest;
import com.arknoa.orchestrator.model.HistoryEntry;
import com.arknoa.orchestrator.model.HistoryRecord;
import com.arknoa.orchestrator.model.LedgerEntry;
import com.arknoa.orchestrator.model.PipelineState;
import com.arknoa.orchestrator.model.RequestStatus;
import com.arknoa.orchestrator.repository.HistoryRepository;
import com.arknoa.orchestrator.repository.RequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable ledger on PostgreSQL.
 *
 * Conditional writes are a single UPDATE ... WHERE state = :expected (see
 * {@link RequestRepository#compareAndSet}); the history row is inserted in the
 * same transaction. The conflict exceptions are checked, so Spring does not
 * mark a surrounding transaction rollback-only when they are thrown.
 */
@Component
public class JpaRequestLedger implements RequestLedger {

    private static final Logger log = LoggerFactory.getLogger(JpaRequestLedger.class);

    private static final EnumSet<RequestStatus> READY = EnumSet.of(
            RequestStatus.INTAKE_PENDING, RequestStatus.SUCCEEDED, RequestStatus.RETRY_PENDING);

    private final RequestRepository requests;
    private final HistoryRepository history;
    private final Clock             clock;

    public JpaRequestLedger(RequestRepository requests, HistoryRepository history, Clock clock) {
        this.requests = requests;
        this.history  = history;
        this.clock    = clock;
    }

    @Override
    @Transactional
    public UUID create(String payloadRef) {
        LedgerEntry entry = requests.save(new LedgerEntry(UUID.randomUUID(), payloadRef, clock.instant()));
        log.info("Request {} recorded (payload={})", entry.getId(), payloadRef);
        return entry.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public DigestRequest get(UUID id) {
        LedgerEntry entry = requests.findById(id).orElseThrow(() -> new RequestNotFoundException(id));
        return entry.toSnapshot(historyOf(id));
    }

    @Override
    @Transactional
    public void appendHistory(UUID id, HistoryEntry entry) throws HistoryConflictException {
        if (!requests.existsById(id)) {
            throw new RequestNotFoundException(id);
        }
        checkAppend(id, entry);
        history.save(new HistoryRecord(id, entry));
    }

    @Override
    @Transactional
    public void transition(UUID id, Transition t) throws StaleTransitionException, HistoryConflictException {
        LedgerEntry current = requests.findById(id).orElseThrow(() -> new RequestNotFoundException(id));
        if (!current.getState().equals(t.from().label())) {
            throw new StaleTransitionException(id, t.from(), current.getState());
        }
        if (t.entry() != null) {
            checkAppend(id, t.entry());
        }

        PipelineState to = t.to();
        int updated = requests.compareAndSet(id, t.from().label(),
                to.label(), to.status(), to.stage(),
                t.resolveAttemptCount(current.getAttemptCount()),
                t.notBefore(), t.failureReason(), clock.instant());
        if (updated == 0) {
            // Lost the race between the read above and the UPDATE.
            String actual = requests.findById(id).map(LedgerEntry::getState).orElse("<deleted>");
            throw new StaleTransitionException(id, t.from(), actual);
        }
        if (t.entry() != null) {
            history.save(new HistoryRecord(id, t.entry()));
        }
        log.debug("Request {} {} -> {}", id, t.from().label(), to.label());
    }

    @Override
    @Transactional
    public DigestRequest abort(UUID id, String reason) {
        // Re-read until the abort lands or the request is already terminal;
        // an abort must not lose to a concurrent stage transition.
        while (true) {
            LedgerEntry current = requests.findById(id).orElseThrow(() -> new RequestNotFoundException(id));
            if (current.getStatus().isTerminal()) {
                return current.toSnapshot(historyOf(id));
            }
            PipelineState aborted = PipelineState.aborted(current.getStage());
            int updated = requests.compareAndSet(id, current.getState(),
                    aborted.label(), aborted.status(), aborted.stage(),
                    current.getAttemptCount(), null, reason, clock.instant());
            if (updated == 1) {
                log.info("Request {} ABORTED at {}", id, current.getState());
                return get(id);
            }
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<DigestRequest> findReady(Instant now, int limit) {
        return requests.findReady(READY, now, PageRequest.of(0, limit)).stream()
                .map(e -> e.toSnapshot(List.of()))
                .toList();
    }

    private List<HistoryEntry> historyOf(UUID id) {
        return history.findByRequestIdOrderByIdAsc(id).stream()
                .map(HistoryRecord::toEntry)
                .toList();
    }

    private void checkAppend(UUID id, HistoryEntry entry) throws HistoryConflictException {
        if (history.existsByRequestIdAndStageAndAttempt(id, entry.stage(), entry.attempt())) {
            throw new HistoryConflictException(id, HistoryConflictException.Kind.ALREADY_RESOLVED,
                    entry.stage() + " attempt " + entry.attempt() + " already resolved");
        }
        Optional<HistoryRecord> last = history.findFirstByRequestIdOrderByIdDesc(id);
        if (last.isPresent() && entry.position() < last.get().getPosition()) {
            throw new HistoryConflictException(id, HistoryConflictException.Kind.OUT_OF_ORDER,
                    "stage " + entry.stage() + " comes before already recorded stage " + last.get().getStage());
        }
    }
}
