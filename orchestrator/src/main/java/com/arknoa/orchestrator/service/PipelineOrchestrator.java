package com.arknoa.orchestrator.service;

import com.arknoa.orchestrator.bus.EventBus;
import com.arknoa.orchestrator.bus.Topics;
import com.arknoa.orchestrator.config.PipelineProperties;
import com.arknoa.orchestrator.ledger.HistoryConflictException;
import com.arknoa.orchestrator.ledger.LeaseExpiredException;
import com.arknoa.orchestrator.ledger.LeaseStore;
import com.arknoa.orchestrator.ledger.RequestLedger;
import com.arknoa.orchestrator.ledger.RequestNotFoundException;
import com.arknoa.orchestrator.ledger.StaleTransitionException;
import com.arknoa.orchestrator.ledger.Transition;
import com.arknoa.orchestrator.model.*;
import com.arknoa.orchestrator.stage.StageDescriptor;
import com.arknoa.orchestrator.stage.StageRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Drives every request through the stage pipeline.
 *
 * Holds no state of its own: each decision starts from a fresh ledger read
 * and ends in a conditional ledger write, so any number of instances can run
 * side by side. Ownership of a request while a stage runs is a lease; an
 * instance that dies mid-stage simply lets its lease expire and the sweep
 * hands the request back to the retry rule.
 *
 * Lifecycle of one stage:
 *  1. dispatchReady()  lease + CAS to &lt;stage&gt;_IN_PROGRESS + DISPATCHED event
 *  2. handle(DISPATCHED) from the invoker: renew the lease
 *  3. handle(SUCCEEDED)  merge output, &lt;stage&gt;_SUCCEEDED, advance at once
 *     handle(FAILED / TIMED_OUT)  RETRY_PENDING with backoff, or FAILED
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final RequestLedger      ledger;
    private final LeaseStore         leases;
    private final EventBus           bus;
    private final ResultAccumulator  accumulator;
    private final StageRegistry      registry;
    private final PipelineProperties props;
    private final MeterRegistry      meterRegistry;
    private final Clock              clock;
    private final DoubleSupplier     random;
    private final String             holderId;

    @Autowired
    public PipelineOrchestrator(RequestLedger ledger,
                                LeaseStore leases,
                                EventBus bus,
                                ResultAccumulator accumulator,
                                StageRegistry registry,
                                PipelineProperties props,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this(ledger, leases, bus, accumulator, registry, props, meterRegistry, clock,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public PipelineOrchestrator(RequestLedger ledger,
                                LeaseStore leases,
                                EventBus bus,
                                ResultAccumulator accumulator,
                                StageRegistry registry,
                                PipelineProperties props,
                                MeterRegistry meterRegistry,
                                Clock clock,
                                DoubleSupplier random) {
        this.ledger        = ledger;
        this.leases        = leases;
        this.bus           = bus;
        this.accumulator   = accumulator;
        this.registry      = registry;
        this.props         = props;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.random        = random;
        this.holderId      = props.getInstanceId() != null && !props.getInstanceId().isBlank()
                ? props.getInstanceId()
                : "orchestrator-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // ------------------------------------------------------------------
    // Control API
    // ------------------------------------------------------------------

    /**
     * Accept a new digest request. It sits in INTAKE_PENDING until the next
     * dispatch tick sends it to the first stage.
     */
    public UUID submit(String payloadRef) {
        if (payloadRef == null || payloadRef.isBlank()) {
            throw new IllegalArgumentException("payloadRef must not be blank");
        }
        UUID id = ledger.create(payloadRef);
        log.info("Request {} submitted (payload={})", id, payloadRef);
        return id;
    }

    public DigestRequest status(UUID id) {
        return ledger.get(id);
    }

    /**
     * Stop a request wherever it is. Results still in flight are ignored when
     * they arrive. Aborting a finished request changes nothing.
     */
    public DigestRequest abort(UUID id) {
        boolean wasTerminal = ledger.get(id).isTerminal();
        DigestRequest after = ledger.abort(id, "aborted by operator");
        leases.forceRelease(id);
        if (!wasTerminal && after.state().status() == RequestStatus.ABORTED) {
            countTerminal(RequestStatus.ABORTED);
            log.info("Request {} ABORTED", id);
        }
        return after;
    }

    /** The integrated output, present only once the request is COMPLETED. */
    public Optional<CompositeResult> result(UUID id) {
        DigestRequest r = ledger.get(id);
        if (r.state().status() != RequestStatus.COMPLETED) {
            return Optional.empty();
        }
        return Optional.of(accumulator.composite(id, completedStages(r)));
    }

    /** Retained bus events of the request, oldest first. */
    public List<PipelineEvent> events(UUID id) {
        ledger.get(id);   // 404 for unknown ids rather than an empty list
        return bus.replay(id);
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    /**
     * One dispatch tick: move every ready request one step forward.
     *
     * @return number of requests that were dispatched or completed
     */
    public int dispatchReady() {
        int advanced = 0;
        for (DigestRequest ready : ledger.findReady(clock.instant(), props.getDispatchBatch())) {
            try {
                if (advance(ready.id())) {
                    advanced++;
                }
            } catch (RuntimeException e) {
                log.error("Dispatch of request {} failed: {}", ready.id(), e.getMessage(), e);
            }
        }
        return advanced;
    }

    /**
     * Take a ready request into its next state: the first stage, the next
     * stage, a retry of the same stage, or COMPLETED after the last stage.
     *
     * @return true if this call moved the request
     */
    boolean advance(UUID id) {
        for (int round = 0; round <= props.getMaxCasRetries(); round++) {
            DigestRequest r = ledger.get(id);
            if (!isDue(r)) {
                return false;
            }
            Optional<StageDescriptor> target = targetOf(r);
            Duration ttl = target.map(this::leaseTtl).orElse(props.getLeaseGrace());

            Optional<Lease> acquired = leases.tryAcquire(id, holderId, ttl);
            if (acquired.isEmpty()) {
                log.debug("Request {} is leased elsewhere, skipping", id);
                return false;
            }
            Lease lease = acquired.get();

            // Re-read under the lease; the decision must be made on current state.
            r = ledger.get(id);
            if (!isDue(r)) {
                leases.release(id, lease.token());
                return false;
            }
            target = targetOf(r);
            try {
                if (target.isEmpty()) {
                    complete(r);
                    leases.release(id, lease.token());
                } else {
                    dispatch(r, target.get(), lease);
                }
                return true;
            } catch (StaleTransitionException e) {
                leases.release(id, lease.token());
                log.debug("Request {} moved on before dispatch ({}), re-reading", id, e.getMessage());
            }
        }
        log.warn("Request {} not dispatched: state kept changing under {} attempts", id,
                props.getMaxCasRetries() + 1);
        return false;
    }

    private void dispatch(DigestRequest r, StageDescriptor stage, Lease lease) throws StaleTransitionException {
        Transition t = Transition.of(r.state(), PipelineState.inProgress(stage.name()));
        int attempt = t.resolveAttemptCount(r.attemptCount()) + 1;
        ledger.transition(r.id(), r.state(), t.to());

        PipelineEvent event = PipelineEvent.dispatched(r.id(), stage.name(), attempt,
                r.payloadRef(), lease.token(), clock.instant());
        bus.publish(Topics.dispatch(stage.name()), event);
        log.info("Request {} dispatched to {} (attempt {}/{}, lease token {})",
                r.id(), stage.name(), attempt, stage.maxRetries() + 1, lease.token());
    }

    private void complete(DigestRequest r) throws StaleTransitionException {
        ledger.transition(r.id(), r.state(), PipelineState.completed());
        countTerminal(RequestStatus.COMPLETED);
        log.info("Request {} COMPLETED after {} stages", r.id(), completedStages(r).size());
    }

    // ------------------------------------------------------------------
    // Result handling
    // ------------------------------------------------------------------

    /** Drain the result topics of every stage. Called by the scheduler. */
    public int consumeResults() {
        int handled = 0;
        for (StageDescriptor stage : registry.pipeline()) {
            handled += bus.consume(Topics.ORCHESTRATOR_GROUP, Topics.result(stage.name()),
                    props.getConsumeBatch(), this::handle);
        }
        return handled;
    }

    /**
     * Apply one event from the invoker. Events for finished requests, other
     * stages or older attempts are replays and are dropped.
     */
    public void handle(PipelineEvent event) {
        MDC.put("requestId", event.requestId().toString());
        MDC.put("stage",     event.stage());
        MDC.put("attempt",   String.valueOf(event.attempt()));
        try {
            for (int round = 0; round <= props.getMaxCasRetries(); round++) {
                try {
                    handleOnce(event);
                    return;
                } catch (StaleTransitionException e) {
                    log.debug("Stale write while handling {}: {}", event.type(), e.getMessage());
                }
            }
            log.warn("Gave up on {} for {} after {} stale writes", event.type(), event.requestId(),
                    props.getMaxCasRetries() + 1);
        } catch (RequestNotFoundException e) {
            log.warn("Dropping {} for unknown request {}", event.type(), event.requestId());
        } finally {
            MDC.remove("requestId");
            MDC.remove("stage");
            MDC.remove("attempt");
        }
    }

    private void handleOnce(PipelineEvent event) throws StaleTransitionException {
        DigestRequest r = ledger.get(event.requestId());
        if (r.isTerminal()) {
            log.debug("Ignoring {} for {} request {}", event.type(), r.state().label(), r.id());
            return;
        }
        PipelineState running = PipelineState.inProgress(event.stage());
        if (!r.state().equals(running) || r.currentAttempt() != event.attempt()) {
            log.debug("Ignoring stale {} ({} attempt {}); request is {} attempt {}",
                    event.type(), event.stage(), event.attempt(), r.state().label(), r.currentAttempt());
            return;
        }
        StageDescriptor stage = registry.resolve(event.stage());

        switch (event.type()) {
            case DISPATCHED -> renewLease(event, stage);
            case SUCCEEDED  -> onSucceeded(r, stage, event);
            case FAILED     -> {
                if (event.permanent()) {
                    onPermanentFailure(r, stage, event);
                } else {
                    onRetryableFailure(r, stage, event, StageOutcome.FAILED);
                }
            }
            case TIMED_OUT  -> onRetryableFailure(r, stage, event, StageOutcome.TIMED_OUT);
        }
    }

    private void renewLease(PipelineEvent event, StageDescriptor stage) {
        try {
            leases.renew(event.requestId(), event.leaseToken(), leaseTtl(stage));
        } catch (LeaseExpiredException e) {
            log.warn("{}; the recovery sweep will time this attempt out", e.getMessage());
        }
    }

    private void onSucceeded(DigestRequest r, StageDescriptor stage, PipelineEvent event)
            throws StaleTransitionException {
        Instant now = clock.instant();
        accumulator.merge(r.id(), stage.name(), event.payloadRef());

        HistoryEntry entry = new HistoryEntry(stage.name(), stage.position(), event.attempt(),
                StageOutcome.SUCCEEDED, null, now);
        if (!apply(r, Transition.of(r.state(), PipelineState.succeeded(stage.name())).recording(entry),
                event.leaseToken())) {
            return;
        }
        leases.release(r.id(), event.leaseToken());
        log.info("Request {} {} succeeded on attempt {} (output={})",
                r.id(), stage.name(), event.attempt(), event.payloadRef());

        try {
            advance(r.id());
        } catch (RuntimeException e) {
            log.warn("Request {} not advanced past {} right away, next dispatch tick will: {}",
                    r.id(), stage.name(), e.getMessage());
        }
    }

    private void onPermanentFailure(DigestRequest r, StageDescriptor stage, PipelineEvent event)
            throws StaleTransitionException {
        String reason = stage.name() + ": " + event.error();
        HistoryEntry entry = new HistoryEntry(stage.name(), stage.position(), event.attempt(),
                StageOutcome.FAILED, event.error(), clock.instant());
        if (!apply(r, Transition.fail(r.state(), r.attemptCount() + 1, reason).recording(entry), event.leaseToken())) {
            return;
        }
        leases.release(r.id(), event.leaseToken());
        countTerminal(RequestStatus.FAILED);
        log.error("Request {} FAILED at {} (permanent): {}", r.id(), stage.name(), event.error());
    }

    private void onRetryableFailure(DigestRequest r, StageDescriptor stage, PipelineEvent event,
                                    StageOutcome outcome) throws StaleTransitionException {
        Instant now    = clock.instant();
        int     failed = r.attemptCount() + 1;
        HistoryEntry entry = new HistoryEntry(stage.name(), stage.position(), event.attempt(),
                outcome, event.error(), now);

        if (failed <= stage.maxRetries()) {
            Duration delay = stage.backoff().delayFor(failed, random.getAsDouble());
            if (!apply(r, Transition.retry(r.state(), failed, now.plus(delay)).recording(entry), event.leaseToken())) {
                return;
            }
            leases.release(r.id(), event.leaseToken());
            log.warn("Request {} {} attempt {}/{} {}: {}; retrying in {}",
                    r.id(), stage.name(), event.attempt(), stage.maxRetries() + 1,
                    outcome, event.error(), delay);
            return;
        }

        String reason = stage.name() + ": retries exhausted after " + failed + " attempts, last "
                + outcome + ": " + event.error();
        if (!apply(r, Transition.fail(r.state(), failed, reason).recording(entry), event.leaseToken())) {
            return;
        }
        leases.release(r.id(), event.leaseToken());
        countTerminal(RequestStatus.FAILED);
        log.error("Request {} FAILED at {}: {}", r.id(), stage.name(), reason);
    }

    /**
     * Write the outcome of the running attempt.
     *
     * @return false if the outcome was not applied: either it was already
     *         recorded (duplicate delivery), or the history refused it as out of
     *         order, in which case the request has been FAILED here
     */
    private boolean apply(DigestRequest r, Transition t, long leaseToken) throws StaleTransitionException {
        try {
            ledger.transition(r.id(), t);
            return true;
        } catch (HistoryConflictException e) {
            if (e.isDuplicate()) {
                log.warn("Duplicate outcome for {}: {}", r.id(), e.getMessage());
                return false;
            }
            failOutOfOrder(r, t, leaseToken, e);
            return false;
        }
    }

    private void failOutOfOrder(DigestRequest r, Transition t, long leaseToken, HistoryConflictException cause)
            throws StaleTransitionException {
        String stage  = t.from().stage();
        String reason = stage + ": history out of order, " + cause.getMessage();
        Transition fail = Transition.fail(t.from(), t.resolveAttemptCount(r.attemptCount()), reason);
        try {
            ledger.transition(r.id(), fail);
        } catch (HistoryConflictException e) {
            throw new IllegalStateException("Transition without history entry reported a history conflict", e);
        }
        leases.release(r.id(), leaseToken);
        countTerminal(RequestStatus.FAILED);
        log.error("Request {} FAILED at {}: {}", r.id(), stage, reason);
    }

    // ------------------------------------------------------------------
    // Recovery
    // ------------------------------------------------------------------

    /**
     * Time out attempts whose lease ran out: the worker is gone, or the
     * instance that dispatched it died. Leases left behind by requests that
     * are no longer running are dropped.
     *
     * @return number of expired leases processed
     */
    public int sweepExpiredLeases() {
        List<Lease> expired = leases.findExpired(clock.instant(), props.getSweepBatch());
        for (Lease lease : expired) {
            try {
                recover(lease);
            } catch (RuntimeException e) {
                log.error("Recovery of request {} failed: {}", lease.requestId(), e.getMessage(), e);
            }
        }
        return expired.size();
    }

    private void recover(Lease lease) {
        DigestRequest r;
        try {
            r = ledger.get(lease.requestId());
        } catch (RequestNotFoundException e) {
            leases.release(lease.requestId(), lease.token());
            return;
        }
        if (r.state().status() == RequestStatus.IN_PROGRESS) {
            log.warn("Lease {} on request {} expired during {} attempt {}",
                    lease.token(), r.id(), r.state().stage(), r.currentAttempt());
            PipelineEvent timeout = new PipelineEvent(r.id(), r.state().stage(), r.currentAttempt(),
                    EventType.TIMED_OUT, null, "lease expired", false, lease.token(), clock.instant());
            handle(timeout);
        }
        // No-op when the handler above already released it.
        leases.release(lease.requestId(), lease.token());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private boolean isDue(DigestRequest r) {
        RequestStatus status = r.state().status();
        return status.isReady() && (r.notBefore() == null || !r.notBefore().isAfter(clock.instant()));
    }

    /** Stage the request enters next; empty means the pipeline is done. */
    private Optional<StageDescriptor> targetOf(DigestRequest r) {
        PipelineState s = r.state();
        switch (s.status()) {
            case INTAKE_PENDING:
                return Optional.of(registry.first());
            case RETRY_PENDING:
                return Optional.of(registry.resolve(s.stage()));
            case SUCCEEDED:
                return registry.next(s.stage());
            default:
                throw new IllegalStateException("Request " + r.id() + " is not ready: " + s.label());
        }
    }

    private Duration leaseTtl(StageDescriptor stage) {
        return stage.timeout().plus(props.getLeaseGrace());
    }

    private static List<String> completedStages(DigestRequest r) {
        return r.history().stream()
                .filter(h -> h.outcome() == StageOutcome.SUCCEEDED)
                .map(HistoryEntry::stage)
                .toList();
    }

    private void countTerminal(RequestStatus outcome) {
        meterRegistry.counter("pipeline.requests.terminal", "outcome", outcome.name().toLowerCase()).increment();
    }
}
