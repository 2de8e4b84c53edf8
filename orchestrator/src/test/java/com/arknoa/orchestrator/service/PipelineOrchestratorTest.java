package com.arknoa.orchestrator.service;

import com.arknoa.orchestrator.MutableClock;
import com.arknoa.orchestrator.bus.InMemoryEventBus;
import com.arknoa.orchestrator.bus.Topics;
import com.arknoa.orchestrator.config.PipelineProperties;
import com.arknoa.orchestrator.ledger.InMemoryLeaseStore;
import com.arknoa.orchestrator.ledger.InMemoryRequestLedger;
import com.arknoa.orchestrator.ledger.RequestNotFoundException;
import com.arknoa.orchestrator.model.*;
import com.arknoa.orchestrator.stage.BackoffPolicy;
import com.arknoa.orchestrator.stage.ConfigurationException;
import com.arknoa.orchestrator.stage.StageDescriptor;
import com.arknoa.orchestrator.stage.StageRegistry;
import com.arknoa.orchestrator.worker.PermanentStageException;
import com.arknoa.orchestrator.worker.StageTimeoutException;
import com.arknoa.orchestrator.worker.StageWorkerClient;
import com.arknoa.orchestrator.worker.TransientStageException;
import com.arknoa.orchestrator.worker.dto.StageWorkRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of the orchestration engine.
 *
 * Ledger, leases, bus and accumulator are the in-memory implementations,
 * the stage workers are scripted, and time only moves when the test says so.
 * The invoker is driven synchronously so every run is deterministic.
 */
class PipelineOrchestratorTest {

    static final List<String> STAGES = List.of("intake", "classifier", "graph_extract", "embeddings",
            "env_synthesis", "safety", "runner", "integrator", "registrar");

    static final Duration TIMEOUT = Duration.ofSeconds(30);
    static final Duration GRACE   = Duration.ofSeconds(10);
    static final Duration BACKOFF = Duration.ofSeconds(1);

    MutableClock               clock;
    InMemoryRequestLedger      ledger;
    InMemoryLeaseStore         leases;
    InMemoryEventBus           bus;
    InMemoryResultAccumulator  accumulator;
    StageRegistry              registry;
    SimpleMeterRegistry        meters;
    ScriptedWorker             worker;
    ThreadPoolExecutor         unusedPool;
    StageInvoker               invoker;
    PipelineOrchestrator       orchestrator;

    @BeforeEach
    void setUp() {
        clock       = MutableClock.startingAt("2025-03-01T10:00:00Z");
        ledger      = new InMemoryRequestLedger(clock);
        leases      = new InMemoryLeaseStore(clock);
        bus         = new InMemoryEventBus(4);
        accumulator = new InMemoryResultAccumulator(clock);
        meters      = new SimpleMeterRegistry();
        worker      = new ScriptedWorker();

        List<StageDescriptor> descriptors = new ArrayList<>();
        for (int i = 0; i < STAGES.size(); i++) {
            descriptors.add(new StageDescriptor(STAGES.get(i), 10 * (i + 1), "http://" + STAGES.get(i) + ":8000",
                    TIMEOUT, 2, BackoffPolicy.fixed(BACKOFF), true));
        }
        registry = new StageRegistry(descriptors);

        unusedPool = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(1));
        invoker = new StageInvoker(registry, bus, worker, new InMemoryInvocationLog(), accumulator,
                meters, clock, unusedPool);
        orchestrator = newInstance("orch-a");
    }

    @AfterEach
    void tearDown() {
        unusedPool.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void happyPath_runsEveryStageInOrder_andAssemblesTheComposite() {
        UUID id = orchestrator.submit("blob://uploads/repo.tar.gz");

        drive(id);

        DigestRequest r = ledger.get(id);
        assertThat(r.state()).isEqualTo(PipelineState.completed());
        assertThat(r.history()).extracting(HistoryEntry::stage).containsExactlyElementsOf(STAGES);
        assertThat(r.history()).allMatch(h -> h.outcome() == StageOutcome.SUCCEEDED && h.attempt() == 1);
        assertNonDecreasingPositions(r);

        CompositeResult result = orchestrator.result(id).orElseThrow();
        assertThat(result.outputs().keySet()).containsExactlyElementsOf(STAGES);
        assertThat(result.outputs().get("embeddings")).isEqualTo("blob://embeddings/" + id);

        // The registrar sees everything produced before it.
        StageWorkRequest registrarCall = worker.lastCall("registrar");
        @SuppressWarnings("unchecked")
        Map<String, String> inputs = (Map<String, String>) registrarCall.stage_config().get("inputs");
        assertThat(inputs).hasSize(8).doesNotContainKey("registrar");

        assertThat(leases.find(id)).isEmpty();
        assertThat(meters.counter("pipeline.requests.terminal", "outcome", "completed").count()).isEqualTo(1.0);
    }

    @Test
    void result_isEmptyUntilCompleted() {
        UUID id = orchestrator.submit("blob://p");
        assertThat(orchestrator.result(id)).isEmpty();
    }

    @Test
    void submit_blankPayload_isRejected() {
        assertThatThrownBy(() -> orchestrator.submit("  ")).isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Retry and failure policy
    // ------------------------------------------------------------------

    @Test
    void classifierFailsTwiceThenSucceeds_threeEntries_andAdvancesToGraphExtract() {
        worker.failNext("classifier",
                new TransientStageException("model warming up"),
                new TransientStageException("model warming up"));
        UUID id = orchestrator.submit("blob://p");

        // Run until classifier has resolved and graph_extract was dispatched.
        for (int i = 0; i < 50 && !ledger.get(id).state().equals(PipelineState.inProgress("graph_extract")); i++) {
            if (step() == 0) {
                clock.advance(BACKOFF);
            }
        }

        DigestRequest r = ledger.get(id);
        assertThat(r.state()).isEqualTo(PipelineState.inProgress("graph_extract"));
        assertThat(r.attemptCount()).isZero();
        List<HistoryEntry> classifier = r.history().stream().filter(h -> h.stage().equals("classifier")).toList();
        assertThat(classifier).extracting(HistoryEntry::attempt).containsExactly(1, 2, 3);
        assertThat(classifier).extracting(HistoryEntry::outcome)
                .containsExactly(StageOutcome.FAILED, StageOutcome.FAILED, StageOutcome.SUCCEEDED);
        assertNonDecreasingPositions(r);
    }

    @Test
    void retryWaitsForBackoffDeadline() {
        worker.failNext("intake", new TransientStageException("flaky"));
        UUID id = orchestrator.submit("blob://p");

        step();
        DigestRequest r = ledger.get(id);
        assertThat(r.state()).isEqualTo(PipelineState.retryPending("intake"));
        assertThat(r.notBefore()).isEqualTo(clock.instant().plus(BACKOFF));

        assertThat(orchestrator.dispatchReady()).isZero();   // still backing off
        clock.advance(BACKOFF);
        assertThat(orchestrator.dispatchReady()).isEqualTo(1);
        assertThat(ledger.get(id).currentAttempt()).isEqualTo(2);
    }

    @Test
    void safetyPermanentFailure_failsRequest_andRunnerNeverRuns() {
        worker.failAlways("safety", new PermanentStageException("disallowed content"));
        UUID id = orchestrator.submit("blob://p");

        drive(id);

        DigestRequest r = ledger.get(id);
        assertThat(r.state().status()).isEqualTo(RequestStatus.FAILED);
        assertThat(r.state().stage()).isEqualTo("safety");
        assertThat(r.failureReason()).contains("safety").contains("disallowed content");
        assertThat(r.history()).extracting(HistoryEntry::stage).doesNotContain("runner");
        assertThat(r.history()).filteredOn(h -> h.stage().equals("safety")).hasSize(1);
        assertThat(worker.callsFor("safety")).isEqualTo(1);
        assertThat(worker.callsFor("runner")).isZero();
        assertThat(meters.counter("pipeline.requests.terminal", "outcome", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void alwaysTimingOutStage_failsAfterExactlyMaxRetriesPlusOneAttempts() {
        worker.failAlways("classifier", new StageTimeoutException("classifier", TIMEOUT, null));
        UUID id = orchestrator.submit("blob://p");

        drive(id);

        DigestRequest r = ledger.get(id);
        assertThat(r.state()).isEqualTo(PipelineState.failed("classifier"));
        assertThat(worker.callsFor("classifier")).isEqualTo(3);
        assertThat(r.history()).filteredOn(h -> h.stage().equals("classifier"))
                .extracting(HistoryEntry::outcome)
                .containsExactly(StageOutcome.TIMED_OUT, StageOutcome.TIMED_OUT, StageOutcome.TIMED_OUT);
        assertThat(r.failureReason()).contains("retries exhausted after 3 attempts");
    }

    // ------------------------------------------------------------------
    // Abort
    // ------------------------------------------------------------------

    @Test
    void abortDuringEmbeddings_lateSuccessIsIgnored() {
        UUID id = orchestrator.submit("blob://p");
        PipelineState embeddingsRunning = PipelineState.inProgress("embeddings");
        for (int i = 0; i < 20 && !ledger.get(id).state().equals(embeddingsRunning); i++) {
            orchestrator.dispatchReady();
            if (ledger.get(id).state().equals(embeddingsRunning)) {
                break;
            }
            runInvoker();
            orchestrator.consumeResults();
        }
        assertThat(ledger.get(id).state()).isEqualTo(embeddingsRunning);

        DigestRequest aborted = orchestrator.abort(id);
        assertThat(aborted.state().status()).isEqualTo(RequestStatus.ABORTED);
        assertThat(leases.find(id)).isEmpty();

        // The worker finishes anyway; its success must not resurrect the request.
        runInvoker();
        orchestrator.consumeResults();
        orchestrator.dispatchReady();

        DigestRequest r = ledger.get(id);
        assertThat(r.state().status()).isEqualTo(RequestStatus.ABORTED);
        assertThat(r.state().stage()).isEqualTo("embeddings");
        assertThat(r.history()).extracting(HistoryEntry::stage).doesNotContain("embeddings", "env_synthesis");
        assertThat(orchestrator.result(id)).isEmpty();
    }

    @Test
    void abortOfFinishedRequest_isANoOp() {
        UUID id = orchestrator.submit("blob://p");
        drive(id);

        DigestRequest r = orchestrator.abort(id);

        assertThat(r.state()).isEqualTo(PipelineState.completed());
        assertThat(meters.counter("pipeline.requests.terminal", "outcome", "aborted").count()).isZero();
    }

    @Test
    void unknownRequest_isNotFound() {
        assertThatThrownBy(() -> orchestrator.status(UUID.randomUUID()))
                .isInstanceOf(RequestNotFoundException.class);
        assertThatThrownBy(() -> orchestrator.abort(UUID.randomUUID()))
                .isInstanceOf(RequestNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Crash recovery and competing instances
    // ------------------------------------------------------------------

    @Test
    void instanceDiesMidStage_sweepTimesOutAttempt_andAnotherInstanceFinishes() {
        UUID id = orchestrator.submit("blob://p");
        orchestrator.dispatchReady();
        // The dispatch is lost together with instance A.
        bus.consume(Topics.INVOKER_GROUP, Topics.dispatch("intake"), 10, e -> { });
        long deadToken = leases.find(id).orElseThrow().token();

        PipelineOrchestrator survivor = newInstance("orch-b");
        clock.advance(TIMEOUT.plus(GRACE));
        assertThat(survivor.sweepExpiredLeases()).isEqualTo(1);

        DigestRequest r = ledger.get(id);
        assertThat(r.state()).isEqualTo(PipelineState.retryPending("intake"));
        assertThat(r.history()).singleElement()
                .satisfies(h -> {
                    assertThat(h.outcome()).isEqualTo(StageOutcome.TIMED_OUT);
                    assertThat(h.error()).isEqualTo("lease expired");
                });

        clock.advance(BACKOFF);
        orchestrator = survivor;
        drive(id);

        r = ledger.get(id);
        assertThat(r.state()).isEqualTo(PipelineState.completed());
        assertThat(r.history().get(1).stage()).isEqualTo("intake");
        assertThat(r.history().get(1).attempt()).isEqualTo(2);

        // A late answer for the lost attempt changes nothing.
        PipelineEvent lost = PipelineEvent.dispatched(id, "intake", 1, "blob://p", deadToken, clock.instant());
        survivor.handle(PipelineEvent.succeeded(lost, "blob://late", clock.instant()));
        assertThat(ledger.get(id).state()).isEqualTo(PipelineState.completed());
    }

    @Test
    void twoInstances_dispatchARequestOnlyOnce() {
        UUID id = orchestrator.submit("blob://p");
        PipelineOrchestrator other = newInstance("orch-b");

        int a = orchestrator.dispatchReady();
        int b = other.dispatchReady();

        assertThat(a + b).isEqualTo(1);
        assertThat(bus.replay(id)).filteredOn(e -> e.type() == EventType.DISPATCHED).hasSize(1);
    }

    @Test
    void startNotice_renewsTheLease() {
        UUID id = orchestrator.submit("blob://p");
        orchestrator.dispatchReady();
        Lease before = leases.find(id).orElseThrow();

        clock.advance(Duration.ofSeconds(20));
        PipelineEvent dispatch = PipelineEvent.dispatched(id, "intake", 1, "blob://p", before.token(), clock.instant());
        orchestrator.handle(dispatch.startedAt(clock.instant()));

        Lease after = leases.find(id).orElseThrow();
        assertThat(after.token()).isEqualTo(before.token());
        assertThat(after.expiresAt()).isEqualTo(clock.instant().plus(TIMEOUT).plus(GRACE));
    }

    @Test
    void sweep_dropsLeftoverLeaseOfRequestThatIsNotRunning() {
        UUID id = orchestrator.submit("blob://p");
        leases.tryAcquire(id, "crashed-before-cas", GRACE);
        clock.advance(GRACE);

        orchestrator.sweepExpiredLeases();

        assertThat(leases.find(id)).isEmpty();
        assertThat(ledger.get(id).state()).isEqualTo(PipelineState.intakePending());
    }

    // ------------------------------------------------------------------
    // Out-of-order history
    // ------------------------------------------------------------------

    @Test
    void movingARunningStage_isRejected_andTheRequestStillCompletes() {
        UUID id = orchestrator.submit("blob://p");
        runUntil(id, PipelineState.inProgress("embeddings"));

        StageDescriptor embeddings = registry.resolve("embeddings");
        assertThatThrownBy(() -> registry.register(new StageDescriptor("embeddings", 15, embeddings.endpoint(),
                embeddings.timeout(), embeddings.maxRetries(), embeddings.backoff(), true)))
                .isInstanceOf(ConfigurationException.class);

        drive(id);

        assertThat(ledger.get(id).state()).isEqualTo(PipelineState.completed());
        assertNonDecreasingPositions(ledger.get(id));
    }

    @Test
    void outcomeRefusedAsOutOfOrder_failsTheRequestInsteadOfLeavingItRunning() throws Exception {
        UUID id = orchestrator.submit("blob://p");
        runUntil(id, PipelineState.inProgress("embeddings"));
        ledger.appendHistory(id, new HistoryEntry("registrar", 90, 1, StageOutcome.SUCCEEDED, null, clock.instant()));

        runInvoker();
        orchestrator.consumeResults();

        DigestRequest r = ledger.get(id);
        assertThat(r.state()).isEqualTo(PipelineState.failed("embeddings"));
        assertThat(r.failureReason()).contains("out of order");
        assertThat(leases.find(id)).isEmpty();
        assertThat(meters.counter("pipeline.requests.terminal", "outcome", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void expiredLeaseWithOutOfOrderHistory_isFailedBySweep_notStranded() throws Exception {
        UUID id = orchestrator.submit("blob://p");
        runUntil(id, PipelineState.inProgress("embeddings"));
        ledger.appendHistory(id, new HistoryEntry("registrar", 90, 1, StageOutcome.SUCCEEDED, null, clock.instant()));
        // The worker never answers.
        bus.consume(Topics.INVOKER_GROUP, Topics.dispatch("embeddings"), 10, e -> { });

        clock.advance(TIMEOUT.plus(GRACE));
        orchestrator.sweepExpiredLeases();

        assertThat(ledger.get(id).state().status()).isEqualTo(RequestStatus.FAILED);
        assertThat(leases.find(id)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Duplicate delivery
    // ------------------------------------------------------------------

    @Test
    void replayedSuccess_neverChangesTheOutcome() {
        UUID id = orchestrator.submit("blob://p");
        drive(id);
        CompositeResult before = orchestrator.result(id).orElseThrow();

        PipelineEvent old = PipelineEvent.dispatched(id, "classifier", 1, "blob://p", 1L, clock.instant());
        orchestrator.handle(PipelineEvent.succeeded(old, "blob://different", clock.instant()));
        accumulator.merge(id, "classifier", "blob://different");

        assertThat(orchestrator.result(id).orElseThrow().outputs()).isEqualTo(before.outputs());
        assertThat(ledger.get(id).history()).hasSize(STAGES.size());
    }

    @Test
    void duplicateTerminalEvent_forRunningAttempt_isAppliedOnce() {
        UUID id = orchestrator.submit("blob://p");
        orchestrator.dispatchReady();
        long token = leases.find(id).orElseThrow().token();
        PipelineEvent dispatch = PipelineEvent.dispatched(id, "intake", 1, "blob://p", token, clock.instant());
        PipelineEvent failed = PipelineEvent.failed(dispatch, "worker 503", false, clock.instant());

        orchestrator.handle(failed);
        orchestrator.handle(failed);

        DigestRequest r = ledger.get(id);
        assertThat(r.attemptCount()).isEqualTo(1);
        assertThat(r.history()).hasSize(1);
    }

    // ------------------------------------------------------------------
    // Harness
    // ------------------------------------------------------------------

    private PipelineOrchestrator newInstance(String instanceId) {
        PipelineProperties props = new PipelineProperties();
        props.setInstanceId(instanceId);
        props.setLeaseGrace(GRACE);
        return new PipelineOrchestrator(ledger, leases, bus, accumulator, registry, props, meters, clock,
                () -> 1.0);
    }

    /** Run the stage workers for every pending dispatch, synchronously. */
    private int runInvoker() {
        int n = 0;
        for (StageDescriptor stage : registry.pipeline()) {
            n += bus.consume(Topics.INVOKER_GROUP, Topics.dispatch(stage.name()), 100,
                    e -> invoker.call(e, registry.resolve(e.stage())));
        }
        return n;
    }

    /** Step one loop at a time until the request is in the given state. */
    private void runUntil(UUID id, PipelineState target) {
        for (int i = 0; i < 20 && !ledger.get(id).state().equals(target); i++) {
            orchestrator.dispatchReady();
            if (ledger.get(id).state().equals(target)) {
                break;
            }
            runInvoker();
            orchestrator.consumeResults();
        }
        assertThat(ledger.get(id).state()).isEqualTo(target);
    }

    /** One round of all loops; returns the amount of work done. */
    private int step() {
        return orchestrator.dispatchReady() + runInvoker() + orchestrator.consumeResults();
    }

    /** Step until the request is terminal, letting backoff deadlines pass when idle. */
    private void drive(UUID id) {
        for (int i = 0; i < 200 && !ledger.get(id).isTerminal(); i++) {
            if (step() == 0) {
                clock.advance(BACKOFF);
            }
        }
    }

    private static void assertNonDecreasingPositions(DigestRequest r) {
        for (int i = 1; i < r.history().size(); i++) {
            assertThat(r.history().get(i).position()).isGreaterThanOrEqualTo(r.history().get(i - 1).position());
        }
    }

    /**
     * Stage worker whose behaviour is scripted per stage. By default every
     * call succeeds with blob://&lt;stage&gt;/&lt;requestId&gt;.
     */
    static class ScriptedWorker implements StageWorkerClient {

        private final Map<String, Deque<RuntimeException>> next   = new ConcurrentHashMap<>();
        private final Map<String, RuntimeException>        always = new ConcurrentHashMap<>();
        private final List<StageWorkRequest>               calls  = new CopyOnWriteArrayList<>();

        void failNext(String stage, RuntimeException... failures) {
            next.computeIfAbsent(stage, s -> new ArrayDeque<>()).addAll(List.of(failures));
        }

        void failAlways(String stage, RuntimeException failure) {
            always.put(stage, failure);
        }

        long callsFor(String stage) {
            return calls.stream().filter(c -> c.stage().equals(stage)).count();
        }

        StageWorkRequest lastCall(String stage) {
            return calls.stream().filter(c -> c.stage().equals(stage))
                    .reduce((first, second) -> second)
                    .orElseThrow();
        }

        @Override
        public String invoke(StageDescriptor stage, StageWorkRequest request) {
            calls.add(request);
            RuntimeException failure = always.get(stage.name());
            if (failure == null) {
                Deque<RuntimeException> queued = next.get(stage.name());
                failure = queued == null ? null : queued.poll();
            }
            if (failure != null) {
                throw failure;
            }
            return "blob://" + stage.name() + "/" + request.request_id();
        }

        @Override
        public boolean ping(StageDescriptor stage) {
            return true;
        }
    }
}
