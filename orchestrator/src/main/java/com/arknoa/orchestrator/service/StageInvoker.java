package com.arknoa.orchestrator.service;

import com.arknoa.orchestrator.bus.EventBus;
import com.arknoa.orchestrator.bus.Topics;
import com.arknoa.orchestrator.config.PipelineProperties;
import com.arknoa.orchestrator.model.EventType;
import com.arknoa.orchestrator.model.PipelineEvent;
import com.arknoa.orchestrator.stage.StageDescriptor;
import com.arknoa.orchestrator.stage.StageRegistry;
import com.arknoa.orchestrator.worker.PermanentStageException;
import com.arknoa.orchestrator.worker.StageException;
import com.arknoa.orchestrator.worker.StageTimeoutException;
import com.arknoa.orchestrator.worker.StageWorkerClient;
import com.arknoa.orchestrator.worker.dto.StageWorkRequest;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Turns DISPATCHED events into stage worker calls.
 *
 * Calls run on a bounded pool. The invoker only takes as many dispatches off
 * the bus as the pool has room for; everything else stays on the topic, which
 * is the backpressure towards the orchestrator.
 *
 * For every attempt it emits a DISPATCHED start notice before calling out and
 * exactly one terminal event afterwards, deduplicated through the
 * {@link InvocationLog} so a redelivered dispatch cannot produce a second one.
 */
@Component
public class StageInvoker {

    private static final Logger log = LoggerFactory.getLogger(StageInvoker.class);

    private final StageRegistry      registry;
    private final EventBus           bus;
    private final StageWorkerClient  client;
    private final InvocationLog      invocations;
    private final ResultAccumulator  accumulator;
    private final MeterRegistry      meterRegistry;
    private final Clock              clock;
    private final ThreadPoolExecutor workers;

    @Autowired
    public StageInvoker(StageRegistry registry,
                        EventBus bus,
                        StageWorkerClient client,
                        InvocationLog invocations,
                        ResultAccumulator accumulator,
                        MeterRegistry meterRegistry,
                        Clock clock,
                        PipelineProperties props) {
        this(registry, bus, client, invocations, accumulator, meterRegistry, clock,
                new ThreadPoolExecutor(props.getInvokerThreads(), props.getInvokerThreads(),
                        0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(props.getInvokerQueue())));
    }

    StageInvoker(StageRegistry registry,
                 EventBus bus,
                 StageWorkerClient client,
                 InvocationLog invocations,
                 ResultAccumulator accumulator,
                 MeterRegistry meterRegistry,
                 Clock clock,
                 ThreadPoolExecutor workers) {
        this.registry      = registry;
        this.bus           = bus;
        this.client        = client;
        this.invocations   = invocations;
        this.accumulator   = accumulator;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.workers       = workers;
    }

    // ------------------------------------------------------------------
    // Bus side
    // ------------------------------------------------------------------

    /**
     * Take dispatches off the stage topics, at most as many as the pool can
     * absorb right now.
     *
     * @return number of dispatches accepted
     */
    public int pollDispatches() {
        int accepted = 0;
        for (StageDescriptor stage : registry.pipeline()) {
            int free = freeSlots();
            if (free <= 0) {
                log.debug("Invoker pool full, leaving dispatches on the bus");
                break;
            }
            accepted += bus.consume(Topics.INVOKER_GROUP, Topics.dispatch(stage.name()), free, this::onDispatch);
        }
        return accepted;
    }

    private void onDispatch(PipelineEvent event) {
        if (event.type() != EventType.DISPATCHED) {
            return;
        }
        StageDescriptor stage = registry.resolve(event.stage());
        invoke(event.requestId(), stage, event.payloadRef(), event.attempt(), event.leaseToken());
    }

    /**
     * Queue one attempt on the worker pool.
     *
     * @throws java.util.concurrent.RejectedExecutionException if the pool is
     *         saturated; the dispatch stays uncommitted and comes back later
     */
    public InvocationResult invoke(UUID requestId, StageDescriptor stage, String payloadRef,
                                   int attempt, long leaseToken) {
        PipelineEvent dispatch = PipelineEvent.dispatched(requestId, stage.name(), attempt,
                payloadRef, leaseToken, clock.instant());
        workers.execute(() -> {
            try {
                call(dispatch, stage);
            } catch (Exception e) {
                log.error("Unhandled error invoking {} for request {}: {}",
                        stage.name(), requestId, e.getMessage(), e);
            }
        });
        return InvocationResult.ACCEPTED;
    }

    // ------------------------------------------------------------------
    // Worker side
    // ------------------------------------------------------------------

    /**
     * Run one attempt synchronously and publish its outcome.
     */
    public InvocationResult call(PipelineEvent dispatch, StageDescriptor stage) {
        MDC.put("requestId", dispatch.requestId().toString());
        MDC.put("stage",     stage.name());
        MDC.put("attempt",   String.valueOf(dispatch.attempt()));
        try {
            if (invocations.isRecorded(dispatch.requestId(), stage.name(), dispatch.attempt())) {
                log.info("Attempt {} of {} already has an outcome, not calling the worker again",
                        dispatch.attempt(), stage.name());
                return InvocationResult.DUPLICATE;
            }

            bus.publish(Topics.result(stage.name()), dispatch.startedAt(clock.instant()));

            PipelineEvent outcome = runAttempt(dispatch, stage);

            if (!invocations.recordIfAbsent(dispatch.requestId(), stage.name(), dispatch.attempt(), outcome.type())) {
                log.info("Attempt {} of {} resolved concurrently, dropping {}",
                        dispatch.attempt(), stage.name(), outcome.type());
                return InvocationResult.DUPLICATE;
            }
            bus.publish(Topics.result(stage.name()), outcome);
            return toResult(outcome.type());
        } finally {
            MDC.remove("requestId");
            MDC.remove("stage");
            MDC.remove("attempt");
        }
    }

    private PipelineEvent runAttempt(PipelineEvent dispatch, StageDescriptor stage) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "succeeded";
        try {
            String outputRef = client.invoke(stage, buildRequest(dispatch, stage));
            log.info("{} attempt {} succeeded: {}", stage.name(), dispatch.attempt(), outputRef);
            return PipelineEvent.succeeded(dispatch, outputRef, clock.instant());
        } catch (StageTimeoutException e) {
            status = "timed_out";
            log.warn("{} attempt {} timed out: {}", stage.name(), dispatch.attempt(), e.getMessage());
            return PipelineEvent.timedOut(dispatch, e.getMessage(), clock.instant());
        } catch (PermanentStageException e) {
            status = "failed_permanent";
            log.warn("{} attempt {} failed permanently: {}", stage.name(), dispatch.attempt(), e.getMessage());
            return PipelineEvent.failed(dispatch, e.getMessage(), true, clock.instant());
        } catch (StageException e) {
            status = "failed";
            log.warn("{} attempt {} failed: {}", stage.name(), dispatch.attempt(), e.getMessage());
            return PipelineEvent.failed(dispatch, e.getMessage(), false, clock.instant());
        } catch (RuntimeException e) {
            status = "error";
            log.warn("{} attempt {} failed unexpectedly: {}", stage.name(), dispatch.attempt(), e.toString());
            return PipelineEvent.failed(dispatch, "Unexpected error: " + e, false, clock.instant());
        } finally {
            sample.stop(meterRegistry.timer("pipeline.stage.duration",
                    "stage", stage.name(), "outcome", status));
            meterRegistry.counter("pipeline.stage.invocations",
                    "stage", stage.name(), "outcome", status).increment();
        }
    }

    private StageWorkRequest buildRequest(PipelineEvent dispatch, StageDescriptor stage) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("position",    stage.position());
        config.put("timeout_ms",  stage.timeout().toMillis());
        config.put("max_retries", stage.maxRetries());
        config.put("inputs",      accumulator.outputs(dispatch.requestId()));
        return new StageWorkRequest(dispatch.requestId().toString(), dispatch.payloadRef(),
                stage.name(), dispatch.attempt(), config);
    }

    private static InvocationResult toResult(EventType type) {
        switch (type) {
            case SUCCEEDED: return InvocationResult.SUCCEEDED;
            case TIMED_OUT: return InvocationResult.TIMED_OUT;
            default:        return InvocationResult.FAILED;
        }
    }

    private int freeSlots() {
        int idleThreads = workers.getMaximumPoolSize() - workers.getActiveCount();
        return Math.max(0, idleThreads) + workers.getQueue().remainingCapacity();
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
    }
}
