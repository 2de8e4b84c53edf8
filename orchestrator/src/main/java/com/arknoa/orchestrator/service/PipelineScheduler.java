package com.arknoa.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background loops that keep the pipeline moving.
 *
 * Four fixed-delay ticks, each one a short, bounded pass over the DB:
 *   dispatch  ready requests → stage topics
 *   results   result topics → ledger
 *   invoke    stage topics → worker pool
 *   sweep     expired leases → TIMED_OUT
 *
 * fixedDelay waits for the previous run to finish, so a slow tick never
 * overlaps itself. Several instances may run the same ticks; the ledger's
 * conditional writes and the bus partition claims keep them apart.
 */
@Component
@EnableScheduling
public class PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final PipelineOrchestrator orchestrator;
    private final StageInvoker         invoker;

    public PipelineScheduler(PipelineOrchestrator orchestrator, StageInvoker invoker) {
        this.orchestrator = orchestrator;
        this.invoker      = invoker;
    }

    @Scheduled(fixedDelayString = "${pipeline.scheduler.dispatch-delay-ms:1000}")
    public void dispatchTick() {
        try {
            int n = orchestrator.dispatchReady();
            if (n > 0) {
                log.debug("Dispatch tick advanced {} requests", n);
            }
        } catch (Exception e) {
            log.error("Dispatch tick failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${pipeline.scheduler.result-delay-ms:500}")
    public void resultTick() {
        try {
            orchestrator.consumeResults();
        } catch (Exception e) {
            log.error("Result tick failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${pipeline.scheduler.invoke-delay-ms:500}")
    public void invokeTick() {
        try {
            invoker.pollDispatches();
        } catch (Exception e) {
            log.error("Invoke tick failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${pipeline.scheduler.sweep-delay-ms:5000}")
    public void sweepTick() {
        try {
            int n = orchestrator.sweepExpiredLeases();
            if (n > 0) {
                log.info("Recovery sweep processed {} expired leases", n);
            }
        } catch (Exception e) {
            log.error("Recovery sweep failed: {}", e.getMessage(), e);
        }
    }
}
