package com.arknoa.orchestrator.service;

import com.arknoa.orchestrator.stage.StageDescriptor;
import com.arknoa.orchestrator.stage.StageRegistry;
import com.arknoa.orchestrator.worker.StageWorkerClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * /actuator/health contribution: pings GET {endpoint}/health of every
 * registered stage. DOWN if any stage worker does not answer.
 */
@Component("stageWorkers")
public class StageWorkersHealthIndicator implements HealthIndicator {

    private final StageRegistry     registry;
    private final StageWorkerClient client;

    public StageWorkersHealthIndicator(StageRegistry registry, StageWorkerClient client) {
        this.registry = registry;
        this.client   = client;
    }

    @Override
    public Health health() {
        Map<String, String> stages = new LinkedHashMap<>();
        boolean allUp = true;
        for (StageDescriptor stage : registry.pipeline()) {
            boolean up = client.ping(stage);
            stages.put(stage.name(), up ? "UP" : "DOWN");
            allUp &= up;
        }
        Health.Builder builder = allUp ? Health.up() : Health.down();
        return builder.withDetails(stages).build();
    }
}
