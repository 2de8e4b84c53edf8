package com.arknoa.orchestrator.service;

import com.arknoa.orchestrator.model.CompositeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryResultAccumulator implements ResultAccumulator {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResultAccumulator.class);

    private final Map<UUID, Map<String, String>> outputs = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryResultAccumulator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean merge(UUID requestId, String stage, String outputRef) {
        Map<String, String> stages = outputs.computeIfAbsent(requestId, id -> new ConcurrentHashMap<>());
        String existing = stages.putIfAbsent(stage, outputRef);
        if (existing == null) {
            return true;
        }
        if (!existing.equals(outputRef)) {
            log.warn("Ignoring second output for {} stage {}: kept {}, got {}",
                    requestId, stage, existing, outputRef);
        }
        return false;
    }

    @Override
    public Map<String, String> outputs(UUID requestId) {
        return Map.copyOf(outputs.getOrDefault(requestId, Map.of()));
    }

    @Override
    public CompositeResult composite(UUID requestId, List<String> order) {
        Map<String, String> merged = outputs.getOrDefault(requestId, Map.of());
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String stage : order) {
            String ref = merged.get(stage);
            if (ref != null) {
                ordered.put(stage, ref);
            }
        }
        return new CompositeResult(requestId, ordered, clock.instant());
    }
}
