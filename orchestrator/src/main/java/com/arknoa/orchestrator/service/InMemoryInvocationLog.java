package com.arknoa.orchestrator.service;

import com.arknoa.orchestrator.model.EventType;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryInvocationLog implements InvocationLog {

    private final Map<String, EventType> outcomes = new ConcurrentHashMap<>();

    @Override
    public boolean recordIfAbsent(UUID requestId, String stage, int attempt, EventType outcome) {
        return outcomes.putIfAbsent(key(requestId, stage, attempt), outcome) == null;
    }

    @Override
    public boolean isRecorded(UUID requestId, String stage, int attempt) {
        return outcomes.containsKey(key(requestId, stage, attempt));
    }

    private static String key(UUID requestId, String stage, int attempt) {
        return requestId + "/" + stage + "/" + attempt;
    }
}
