package com.arknoa.orchestrator.bus;

import com.arknoa.orchestrator.model.PipelineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event bus held in memory, with the same partition / offset semantics as
 * {@link JpaEventBus}. Consumers of one group share a partition through a
 * try-lock, the in-process counterpart of SKIP LOCKED.
 */
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final int partitions;

    private final Map<String, List<List<PipelineEvent>>> topics  = new ConcurrentHashMap<>();
    private final Map<String, Integer>                   offsets = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock>             claims  = new ConcurrentHashMap<>();
    private final List<PipelineEvent>                    journal = new ArrayList<>();

    public InMemoryEventBus(int partitions) {
        if (partitions < 1) {
            throw new IllegalArgumentException("partitions must be >= 1");
        }
        this.partitions = partitions;
    }

    @Override
    public void publish(String topic, PipelineEvent event) {
        List<PipelineEvent> partition = partitionsOf(topic).get(Topics.partitionFor(event.requestId(), partitions));
        synchronized (partition) {
            partition.add(event);
        }
        synchronized (journal) {
            journal.add(event);
        }
    }

    @Override
    public int consume(String group, String topic, int maxEvents, EventHandler handler) {
        List<List<PipelineEvent>> parts = partitionsOf(topic);
        int handled = 0;
        for (int p = 0; p < partitions && handled < maxEvents; p++) {
            String key = group + "|" + topic + "|" + p;
            ReentrantLock claim = claims.computeIfAbsent(key, k -> new ReentrantLock());
            if (!claim.tryLock()) {
                continue;
            }
            try {
                handled += drain(key, parts.get(p), maxEvents - handled, handler);
            } finally {
                claim.unlock();
            }
        }
        return handled;
    }

    private int drain(String key, List<PipelineEvent> partition, int budget, EventHandler handler) {
        int offset = offsets.getOrDefault(key, 0);
        int handled = 0;
        while (handled < budget) {
            PipelineEvent next;
            synchronized (partition) {
                if (offset >= partition.size()) {
                    break;
                }
                next = partition.get(offset);
            }
            try {
                handler.handle(next);
            } catch (RuntimeException e) {
                log.warn("Handler failed on {} ({} attempt {} {}), will redeliver: {}",
                        key, next.stage(), next.attempt(), next.type(), e.getMessage());
                break;
            }
            offset++;
            handled++;
            offsets.put(key, offset);
        }
        return handled;
    }

    @Override
    public List<PipelineEvent> replay(UUID requestId) {
        synchronized (journal) {
            return journal.stream()
                    .filter(e -> e.requestId().equals(requestId))
                    .toList();
        }
    }

    private List<List<PipelineEvent>> partitionsOf(String topic) {
        return topics.computeIfAbsent(topic, t -> {
            List<List<PipelineEvent>> parts = new ArrayList<>(partitions);
            for (int i = 0; i < partitions; i++) {
                parts.add(new ArrayList<>());
            }
            return parts;
        });
    }
}
