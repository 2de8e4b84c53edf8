package com.arknoa.orchestrator.stage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process stage registry.
 *
 * Read-mostly: resolve() and pipeline() read the live map, so a stage added or
 * replaced through {@link #register} is visible to the very next dispatch
 * without a restart. This is also how a newly generated stage joins the
 * pipeline: a descriptor insert, never code.
 */
public class StageRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageRegistry.class);

    private final Map<String, StageDescriptor> stages = new ConcurrentHashMap<>();

    /**
     * @throws ConfigurationException if the set is empty or any descriptor is
     *                                invalid; the application fails to start
     */
    public StageRegistry(Collection<StageDescriptor> descriptors) {
        if (descriptors.isEmpty()) {
            throw new ConfigurationException("Pipeline declares no stages");
        }
        for (StageDescriptor d : descriptors) {
            register(d);
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public StageDescriptor resolve(String name) {
        StageDescriptor d = stages.get(name);
        if (d == null) {
            throw new StageNotFoundException(name);
        }
        return d;
    }

    public Optional<StageDescriptor> find(String name) {
        return Optional.ofNullable(stages.get(name));
    }

    /** All stages in pipeline order. */
    public List<StageDescriptor> pipeline() {
        return stages.values().stream()
                .sorted(Comparator.comparingInt(StageDescriptor::position))
                .toList();
    }

    public StageDescriptor first() {
        return pipeline().get(0);
    }

    /** The stage after {@code name}, empty if {@code name} is the last one. */
    public Optional<StageDescriptor> next(String name) {
        int position = resolve(name).position();
        return pipeline().stream()
                .filter(d -> d.position() > position)
                .findFirst();
    }

    public boolean isLast(String name) {
        return next(name).isEmpty();
    }

    // ------------------------------------------------------------------
    // Updates
    // ------------------------------------------------------------------

    /**
     * Add a stage or replace the descriptor of an existing one. A registered
     * stage keeps its position: requests already past it have history that
     * a move would put out of order.
     *
     * @throws ConfigurationException if the descriptor is invalid, moves an
     *                                existing stage, or its position is taken
     *                                by another stage
     */
    public synchronized StageDescriptor register(StageDescriptor descriptor) {
        StageDescriptor d = descriptor.validated();
        StageDescriptor current = stages.get(d.name());
        if (current != null && current.position() != d.position()) {
            throw new ConfigurationException("Stage '" + d.name() + "' is at position " + current.position()
                    + " and cannot be moved to " + d.position());
        }
        stages.values().stream()
                .filter(other -> other.position() == d.position() && !other.name().equals(d.name()))
                .findFirst()
                .ifPresent(other -> {
                    throw new ConfigurationException("Stage '" + d.name() + "' position "
                            + d.position() + " is already taken by '" + other.name() + "'");
                });
        StageDescriptor previous = stages.put(d.name(), d);
        log.info("{} stage '{}' at position {} (timeout={}, maxRetries={}, endpoint={})",
                previous == null ? "Registered" : "Updated",
                d.name(), d.position(), d.timeout(), d.maxRetries(), d.endpoint());
        return d;
    }
}
