package org.neuralchilli.flotilla.domain;

import java.io.Serializable;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Pool configuration: a share of one backend's capacity, split into per-priority quotas.
 * Pools bound to the same backend are siblings and may lend idle quota to each other's LOW work.
 */
public record Pool(
        String name,
        String backend,
        PoolStatus status,
        Map<Priority, Capacity> quota,
        List<Platform> platforms,
        ExitActionRules defaultExitActions,
        Duration defaultQueueTimeout,
        Duration defaultExecTimeout
) implements Serializable {

    public Pool {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pool name cannot be null or empty");
        }
        if (backend == null || backend.isBlank()) {
            throw new IllegalArgumentException("Pool '" + name + "' must be bound to a backend");
        }

        // Defaults
        if (status == null) {
            status = PoolStatus.ONLINE;
        }
        Map<Priority, Capacity> complete = new EnumMap<>(Priority.class);
        for (Priority priority : Priority.values()) {
            Capacity value = quota != null ? quota.get(priority) : null;
            complete.put(priority, value != null ? value : Capacity.ZERO);
        }
        quota = Map.copyOf(complete);
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
        if (defaultExitActions == null) {
            defaultExitActions = ExitActionRules.NONE;
        }
    }

    public Capacity quotaFor(Priority priority) {
        return quota.get(priority);
    }

    /**
     * Sum of all priority quotas, the pool's whole share of the backend.
     */
    public Capacity totalQuota() {
        Capacity total = Capacity.ZERO;
        for (Capacity value : quota.values()) {
            total = total.plus(value);
        }
        return total;
    }

    public boolean isOnline() {
        return status == PoolStatus.ONLINE;
    }

    public boolean acceptsTask(ResourceRequest request) {
        return platforms.stream().anyMatch(platform -> platform.accepts(request));
    }

    public Pool withStatus(PoolStatus newStatus) {
        return new Pool(name, backend, newStatus, quota, platforms,
                defaultExitActions, defaultQueueTimeout, defaultExecTimeout);
    }
}
