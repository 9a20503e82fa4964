package org.neuralchilli.flotilla.service;

import org.neuralchilli.flotilla.domain.TaskInstance;
import org.neuralchilli.flotilla.domain.TaskStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Current attempt of one task.
 */
public record TaskView(
        String name,
        UUID instanceId,
        boolean lead,
        int retryId,
        TaskStatus status,
        String node,
        Integer exitCode,
        int restartCount,
        String reason,
        Instant startedAt,
        Instant finishedAt
) {

    static TaskView of(TaskInstance task) {
        return new TaskView(
                task.taskName(),
                task.id(),
                task.lead(),
                task.retryId(),
                task.status(),
                task.node(),
                task.exitCode(),
                task.restartCount(),
                task.reason(),
                task.startedAt(),
                task.finishedAt()
        );
    }
}
