package org.neuralchilli.flotilla.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * One attempt at running a task. A reschedule retires the instance and creates a
 * new one with the next retry id; a restart re-runs the command on the same instance.
 * Stored in Hazelcast for distributed state management.
 */
public record TaskInstance(
        UUID id,
        UUID workflowId,
        String groupName,
        String taskName,
        boolean lead,
        int retryId,
        TaskStatus status,
        String node,
        String reason,
        Integer exitCode,
        int restartCount,
        Instant createdAt,
        Instant scheduledAt,
        Instant readyAt,
        Instant startedAt,
        Instant finishedAt,
        Instant eligibleAt
) implements Serializable {

    public TaskInstance {
        if (id == null) {
            throw new IllegalArgumentException("Task instance ID cannot be null");
        }
        if (workflowId == null) {
            throw new IllegalArgumentException("Workflow ID cannot be null");
        }
        if (groupName == null || groupName.isBlank()) {
            throw new IllegalArgumentException("Group name cannot be null or empty");
        }
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be null or empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (retryId < 0) {
            throw new IllegalArgumentException("Retry id must be >= 0");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Created at cannot be null");
        }
    }

    /**
     * Create the first instance of a task
     */
    public static TaskInstance create(UUID workflowId, String groupName, String taskName, boolean lead, Instant now) {
        return new TaskInstance(
                UUID.randomUUID(),
                workflowId,
                groupName,
                taskName,
                lead,
                0,
                TaskStatus.SUBMITTING,
                null,
                null,
                null,
                0,
                now,
                null,
                null,
                null,
                null,
                null
        );
    }

    public GroupKey groupKey() {
        return new GroupKey(workflowId, groupName);
    }

    public TaskLookupKey lookupKey() {
        return new TaskLookupKey(workflowId, taskName);
    }

    /**
     * Move to a later live status or to a terminal one.
     *
     * @throws IllegalStateException if the transition goes backwards or leaves a terminal status
     */
    public TaskInstance withStatus(TaskStatus newStatus, Instant now) {
        requireTransition(newStatus);
        Instant scheduled = newStatus == TaskStatus.SCHEDULING ? now : scheduledAt;
        Instant finished = newStatus.isTerminal() ? now : finishedAt;
        return new TaskInstance(
                id, workflowId, groupName, taskName, lead, retryId, newStatus, node, reason, exitCode,
                restartCount, createdAt, scheduled, readyAt, startedAt, finished, eligibleAt
        );
    }

    /**
     * Mark as placed on a node
     */
    public TaskInstance place(String assignedNode) {
        requireTransition(TaskStatus.INITIALIZING);
        return new TaskInstance(
                id, workflowId, groupName, taskName, lead, retryId, TaskStatus.INITIALIZING, assignedNode,
                reason, exitCode, restartCount, createdAt, scheduledAt, readyAt, startedAt, finishedAt, eligibleAt
        );
    }

    /**
     * Record that the container reported ready for the start signal
     */
    public TaskInstance ready(Instant now) {
        return new TaskInstance(
                id, workflowId, groupName, taskName, lead, retryId, status, node, reason, exitCode,
                restartCount, createdAt, scheduledAt, now, startedAt, finishedAt, eligibleAt
        );
    }

    /**
     * Mark as running. A restarted instance is already RUNNING and only gets a new start time.
     */
    public TaskInstance start(Instant now) {
        if (status != TaskStatus.RUNNING) {
            requireTransition(TaskStatus.RUNNING);
        }
        return new TaskInstance(
                id, workflowId, groupName, taskName, lead, retryId, TaskStatus.RUNNING, node, reason, exitCode,
                restartCount, createdAt, scheduledAt, readyAt, now, finishedAt, eligibleAt
        );
    }

    /**
     * Mark as finished with a terminal status
     */
    public TaskInstance finish(TaskStatus terminal, String failureReason, Integer code, Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        requireTransition(terminal);
        return new TaskInstance(
                id, workflowId, groupName, taskName, lead, retryId, terminal, node, failureReason, code,
                restartCount, createdAt, scheduledAt, readyAt, startedAt, now, eligibleAt
        );
    }

    /**
     * Overwrite a cancellation with the outcome the executor reported afterwards.
     */
    public TaskInstance reconcile(TaskStatus reported, String reportedReason, Integer code, Instant now) {
        if (!status.isCanceled()) {
            throw new IllegalStateException("Only canceled instances are reconciled, status is " + status);
        }
        return new TaskInstance(
                id, workflowId, groupName, taskName, lead, retryId, reported, node, reportedReason, code,
                restartCount, createdAt, scheduledAt, readyAt, startedAt, now, eligibleAt
        );
    }

    /**
     * Re-run the user command on the same instance
     */
    public TaskInstance restart() {
        if (!status.isActive()) {
            throw new IllegalStateException("Cannot restart task in status: " + status);
        }
        return new TaskInstance(
                id, workflowId, groupName, taskName, lead, retryId, status, node, reason, exitCode,
                restartCount + 1, createdAt, scheduledAt, null, startedAt, finishedAt, eligibleAt
        );
    }

    /**
     * Create the successor instance after this one was retired. It starts over in SUBMITTING.
     *
     * @param notBefore earliest time the successor may be placed, null for immediately
     */
    public TaskInstance retry(Instant now, Instant notBefore) {
        if (!status.isTerminal()) {
            throw new IllegalStateException("Cannot retry task in status: " + status);
        }
        return new TaskInstance(
                UUID.randomUUID(), // New ID for every attempt
                workflowId,
                groupName,
                taskName,
                lead,
                retryId + 1,
                TaskStatus.SUBMITTING,
                null,
                null,
                null,
                0,
                now,
                null,
                null,
                null,
                null,
                notBefore
        );
    }

    /**
     * Placed, reported READY, and not started since.
     */
    public boolean awaitingStart() {
        return status.isActive() && readyAt != null && (startedAt == null || readyAt.isAfter(startedAt));
    }

    public boolean isFinished() {
        return status.isTerminal();
    }

    public boolean isEligible(Instant now) {
        return eligibleAt == null || !eligibleAt.isAfter(now);
    }

    private void requireTransition(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal transition for task '" + taskName + "': " + status + " -> " + next);
        }
    }
}
