package org.neuralchilli.flotilla.domain;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted state of one submitted workflow. The status is derived from its groups;
 * {@code cancelStatus} pins the final status once the workflow has been stopped.
 * Stored in Hazelcast for distributed state management.
 */
public record WorkflowRecord(
        UUID id,
        String name,
        String user,
        String pool,
        Priority priority,
        long sequence,
        WorkflowSpec spec,
        WorkflowStatus status,
        Instant submittedAt,
        Instant startedAt,
        Instant finishedAt,
        Duration queueTimeout,
        Duration execTimeout,
        String canceledBy,
        WorkflowStatus cancelStatus,
        String failureReason
) implements Serializable {

    public WorkflowRecord {
        if (id == null) {
            throw new IllegalArgumentException("Workflow ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workflow name cannot be null or empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (submittedAt == null) {
            throw new IllegalArgumentException("Submitted at cannot be null");
        }
        if (spec == null && status != WorkflowStatus.FAILED_SUBMISSION) {
            throw new IllegalArgumentException("Only rejected submissions may omit the workflow spec");
        }
        if (priority == null) {
            priority = Priority.NORMAL;
        }
    }

    /**
     * Create an accepted workflow
     */
    public static WorkflowRecord create(
            WorkflowSpec spec,
            String user,
            long sequence,
            Instant now,
            Duration queueTimeout,
            Duration execTimeout
    ) {
        return new WorkflowRecord(
                UUID.randomUUID(),
                spec.name(),
                user,
                spec.pool(),
                spec.priority(),
                sequence,
                spec,
                WorkflowStatus.PENDING,
                now,
                null,
                null,
                queueTimeout,
                execTimeout,
                null,
                null,
                null
        );
    }

    /**
     * Create the history entry of a rejected submission
     */
    public static WorkflowRecord rejected(
            String name,
            String pool,
            Priority priority,
            WorkflowSpec spec,
            String user,
            long sequence,
            Instant now,
            String reason
    ) {
        return new WorkflowRecord(
                UUID.randomUUID(),
                name == null || name.isBlank() ? "unnamed" : name,
                user,
                pool,
                priority,
                sequence,
                spec,
                WorkflowStatus.FAILED_SUBMISSION,
                now,
                null,
                now,
                null,
                null,
                null,
                null,
                reason
        );
    }

    /**
     * Apply a newly derived status. The first RUNNING sets the start time,
     * a finished status sets the end time.
     */
    public WorkflowRecord withStatus(WorkflowStatus newStatus, String reason, Instant now) {
        Instant started = startedAt == null && newStatus == WorkflowStatus.RUNNING ? now : startedAt;
        Instant finished = newStatus.isFinished() && finishedAt == null ? now : finishedAt;
        return new WorkflowRecord(
                id, name, user, pool, priority, sequence, spec, newStatus, submittedAt, started, finished,
                queueTimeout, execTimeout, canceledBy, cancelStatus, reason != null ? reason : failureReason
        );
    }

    /**
     * Record who stopped the workflow and with which status
     */
    public WorkflowRecord cancel(String by, WorkflowStatus stopStatus) {
        if (!stopStatus.isFailed() || stopStatus == WorkflowStatus.FAILED_SUBMISSION) {
            throw new IllegalArgumentException("Not a stop status: " + stopStatus);
        }
        return new WorkflowRecord(
                id, name, user, pool, priority, sequence, spec, status, submittedAt, startedAt, finishedAt,
                queueTimeout, execTimeout, by, stopStatus, failureReason
        );
    }

    public boolean isFinished() {
        return status.isFinished();
    }

    public boolean hasStarted() {
        return startedAt != null;
    }
}
