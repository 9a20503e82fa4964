package org.neuralchilli.flotilla.domain;

/**
 * Lifecycle status of a task instance. Group statuses reuse the same values
 * (a group is never RESCHEDULED).
 */
public enum TaskStatus {
    /**
     * Record created, not yet evaluated against the DAG
     */
    SUBMITTING(0),

    /**
     * Blocked on upstream groups
     */
    WAITING(1),

    /**
     * Upstream satisfied, queued for admission
     */
    PROCESSING(2),

    /**
     * Admitted by the ledger, handed to the gang coordinator
     */
    SCHEDULING(3),

    /**
     * Placed on a node, container starting
     */
    INITIALIZING(4),

    /**
     * User command running
     */
    RUNNING(5),

    /**
     * Finished successfully
     */
    COMPLETED(6),

    /**
     * Instance retired and replaced by a new one
     */
    RESCHEDULED(6),

    /**
     * User command failed
     */
    FAILED(6),

    FAILED_CANCELED(6),
    FAILED_SERVER_ERROR(6),
    FAILED_BACKEND_ERROR(6),
    FAILED_EXEC_TIMEOUT(6),
    FAILED_QUEUE_TIMEOUT(6),
    FAILED_IMAGE_PULL(6),

    /**
     * An upstream group failed; never scheduled
     */
    FAILED_UPSTREAM(6),

    FAILED_EVICTED(6),

    /**
     * Capacity reclaimed by a higher priority admission
     */
    FAILED_PREEMPTED(6),

    FAILED_START_ERROR(6),

    /**
     * Start barrier not satisfied within the start timeout
     */
    FAILED_START_TIMEOUT(6);

    private final int rank;

    TaskStatus(int rank) {
        this.rank = rank;
    }

    /**
     * Check if this instance will not change status again
     */
    public boolean isTerminal() {
        return rank == 6;
    }

    /**
     * Terminal and counted towards group completion. A RESCHEDULED instance has a successor.
     */
    public boolean isGroupFinished() {
        return isTerminal() && this != RESCHEDULED;
    }

    public boolean isFailed() {
        return name().startsWith("FAILED");
    }

    public boolean isActive() {
        return this == INITIALIZING || this == RUNNING;
    }

    public boolean isCanceled() {
        return this == FAILED_CANCELED || this == FAILED_EXEC_TIMEOUT || this == FAILED_QUEUE_TIMEOUT;
    }

    /**
     * Live statuses only move forward; any live status may end in a terminal one.
     */
    public boolean canTransitionTo(TaskStatus next) {
        return !isTerminal() && next.rank > rank;
    }

    /**
     * Retry policy for an instance that ended in this status.
     */
    public RetryPolicy retryPolicy() {
        return switch (this) {
            case FAILED_IMAGE_PULL, FAILED_BACKEND_ERROR, FAILED_EVICTED,
                    FAILED_START_ERROR, FAILED_PREEMPTED -> RetryPolicy.RESCHEDULE;
            case FAILED_SERVER_ERROR -> RetryPolicy.BACKOFF;
            case FAILED_START_TIMEOUT -> RetryPolicy.ADMIN_OVERRIDE;
            default -> RetryPolicy.NEVER;
        };
    }
}
