package org.neuralchilli.flotilla.domain;

/**
 * Derived status of a workflow.
 */
public enum WorkflowStatus {
    /**
     * Accepted, no group has started yet
     */
    PENDING,

    /**
     * At least one group is initializing or running
     */
    RUNNING,

    /**
     * Started before, nothing running right now, not finished
     */
    WAITING,

    COMPLETED,
    FAILED,

    /**
     * Rejected at submission; never entered scheduling
     */
    FAILED_SUBMISSION,

    FAILED_CANCELED,
    FAILED_SERVER_ERROR,
    FAILED_BACKEND_ERROR,
    FAILED_EXEC_TIMEOUT,
    FAILED_QUEUE_TIMEOUT,
    FAILED_IMAGE_PULL,
    FAILED_UPSTREAM,
    FAILED_EVICTED,
    FAILED_PREEMPTED,
    FAILED_START_ERROR,
    FAILED_START_TIMEOUT;

    public boolean isFinished() {
        return this == COMPLETED || isFailed();
    }

    public boolean isFailed() {
        return name().startsWith("FAILED");
    }

    /**
     * Workflow status carrying the same reason code as a failed group.
     */
    public static WorkflowStatus fromGroupFailure(TaskStatus groupStatus) {
        if (!groupStatus.isFailed()) {
            throw new IllegalArgumentException("Not a failure status: " + groupStatus);
        }
        return valueOf(groupStatus.name());
    }

    /**
     * Task status applied to live tasks when the workflow is stopped with this status.
     */
    public TaskStatus toTaskStatus() {
        if (!isFailed() || this == FAILED_SUBMISSION) {
            throw new IllegalStateException("No task status for workflow status " + this);
        }
        return TaskStatus.valueOf(name());
    }
}
