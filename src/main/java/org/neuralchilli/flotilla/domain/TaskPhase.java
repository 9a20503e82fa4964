package org.neuralchilli.flotilla.domain;

/**
 * Phase reported by a backend executor for a placed task.
 */
public enum TaskPhase {
    /**
     * Container is being created on the node
     */
    INITIALIZING,

    /**
     * Container is up and waiting for the start signal
     */
    READY,

    /**
     * User command is running
     */
    RUNNING,

    /**
     * User command exited with code 0
     */
    SUCCEEDED,

    /**
     * User command exited with a non-zero code
     */
    FAILED,

    IMAGE_PULL_FAILED,
    BACKEND_ERROR,
    EVICTED,
    START_ERROR,
    SERVER_ERROR;

    /**
     * Task status for a phase that ends the instance. Exit codes of FAILED are
     * resolved against exit actions before this applies.
     */
    public TaskStatus terminalStatus() {
        return switch (this) {
            case SUCCEEDED -> TaskStatus.COMPLETED;
            case FAILED -> TaskStatus.FAILED;
            case IMAGE_PULL_FAILED -> TaskStatus.FAILED_IMAGE_PULL;
            case BACKEND_ERROR -> TaskStatus.FAILED_BACKEND_ERROR;
            case EVICTED -> TaskStatus.FAILED_EVICTED;
            case START_ERROR -> TaskStatus.FAILED_START_ERROR;
            case SERVER_ERROR -> TaskStatus.FAILED_SERVER_ERROR;
            default -> throw new IllegalStateException("Phase " + this + " does not end a task");
        };
    }

    public boolean isTerminal() {
        return this != INITIALIZING && this != READY && this != RUNNING;
    }
}
