package org.neuralchilli.flotilla.domain;

import java.io.Serial;
import java.io.Serializable;
import java.util.UUID;

/**
 * Phase change reported by a backend executor for one task instance.
 */
public final class TaskEvent implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final UUID taskInstanceId;
    private final TaskPhase phase;
    private final String reason;
    private final Integer exitCode;
    private final String node;

    public TaskEvent(UUID taskInstanceId, TaskPhase phase, String reason, Integer exitCode, String node) {
        if (taskInstanceId == null) {
            throw new IllegalArgumentException("Task instance ID cannot be null");
        }
        if (phase == null) {
            throw new IllegalArgumentException("Phase cannot be null");
        }
        this.taskInstanceId = taskInstanceId;
        this.phase = phase;
        this.reason = reason;
        this.exitCode = exitCode;
        this.node = node;
    }

    public UUID taskInstanceId() {
        return taskInstanceId;
    }

    public TaskPhase phase() {
        return phase;
    }

    public String reason() {
        return reason;
    }

    public Integer exitCode() {
        return exitCode;
    }

    public String node() {
        return node;
    }

    public static TaskEvent of(UUID taskInstanceId, TaskPhase phase) {
        return new TaskEvent(taskInstanceId, phase, null, null, null);
    }

    public static TaskEvent exited(UUID taskInstanceId, int exitCode) {
        TaskPhase phase = exitCode == 0 ? TaskPhase.SUCCEEDED : TaskPhase.FAILED;
        return new TaskEvent(taskInstanceId, phase, null, exitCode, null);
    }

    public static TaskEvent failed(UUID taskInstanceId, TaskPhase phase, String reason) {
        return new TaskEvent(taskInstanceId, phase, reason, null, null);
    }

    @Override
    public String toString() {
        return "TaskEvent[taskInstanceId=" + taskInstanceId + ", phase=" + phase +
                ", reason=" + reason + ", exitCode=" + exitCode + ", node=" + node + "]";
    }
}
