package org.neuralchilli.flotilla.domain;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

/**
 * Index key from (workflow, task name) to the task's current instance id.
 *
 * Must be a plain class (not record) for Hazelcast key serialization.
 */
public final class TaskLookupKey implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final UUID workflowId;
    private final String taskName;

    public TaskLookupKey(UUID workflowId, String taskName) {
        if (workflowId == null) {
            throw new IllegalArgumentException("Workflow ID cannot be null");
        }
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be null or empty");
        }

        this.workflowId = workflowId;
        this.taskName = taskName;
    }

    public UUID workflowId() {
        return workflowId;
    }

    public String taskName() {
        return taskName;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        TaskLookupKey that = (TaskLookupKey) obj;
        return Objects.equals(workflowId, that.workflowId) &&
                Objects.equals(taskName, that.taskName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowId, taskName);
    }

    @Override
    public String toString() {
        return "TaskLookupKey[workflowId=" + workflowId + ", taskName=" + taskName + "]";
    }
}
