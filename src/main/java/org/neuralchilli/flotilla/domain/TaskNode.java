package org.neuralchilli.flotilla.domain;

import javax.annotation.Nonnull;
import java.io.Serializable;
import java.util.Objects;

/**
 * Vertex of the task-level dependency graph.
 */
public record TaskNode(
        String taskName,
        String groupName
) implements Serializable {

    public TaskNode {
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be null or empty");
        }
        if (groupName == null || groupName.isBlank()) {
            throw new IllegalArgumentException("Group name cannot be null or empty");
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        TaskNode that = (TaskNode) obj;
        // Task names are unique within a workflow
        return Objects.equals(this.taskName, that.taskName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskName);
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format("TaskNode[%s/%s]", groupName, taskName);
    }
}
