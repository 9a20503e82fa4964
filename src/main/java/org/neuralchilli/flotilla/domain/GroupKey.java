package org.neuralchilli.flotilla.domain;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

/**
 * Identifies one group of one workflow. Used for queue entries, reservations and barriers.
 */
public final class GroupKey implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final UUID workflowId;
    private final String groupName;

    public GroupKey(UUID workflowId, String groupName) {
        if (workflowId == null) {
            throw new IllegalArgumentException("Workflow ID cannot be null");
        }
        if (groupName == null || groupName.isBlank()) {
            throw new IllegalArgumentException("Group name cannot be null or empty");
        }

        this.workflowId = workflowId;
        this.groupName = groupName;
    }

    public static GroupKey of(UUID workflowId, String groupName) {
        return new GroupKey(workflowId, groupName);
    }

    public UUID workflowId() {
        return workflowId;
    }

    public String groupName() {
        return groupName;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        GroupKey that = (GroupKey) obj;
        return Objects.equals(workflowId, that.workflowId) &&
                Objects.equals(groupName, that.groupName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowId, groupName);
    }

    @Override
    public String toString() {
        return workflowId + "/" + groupName;
    }
}
