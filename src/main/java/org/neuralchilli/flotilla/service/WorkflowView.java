package org.neuralchilli.flotilla.service;

import org.neuralchilli.flotilla.domain.Priority;
import org.neuralchilli.flotilla.domain.WorkflowStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Status tree of a workflow: derived workflow status, group statuses and the
 * current attempt of every task. Rejected submissions have no groups.
 */
public record WorkflowView(
        UUID id,
        String name,
        String user,
        String pool,
        Priority priority,
        WorkflowStatus status,
        Instant submittedAt,
        Instant startedAt,
        Instant finishedAt,
        String canceledBy,
        String failureReason,
        List<GroupView> groups
) {

    public WorkflowView {
        groups = List.copyOf(groups);
    }

    public GroupView group(String groupName) {
        return groups.stream()
                .filter(group -> group.name().equals(groupName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No group " + groupName + " in workflow " + id));
    }
}
