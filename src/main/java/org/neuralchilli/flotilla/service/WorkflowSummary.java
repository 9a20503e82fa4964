package org.neuralchilli.flotilla.service;

import org.neuralchilli.flotilla.domain.Priority;
import org.neuralchilli.flotilla.domain.WorkflowRecord;
import org.neuralchilli.flotilla.domain.WorkflowStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * One line of workflow history.
 */
public record WorkflowSummary(
        UUID id,
        String name,
        String user,
        String pool,
        Priority priority,
        WorkflowStatus status,
        Instant submittedAt,
        Instant finishedAt,
        String failureReason
) {

    static WorkflowSummary of(WorkflowRecord workflow) {
        return new WorkflowSummary(
                workflow.id(),
                workflow.name(),
                workflow.user(),
                workflow.pool(),
                workflow.priority(),
                workflow.status(),
                workflow.submittedAt(),
                workflow.finishedAt(),
                workflow.failureReason()
        );
    }
}
