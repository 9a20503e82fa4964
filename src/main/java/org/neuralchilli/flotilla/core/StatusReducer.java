package org.neuralchilli.flotilla.core;

import org.neuralchilli.flotilla.domain.GroupSpec;
import org.neuralchilli.flotilla.domain.TaskInstance;
import org.neuralchilli.flotilla.domain.TaskStatus;
import org.neuralchilli.flotilla.domain.WorkflowRecord;
import org.neuralchilli.flotilla.domain.WorkflowStatus;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pure reductions from task instances to group status and from group statuses to
 * workflow status. No state, no side effects.
 */
public final class StatusReducer {

    /**
     * Failure variants that win over any other failure of the considered tasks, in order.
     */
    private static final List<TaskStatus> FAILURE_PRECEDENCE = List.of(
            TaskStatus.FAILED_UPSTREAM,
            TaskStatus.FAILED_SERVER_ERROR,
            TaskStatus.FAILED_PREEMPTED,
            TaskStatus.FAILED_EVICTED
    );

    private StatusReducer() {
    }

    /**
     * Reduce the current instances of a group's tasks to the group status.
     * <p>
     * With {@code ignoreNonleadStatus} only the lead is considered for the outcome;
     * otherwise every task is. A considered failure fails the group immediately,
     * all considered tasks COMPLETED completes it. Anything else is live and
     * reported as the furthest live status of any member.
     */
    public static TaskStatus reduceGroup(GroupSpec group, Collection<TaskInstance> current) {
        if (current.isEmpty()) {
            return TaskStatus.SUBMITTING;
        }

        boolean anyConsideredFailed = false;
        boolean allConsideredCompleted = true;
        TaskStatus leadStatus = null;
        TaskStatus firstConsideredFailure = null;

        for (TaskInstance task : current) {
            boolean considered = !group.ignoreNonleadStatus() || task.lead();
            if (task.lead()) {
                leadStatus = task.status();
            }
            if (!considered) {
                continue;
            }
            if (task.status().isFailed()) {
                anyConsideredFailed = true;
                if (firstConsideredFailure == null) {
                    firstConsideredFailure = task.status();
                }
            }
            if (task.status() != TaskStatus.COMPLETED) {
                allConsideredCompleted = false;
            }
        }

        if (anyConsideredFailed) {
            return failureOf(current, group.ignoreNonleadStatus(), leadStatus, firstConsideredFailure);
        }
        if (allConsideredCompleted) {
            return TaskStatus.COMPLETED;
        }
        return furthestLive(current);
    }

    /**
     * Reduce group statuses to the workflow status.
     *
     * @param groupsInOrder group names in topological order, used to pick the originating failure
     */
    public static WorkflowStatus reduceWorkflow(
            WorkflowRecord workflow,
            List<String> groupsInOrder,
            Map<String, TaskStatus> groupStatuses
    ) {
        boolean allFinished = true;
        boolean allCompleted = true;
        boolean anyActive = false;

        for (String group : groupsInOrder) {
            TaskStatus status = groupStatuses.getOrDefault(group, TaskStatus.SUBMITTING);
            if (!status.isGroupFinished()) {
                allFinished = false;
            }
            if (status != TaskStatus.COMPLETED) {
                allCompleted = false;
            }
            if (status.isActive()) {
                anyActive = true;
            }
        }

        if (allFinished) {
            if (allCompleted) {
                return WorkflowStatus.COMPLETED;
            }
            if (workflow.cancelStatus() != null) {
                return workflow.cancelStatus();
            }
            return originatingFailure(groupsInOrder, groupStatuses)
                    .map(WorkflowStatus::fromGroupFailure)
                    .orElse(WorkflowStatus.FAILED);
        }
        if (anyActive) {
            return WorkflowStatus.RUNNING;
        }
        return workflow.hasStarted() ? WorkflowStatus.WAITING : WorkflowStatus.PENDING;
    }

    /**
     * First failed group in topological order that did not fail because of another group.
     */
    public static Optional<TaskStatus> originatingFailure(
            List<String> groupsInOrder,
            Map<String, TaskStatus> groupStatuses
    ) {
        TaskStatus upstreamOnly = null;
        for (String group : groupsInOrder) {
            TaskStatus status = groupStatuses.get(group);
            if (status == null || !status.isFailed()) {
                continue;
            }
            if (status != TaskStatus.FAILED_UPSTREAM) {
                return Optional.of(status);
            }
            upstreamOnly = status;
        }
        return Optional.ofNullable(upstreamOnly);
    }

    private static TaskStatus failureOf(
            Collection<TaskInstance> current,
            boolean ignoreNonlead,
            TaskStatus leadStatus,
            TaskStatus firstConsideredFailure
    ) {
        for (TaskStatus precedent : FAILURE_PRECEDENCE) {
            for (TaskInstance task : current) {
                boolean considered = !ignoreNonlead || task.lead();
                if (considered && task.status() == precedent) {
                    return precedent;
                }
            }
        }
        if (leadStatus != null && leadStatus.isFailed()) {
            return leadStatus;
        }
        return firstConsideredFailure;
    }

    private static TaskStatus furthestLive(Collection<TaskInstance> current) {
        TaskStatus furthest = TaskStatus.SUBMITTING;
        for (TaskInstance task : current) {
            TaskStatus status = task.status();
            if (status.isTerminal()) {
                continue;
            }
            if (furthest.canTransitionTo(status)) {
                furthest = status;
            }
        }
        return furthest;
    }
}
