package org.neuralchilli.flotilla.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.flotilla.TestWorkflows;
import org.neuralchilli.flotilla.domain.GroupSpec;
import org.neuralchilli.flotilla.domain.Priority;
import org.neuralchilli.flotilla.domain.TaskInstance;
import org.neuralchilli.flotilla.domain.TaskStatus;
import org.neuralchilli.flotilla.domain.WorkflowRecord;
import org.neuralchilli.flotilla.domain.WorkflowStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.neuralchilli.flotilla.TestWorkflows.gang;
import static org.neuralchilli.flotilla.TestWorkflows.lead;
import static org.neuralchilli.flotilla.TestWorkflows.task;

class StatusReducerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final List<String> ORDER = List.of("a", "b");

    private final UUID workflowId = UUID.randomUUID();
    private final GroupSpec followLead = gang("g", true, lead("master", 1), task("worker", 1));
    private final GroupSpec allTasks = gang("g", false, lead("master", 1), task("worker", 1));

    @Test
    void shouldIgnoreWorkerFailureWhenFollowingLead() {
        TaskStatus status = StatusReducer.reduceGroup(followLead, List.of(
                instance("master", true, TaskStatus.RUNNING),
                instance("worker", false, TaskStatus.FAILED)));

        assertThat(status).isEqualTo(TaskStatus.RUNNING);
    }

    @Test
    void shouldCompleteWithLeadWhenFollowingLead() {
        TaskStatus status = StatusReducer.reduceGroup(followLead, List.of(
                instance("master", true, TaskStatus.COMPLETED),
                instance("worker", false, TaskStatus.RUNNING)));

        assertThat(status).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    void shouldFailOnAnyTaskWhenAllTasksCount() {
        TaskStatus status = StatusReducer.reduceGroup(allTasks, List.of(
                instance("master", true, TaskStatus.RUNNING),
                instance("worker", false, TaskStatus.FAILED_EVICTED)));

        assertThat(status).isEqualTo(TaskStatus.FAILED_EVICTED);
    }

    @Test
    void shouldPreferPrecedentFailureOverLeadFailure() {
        TaskStatus status = StatusReducer.reduceGroup(allTasks, List.of(
                instance("master", true, TaskStatus.FAILED),
                instance("worker", false, TaskStatus.FAILED_PREEMPTED)));

        assertThat(status).isEqualTo(TaskStatus.FAILED_PREEMPTED);
    }

    @Test
    void shouldReportFurthestLiveStatus() {
        TaskStatus status = StatusReducer.reduceGroup(allTasks, List.of(
                instance("master", true, TaskStatus.INITIALIZING),
                instance("worker", false, TaskStatus.RUNNING)));

        assertThat(status).isEqualTo(TaskStatus.RUNNING);
        assertThat(StatusReducer.reduceGroup(allTasks, List.of())).isEqualTo(TaskStatus.SUBMITTING);
    }

    @Test
    void shouldCompleteWorkflowWhenEveryGroupCompleted() {
        WorkflowStatus status = StatusReducer.reduceWorkflow(record(), ORDER, Map.of(
                "a", TaskStatus.COMPLETED,
                "b", TaskStatus.COMPLETED));

        assertThat(status).isEqualTo(WorkflowStatus.COMPLETED);
    }

    @Test
    void shouldReportOriginatingFailureRatherThanUpstreamFailure() {
        WorkflowStatus status = StatusReducer.reduceWorkflow(record(), ORDER, Map.of(
                "a", TaskStatus.FAILED_EVICTED,
                "b", TaskStatus.FAILED_UPSTREAM));

        assertThat(status).isEqualTo(WorkflowStatus.FAILED_EVICTED);
    }

    @Test
    void shouldReportStopStatusOfCanceledWorkflow() {
        WorkflowRecord canceled = record().cancel("alice", WorkflowStatus.FAILED_CANCELED);

        WorkflowStatus status = StatusReducer.reduceWorkflow(canceled, ORDER, Map.of(
                "a", TaskStatus.FAILED_CANCELED,
                "b", TaskStatus.FAILED_UPSTREAM));

        assertThat(status).isEqualTo(WorkflowStatus.FAILED_CANCELED);
    }

    @Test
    void shouldDistinguishPendingRunningAndWaiting() {
        WorkflowRecord pending = record();
        WorkflowRecord started = pending.withStatus(WorkflowStatus.RUNNING, null, NOW);

        assertThat(StatusReducer.reduceWorkflow(pending, ORDER, Map.of(
                "a", TaskStatus.PROCESSING, "b", TaskStatus.WAITING)))
                .isEqualTo(WorkflowStatus.PENDING);
        assertThat(StatusReducer.reduceWorkflow(started, ORDER, Map.of(
                "a", TaskStatus.RUNNING, "b", TaskStatus.WAITING)))
                .isEqualTo(WorkflowStatus.RUNNING);
        assertThat(StatusReducer.reduceWorkflow(started, ORDER, Map.of(
                "a", TaskStatus.COMPLETED, "b", TaskStatus.PROCESSING)))
                .isEqualTo(WorkflowStatus.WAITING);
    }

    private TaskInstance instance(String name, boolean lead, TaskStatus status) {
        TaskInstance created = TaskInstance.create(workflowId, "g", name, lead, NOW);
        return status == TaskStatus.SUBMITTING ? created : created.withStatus(status, NOW);
    }

    private static WorkflowRecord record() {
        return WorkflowRecord.create(
                TestWorkflows.single("wf", TestWorkflows.POOL, Priority.NORMAL, 1),
                "alice", 1, NOW, Duration.ofHours(1), Duration.ofHours(2));
    }
}
