package org.neuralchilli.flotilla.gang;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.flotilla.config.TimeoutDefaults;
import org.neuralchilli.flotilla.core.DagResolver;
import org.neuralchilli.flotilla.core.WorkflowDag;
import org.neuralchilli.flotilla.domain.GroupKey;
import org.neuralchilli.flotilla.domain.GroupSpec;
import org.neuralchilli.flotilla.domain.Priority;
import org.neuralchilli.flotilla.domain.TaskInstance;
import org.neuralchilli.flotilla.domain.TaskStatus;
import org.neuralchilli.flotilla.executor.BackendExecutor;
import org.neuralchilli.flotilla.executor.PlacementResult;
import org.neuralchilli.flotilla.executor.TaskPlacement;
import org.neuralchilli.flotilla.monitoring.SchedulingMonitor;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.neuralchilli.flotilla.TestWorkflows.POOL;
import static org.neuralchilli.flotilla.TestWorkflows.gang;
import static org.neuralchilli.flotilla.TestWorkflows.lead;
import static org.neuralchilli.flotilla.TestWorkflows.task;
import static org.neuralchilli.flotilla.TestWorkflows.workflow;

class GangCoordinatorTest {

    private final Instant now = Instant.parse("2025-01-01T10:00:00Z");
    private final UUID workflowId = UUID.randomUUID();
    private final GroupKey key = GroupKey.of(workflowId, "train");

    // master and worker start together; evaluator waits for master inside the gang
    private final GroupSpec group = gang("train", true,
            lead("master", 1), task("worker", 1), task("evaluator", 0, "master"));
    private final WorkflowDag dag = new DagResolver().buildDag(workflow("wf", POOL, Priority.NORMAL, group));

    private GangCoordinator coordinator;
    private BackendExecutor executor;

    @BeforeEach
    void setUp() {
        executor = mock(BackendExecutor.class);
        TimeoutDefaults timeouts = mock(TimeoutDefaults.class);
        when(timeouts.start()).thenReturn(Duration.ofMinutes(5));

        coordinator = new GangCoordinator();
        coordinator.executor = executor;
        coordinator.monitor = new SchedulingMonitor();
        coordinator.timeouts = timeouts;
    }

    @Test
    void shouldPlaceWholeGang() {
        // Given
        List<TaskInstance> instances = scheduling();
        when(executor.placeGang(eq(key), eq(POOL), anyList())).thenAnswer(invocation -> {
            List<TaskPlacement> placements = invocation.getArgument(2);
            Map<UUID, String> nodes = new HashMap<>();
            placements.forEach(placement -> nodes.put(placement.taskInstanceId(), "node-" + placement.taskName()));
            return PlacementResult.accepted(nodes);
        });

        // When
        PlacementResult result = coordinator.place(key, POOL, group, instances);

        // Then
        assertThat(result.accepted()).isTrue();
        assertThat(result.nodeOf(instances.get(0).id())).contains("node-master");
        assertThat(coordinator.isPlaced(key)).isTrue();
        assertThat(coordinator.placedGroups()).containsExactly(key);
    }

    @Test
    void shouldUndoPartialPlacement() {
        // Given: the backend leaves the evaluator without a node
        List<TaskInstance> instances = scheduling();
        Map<UUID, String> nodes = Map.of(
                instances.get(0).id(), "node-1",
                instances.get(1).id(), "node-2");
        when(executor.placeGang(eq(key), eq(POOL), anyList())).thenReturn(PlacementResult.accepted(nodes));

        // When
        PlacementResult result = coordinator.place(key, POOL, group, instances);

        // Then: treated as a rejection, placed tasks are canceled again
        assertThat(result.accepted()).isFalse();
        assertThat(result.reason()).isEqualTo("Partial placement");
        verify(executor).cancel(instances.get(0).id());
        verify(executor).cancel(instances.get(1).id());
        verify(executor, never()).cancel(instances.get(2).id());
        assertThat(coordinator.isPlaced(key)).isFalse();
    }

    @Test
    void shouldTurnBackendFailureIntoRejection() {
        when(executor.placeGang(eq(key), eq(POOL), anyList())).thenThrow(new IllegalStateException("backend down"));

        PlacementResult result = coordinator.place(key, POOL, group, scheduling());

        assertThat(result.accepted()).isFalse();
        assertThat(result.reason()).contains("backend down");
    }

    @Test
    void shouldGateOnlyTasksWithoutIntraGroupUpstream() {
        assertThat(GangCoordinator.barrierMembers(group, dag)).containsExactlyInAnyOrder("master", "worker");

        GroupSpec solo = GroupSpec.single(task("solo", 1));
        WorkflowDag soloDag = new DagResolver().buildDag(workflow("solo", POOL, Priority.NORMAL, solo));
        assertThat(GangCoordinator.barrierMembers(solo, soloDag)).isEmpty();
    }

    @Test
    void shouldStartBarrierMembersTogether() {
        // Given
        coordinator.arm(key, GangCoordinator.barrierMembers(group, dag), now);
        Map<String, TaskInstance> current = new HashMap<>();
        current.put("master", placed("master", true).ready(now));
        current.put("worker", placed("worker", false));
        current.put("evaluator", placed("evaluator", false));

        // When: master arrives first
        List<TaskInstance> first = coordinator.onReady(key, "master", dag, current);

        // Then: held at the barrier
        assertThat(first).isEmpty();
        assertThat(coordinator.barrier(key)).map(StartBarrier::pending)
                .hasValueSatisfying(pending -> assertThat(pending).containsExactly("worker"));

        // When: the last member arrives
        current.put("worker", current.get("worker").ready(now));
        List<TaskInstance> second = coordinator.onReady(key, "worker", dag, current);

        // Then: both start, the barrier is gone
        assertThat(second).extracting(TaskInstance::taskName).containsExactlyInAnyOrder("master", "worker");
        assertThat(coordinator.barrier(key)).isEmpty();
    }

    @Test
    void shouldHoldTaskUntilIntraGroupUpstreamCompletes() {
        // Given
        coordinator.arm(key, GangCoordinator.barrierMembers(group, dag), now);
        Map<String, TaskInstance> current = new HashMap<>();
        current.put("master", placed("master", true).ready(now).start(now));
        current.put("worker", placed("worker", false).ready(now).start(now));
        current.put("evaluator", placed("evaluator", false).ready(now));

        // When: evaluator is ready while master still runs
        assertThat(coordinator.onReady(key, "evaluator", dag, current)).isEmpty();

        // When: master completes
        current.put("master", current.get("master").finish(TaskStatus.COMPLETED, null, 0, now));
        List<TaskInstance> released = coordinator.onCompleted(key, "master", dag, current);

        // Then
        assertThat(released).extracting(TaskInstance::taskName).containsExactly("evaluator");
    }

    @Test
    void shouldReportExpiredBarriers() {
        coordinator.arm(key, GangCoordinator.barrierMembers(group, dag), now);

        assertThat(coordinator.expiredBarriers(now.plus(Duration.ofMinutes(4)))).isEmpty();
        assertThat(coordinator.expiredBarriers(now.plus(Duration.ofMinutes(6))))
                .extracting(StartBarrier::group)
                .containsExactly(key);

        coordinator.discard(key);
        assertThat(coordinator.expiredBarriers(now.plus(Duration.ofMinutes(6)))).isEmpty();
    }

    @Test
    void shouldSwallowCancelFailures() {
        TaskInstance task = placed("master", true);
        doThrow(new IllegalStateException("gone")).when(executor).cancel(task.id());

        coordinator.cancel(task);

        verify(executor).cancel(task.id());
    }

    private List<TaskInstance> scheduling() {
        return List.of(
                TaskInstance.create(workflowId, "train", "master", true, now).withStatus(TaskStatus.SCHEDULING, now),
                TaskInstance.create(workflowId, "train", "worker", false, now).withStatus(TaskStatus.SCHEDULING, now),
                TaskInstance.create(workflowId, "train", "evaluator", false, now).withStatus(TaskStatus.SCHEDULING, now));
    }

    private TaskInstance placed(String name, boolean lead) {
        return TaskInstance.create(workflowId, "train", name, lead, now)
                .withStatus(TaskStatus.SCHEDULING, now)
                .place("node-" + name);
    }
}
