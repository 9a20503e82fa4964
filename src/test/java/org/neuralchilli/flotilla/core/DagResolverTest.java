package org.neuralchilli.flotilla.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.flotilla.domain.GroupSpec;
import org.neuralchilli.flotilla.domain.Priority;
import org.neuralchilli.flotilla.domain.TaskStatus;
import org.neuralchilli.flotilla.domain.WorkflowSpec;
import org.neuralchilli.flotilla.service.CyclicDependencyException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.neuralchilli.flotilla.TestWorkflows.POOL;
import static org.neuralchilli.flotilla.TestWorkflows.gang;
import static org.neuralchilli.flotilla.TestWorkflows.lead;
import static org.neuralchilli.flotilla.TestWorkflows.task;
import static org.neuralchilli.flotilla.TestWorkflows.workflow;

class DagResolverTest {

    private final DagResolver resolver = new DagResolver();

    @Test
    void shouldPromoteCrossGroupDependencies() {
        // Given: prep -> train(master, worker)
        WorkflowSpec spec = workflow("pipeline", POOL, Priority.NORMAL,
                GroupSpec.single(task("prep", 0)),
                gang("train", true, lead("master", 1, "prep"), task("worker", 1, "prep")));

        // When
        WorkflowDag dag = resolver.buildDag(spec);

        // Then
        assertThat(dag.groupCount()).isEqualTo(2);
        assertThat(dag.taskCount()).isEqualTo(3);
        assertThat(dag.upstreamGroups("train")).containsExactly("prep");
        assertThat(dag.downstreamGroups("prep")).containsExactly("train");
        assertThat(dag.rootGroups()).containsExactly("prep");
        assertThat(dag.topologicalGroups()).containsExactly("prep", "train");
        assertThat(dag.groupOf("worker")).isEqualTo("train");
    }

    @Test
    void shouldKeepIntraGroupDependenciesInsideTheGang() {
        // Given: worker waits for master inside the same group
        WorkflowSpec spec = workflow("gang", POOL, Priority.NORMAL,
                gang("train", true, lead("master", 1), task("worker", 1, "master")));

        // When
        WorkflowDag dag = resolver.buildDag(spec);

        // Then: no group edge, the task edge is intra-group
        assertThat(dag.upstreamGroups("train")).isEmpty();
        assertThat(dag.intraGroupUpstream("worker")).containsExactly("master");
        assertThat(dag.intraGroupUpstream("master")).isEmpty();
        assertThat(dag.downstreamTasks("master")).containsExactly("worker");
    }

    @Test
    void shouldRejectTaskCycle() {
        WorkflowSpec spec = workflow("cyclic", POOL, Priority.NORMAL,
                GroupSpec.single(task("a", 0, "b")),
                GroupSpec.single(task("b", 0, "a")));

        assertThatThrownBy(() -> resolver.buildDag(spec))
                .isInstanceOf(CyclicDependencyException.class)
                .hasMessageContaining("would create a cycle");
    }

    @Test
    void shouldRejectGroupCycleWithoutTaskCycle() {
        // Given: x -> z -> y is acyclic, but g1 -> g2 -> g1 is not
        WorkflowSpec spec = workflow("group-cycle", POOL, Priority.NORMAL,
                gang("g1", true, lead("x", 0), task("y", 0, "z")),
                GroupSpec.single(task("z", 0, "x")));

        assertThatThrownBy(() -> resolver.buildDag(spec))
                .isInstanceOf(CyclicDependencyException.class)
                .hasMessageContaining("depend on each other");
    }

    @Test
    void shouldRejectUnknownDependency() {
        WorkflowSpec spec = workflow("dangling", POOL, Priority.NORMAL,
                GroupSpec.single(task("a", 0, "missing")));

        assertThatThrownBy(() -> resolver.buildDag(spec))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'missing' which does not exist");
    }

    @Test
    void shouldReportGroupReadyOnlyWhenAllUpstreamCompleted() {
        // Given: a, b -> c
        WorkflowDag dag = resolver.buildDag(workflow("join", POOL, Priority.NORMAL,
                GroupSpec.single(task("a", 0)),
                GroupSpec.single(task("b", 0)),
                GroupSpec.single(task("c", 0, "a", "b"))));

        // Then
        assertThat(dag.isGroupReady("a", group -> TaskStatus.SUBMITTING)).isTrue();
        assertThat(dag.isGroupReady("c", Map.of(
                "a", TaskStatus.COMPLETED,
                "b", TaskStatus.RUNNING)::get)).isFalse();
        assertThat(dag.isGroupReady("c", Map.of(
                "a", TaskStatus.COMPLETED,
                "b", TaskStatus.COMPLETED)::get)).isTrue();
    }

    @Test
    void shouldListTransitiveDownstreamGroupsInTopologicalOrder() {
        WorkflowDag dag = resolver.buildDag(workflow("chain", POOL, Priority.NORMAL,
                GroupSpec.single(task("c", 0, "b")),
                GroupSpec.single(task("a", 0)),
                GroupSpec.single(task("b", 0, "a")),
                GroupSpec.single(task("side", 0))));

        assertThat(dag.transitiveDownstreamGroups("a")).containsExactly("b", "c");
        assertThat(dag.transitiveDownstreamGroups("side")).isEmpty();
    }

    @Test
    void shouldFailForUnknownTaskLookup() {
        WorkflowDag dag = resolver.buildDag(workflow("one", POOL, Priority.NORMAL,
                GroupSpec.single(task("a", 0))));

        assertThatThrownBy(() -> dag.upstreamTasks("nope"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown task: nope");
    }
}
