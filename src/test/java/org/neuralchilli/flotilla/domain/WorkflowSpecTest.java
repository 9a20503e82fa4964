package org.neuralchilli.flotilla.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowSpecTest {

    @Test
    void shouldTurnFlatTasksIntoSingleTaskGroups() {
        WorkflowSpec spec = WorkflowSpec.ofTasks("etl", "pool", Priority.LOW, List.of(
                TaskSpec.of("extract", ResourceRequest.of(0, 1)),
                TaskSpec.of("load", ResourceRequest.of(0, 1), "extract")));

        assertThat(spec.groups()).extracting(GroupSpec::name).containsExactly("extract", "load");
        assertThat(spec.groupOf("load")).map(GroupSpec::name).contains("load");
        assertThat(spec.taskNames()).containsExactly("extract", "load");
        assertThat(spec.reschedulePreempted()).isTrue();
    }

    @Test
    void shouldDefaultToNormalPriority() {
        WorkflowSpec spec = new WorkflowSpec("wf", "pool", null,
                List.of(GroupSpec.single(TaskSpec.of("t", ResourceRequest.of(0, 1)))), null, null, true);

        assertThat(spec.priority()).isEqualTo(Priority.NORMAL);
    }

    @Test
    void shouldRejectTaskNameUsedInTwoGroups() {
        GroupSpec first = GroupSpec.single(TaskSpec.of("t", ResourceRequest.of(0, 1)));
        GroupSpec second = GroupSpec.of("other", TaskSpec.of("t", ResourceRequest.of(0, 1)).asLead());

        assertThatThrownBy(() -> WorkflowSpec.of("wf", "pool", Priority.HIGH, first, second))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Task name 't' is used more than once");
    }

    @Test
    void shouldRequirePoolAndGroups() {
        assertThatThrownBy(() -> new WorkflowSpec("wf", null, Priority.LOW, List.of(), null, null, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must target a pool");
        assertThatThrownBy(() -> new WorkflowSpec("wf", "pool", Priority.LOW, List.of(), null, null, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one group");
    }

    @Test
    void shouldParsePriorityCaseInsensitively() {
        assertThat(Priority.fromString("high")).isEqualTo(Priority.HIGH);
        assertThat(Priority.fromString(null)).isEqualTo(Priority.NORMAL);
        assertThat(Priority.LOW.mayBorrow()).isTrue();
        assertThat(Priority.NORMAL.mayBorrow()).isFalse();
        assertThatThrownBy(() -> Priority.fromString("urgent"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown priority");
    }
}
