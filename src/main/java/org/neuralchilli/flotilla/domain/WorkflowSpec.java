package org.neuralchilli.flotilla.domain;

import java.io.Serializable;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Submitted workflow definition: a DAG of groups targeting one pool.
 * Flat task lists are normalised into single-task groups by {@link #ofTasks}.
 */
public record WorkflowSpec(
        String name,
        String pool,
        Priority priority,
        List<GroupSpec> groups,
        Duration queueTimeout,
        Duration execTimeout,
        boolean reschedulePreempted
) implements Serializable {

    public WorkflowSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workflow name cannot be null or empty");
        }
        if (pool == null || pool.isBlank()) {
            throw new IllegalArgumentException("Workflow '" + name + "' must target a pool");
        }
        if (groups == null || groups.isEmpty()) {
            throw new IllegalArgumentException("Workflow '" + name + "' must have at least one group");
        }
        if (priority == null) {
            priority = Priority.NORMAL;
        }
        groups = List.copyOf(groups);

        Set<String> groupNames = new HashSet<>();
        Set<String> taskNames = new HashSet<>();
        for (GroupSpec group : groups) {
            if (!groupNames.add(group.name())) {
                throw new IllegalArgumentException("Duplicate group name: " + group.name());
            }
            for (TaskSpec task : group.tasks()) {
                if (!taskNames.add(task.name())) {
                    throw new IllegalArgumentException(
                            "Task name '" + task.name() + "' is used more than once in workflow '" + name + "'");
                }
            }
        }
    }

    public static WorkflowSpec of(String name, String pool, Priority priority, GroupSpec... groups) {
        return new WorkflowSpec(name, pool, priority, List.of(groups), null, null, true);
    }

    /**
     * Workflow with flat tasks: every task becomes a single-task group named after it.
     */
    public static WorkflowSpec ofTasks(String name, String pool, Priority priority, List<TaskSpec> tasks) {
        List<GroupSpec> groups = tasks.stream()
                .map(GroupSpec::single)
                .collect(Collectors.toList());
        return new WorkflowSpec(name, pool, priority, groups, null, null, true);
    }

    public WorkflowSpec withTimeouts(Duration newQueueTimeout, Duration newExecTimeout) {
        return new WorkflowSpec(name, pool, priority, groups, newQueueTimeout, newExecTimeout, reschedulePreempted);
    }

    public WorkflowSpec withReschedulePreempted(boolean value) {
        return new WorkflowSpec(name, pool, priority, groups, queueTimeout, execTimeout, value);
    }

    public Optional<GroupSpec> group(String groupName) {
        return groups.stream()
                .filter(group -> group.name().equals(groupName))
                .findFirst();
    }

    /**
     * Group that owns a task.
     */
    public Optional<GroupSpec> groupOf(String taskName) {
        return groups.stream()
                .filter(group -> group.task(taskName).isPresent())
                .findFirst();
    }

    public List<String> taskNames() {
        return groups.stream()
                .flatMap(group -> group.tasks().stream())
                .map(TaskSpec::name)
                .collect(Collectors.toList());
    }
}
