package org.neuralchilli.flotilla.domain;

import java.io.Serializable;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A gang: tasks that are placed and started together.
 * Exactly one task is the lead; a single-task group's task is the lead implicitly.
 */
public record GroupSpec(
        String name,
        List<TaskSpec> tasks,
        boolean ignoreNonleadStatus,
        boolean barrier
) implements Serializable {

    public GroupSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Group name cannot be null or empty");
        }
        if (tasks == null || tasks.isEmpty()) {
            throw new IllegalArgumentException("Group '" + name + "' must have at least one task");
        }
        if (tasks.size() == 1 && !tasks.get(0).lead()) {
            tasks = List.of(tasks.get(0).asLead());
        } else {
            tasks = List.copyOf(tasks);
        }

        long leads = tasks.stream().filter(TaskSpec::lead).count();
        if (leads != 1) {
            throw new IllegalArgumentException(
                    "Group '" + name + "' must have exactly one lead task, found " + leads);
        }

        Set<String> names = new HashSet<>();
        for (TaskSpec task : tasks) {
            if (!names.add(task.name())) {
                throw new IllegalArgumentException(
                        "Duplicate task name '" + task.name() + "' in group '" + name + "'");
            }
        }
    }

    /**
     * Create a group with default policy: follow the lead, use a start barrier.
     */
    public static GroupSpec of(String name, TaskSpec... tasks) {
        return new GroupSpec(name, List.of(tasks), true, true);
    }

    /**
     * Wrap a flat task in its own single-task group of the same name.
     */
    public static GroupSpec single(TaskSpec task) {
        return new GroupSpec(task.name(), List.of(task), true, true);
    }

    public TaskSpec leader() {
        return tasks.stream()
                .filter(TaskSpec::lead)
                .findFirst()
                .orElseThrow();
    }

    public Optional<TaskSpec> task(String taskName) {
        return tasks.stream()
                .filter(task -> task.name().equals(taskName))
                .findFirst();
    }

    /**
     * The start barrier only applies to gangs of more than one task.
     */
    public boolean usesBarrier() {
        return barrier && tasks.size() > 1;
    }

    public Capacity demand() {
        Capacity total = Capacity.ZERO;
        for (TaskSpec task : tasks) {
            total = total.plus(task.resources().capacity());
        }
        return total;
    }
}
