package org.neuralchilli.flotilla.domain;

import java.io.Serializable;
import java.util.List;

/**
 * Definition of one task inside a group.
 * Dependencies name other tasks of the same workflow, in this group or in another one.
 */
public record TaskSpec(
        String name,
        boolean lead,
        String image,
        List<String> command,
        ResourceRequest resources,
        List<String> dependsOn,
        ExitActionRules exitActions
) implements Serializable {

    public TaskSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be null or empty");
        }
        if (resources == null) {
            throw new IllegalArgumentException("Task '" + name + "' must declare resources");
        }

        // Defaults
        command = command == null ? List.of() : List.copyOf(command);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        if (exitActions == null) {
            exitActions = ExitActionRules.NONE;
        }
    }

    public static TaskSpec of(String name, ResourceRequest resources, String... dependsOn) {
        return new TaskSpec(name, false, null, List.of(), resources, List.of(dependsOn), null);
    }

    public TaskSpec asLead() {
        return new TaskSpec(name, true, image, command, resources, dependsOn, exitActions);
    }
}
