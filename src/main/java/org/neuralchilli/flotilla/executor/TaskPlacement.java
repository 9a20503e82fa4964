package org.neuralchilli.flotilla.executor;

import org.neuralchilli.flotilla.domain.ResourceRequest;

import java.util.List;
import java.util.UUID;

/**
 * One task of a gang handed to the backend for placement.
 */
public record TaskPlacement(
        UUID taskInstanceId,
        String taskName,
        int retryId,
        boolean lead,
        String image,
        List<String> command,
        ResourceRequest resources
) {

    public TaskPlacement {
        if (taskInstanceId == null) {
            throw new IllegalArgumentException("Task instance ID cannot be null");
        }
        command = command == null ? List.of() : List.copyOf(command);
    }
}
