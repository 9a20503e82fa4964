package org.neuralchilli.flotilla.executor;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Answer to a gang placement: either every task got a node, or none did.
 */
public record PlacementResult(boolean accepted, Map<UUID, String> nodes, String reason) {

    public PlacementResult {
        nodes = nodes == null ? Map.of() : Map.copyOf(nodes);
        if (!accepted && (reason == null || reason.isBlank())) {
            reason = "rejected by backend";
        }
    }

    public static PlacementResult accepted(Map<UUID, String> nodes) {
        return new PlacementResult(true, nodes, null);
    }

    public static PlacementResult rejected(String reason) {
        return new PlacementResult(false, Map.of(), reason);
    }

    public Optional<String> nodeOf(UUID taskInstanceId) {
        return Optional.ofNullable(nodes.get(taskInstanceId));
    }
}
