package org.neuralchilli.flotilla.domain;

import java.io.Serializable;

/**
 * Node shape offered by a pool. A task fits a platform when every requested
 * resource is within the shape and the required access is allowed.
 */
public record Platform(
        String name,
        int gpu,
        int cpu,
        int memoryGib,
        int storageGib,
        boolean privilegedAllowed,
        boolean hostNetworkAllowed
) implements Serializable {

    public Platform {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Platform name cannot be null or empty");
        }
    }

    public boolean accepts(ResourceRequest request) {
        if (request.platform() != null && !request.platform().equals(name)) {
            return false;
        }
        if (request.privileged() && !privilegedAllowed) {
            return false;
        }
        if (request.hostNetwork() && !hostNetworkAllowed) {
            return false;
        }
        return request.gpu() <= gpu
                && request.cpu() <= cpu
                && request.memoryGib() <= memoryGib
                && request.storageGib() <= storageGib;
    }
}
