package org.neuralchilli.flotilla.domain;

import java.io.Serializable;

/**
 * Resources one task asks for. Only GPU and CPU count against pool quota;
 * memory, storage and access flags are matched against platforms.
 */
public record ResourceRequest(
        int gpu,
        int cpu,
        int memoryGib,
        int storageGib,
        String platform,
        boolean privileged,
        boolean hostNetwork
) implements Serializable {

    public ResourceRequest {
        if (gpu < 0 || cpu < 0 || memoryGib < 0 || storageGib < 0) {
            throw new IllegalArgumentException("Resource request cannot be negative");
        }
    }

    public static ResourceRequest of(int gpu, int cpu) {
        return new ResourceRequest(gpu, cpu, 0, 0, null, false, false);
    }

    public Capacity capacity() {
        return new Capacity(gpu, cpu);
    }
}
