package org.neuralchilli.flotilla.domain;

import java.io.Serializable;

/**
 * Amount of quota-accounted resources. All arithmetic is component-wise.
 */
public record Capacity(int gpu, int cpu) implements Serializable {

    public static final Capacity ZERO = new Capacity(0, 0);

    public Capacity {
        if (gpu < 0 || cpu < 0) {
            throw new IllegalArgumentException("Capacity cannot be negative: gpu=" + gpu + ", cpu=" + cpu);
        }
    }

    public static Capacity of(int gpu, int cpu) {
        return new Capacity(gpu, cpu);
    }

    public Capacity plus(Capacity other) {
        return new Capacity(gpu + other.gpu, cpu + other.cpu);
    }

    /**
     * Subtraction clamped at zero in each component.
     */
    public Capacity minus(Capacity other) {
        return new Capacity(Math.max(0, gpu - other.gpu), Math.max(0, cpu - other.cpu));
    }

    public Capacity min(Capacity other) {
        return new Capacity(Math.min(gpu, other.gpu), Math.min(cpu, other.cpu));
    }

    public boolean fitsWithin(Capacity limit) {
        return gpu <= limit.gpu && cpu <= limit.cpu;
    }

    public boolean isZero() {
        return gpu == 0 && cpu == 0;
    }

    @Override
    public String toString() {
        return "[gpu=" + gpu + ", cpu=" + cpu + "]";
    }
}
