package org.neuralchilli.flotilla.quota;

import org.neuralchilli.flotilla.domain.Capacity;
import org.neuralchilli.flotilla.domain.PoolStatus;
import org.neuralchilli.flotilla.domain.Priority;

import java.util.Map;

/**
 * Snapshot of a pool's quota accounting.
 *
 * @param borrowedIn capacity this pool's LOW groups hold from sibling pools
 */
public record PoolUsage(
        String pool,
        String backend,
        PoolStatus status,
        Map<Priority, ClassUsage> classes,
        Capacity borrowedIn
) {

    public PoolUsage {
        classes = Map.copyOf(classes);
    }

    /**
     * Accounting of one priority class. {@code free} is what the class can still use
     * itself: quota minus used minus lent out.
     */
    public record ClassUsage(Capacity quota, Capacity used, Capacity lentOut, Capacity free) {
    }

    public ClassUsage of(Priority priority) {
        return classes.get(priority);
    }
}
