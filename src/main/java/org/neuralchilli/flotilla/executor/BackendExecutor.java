package org.neuralchilli.flotilla.executor;

import org.neuralchilli.flotilla.domain.GroupKey;

import java.util.List;
import java.util.UUID;

/**
 * Boundary to the compute backend that runs containers.
 * <p>
 * Calls are synchronous requests; what happens to placed tasks afterwards is reported
 * asynchronously as {@link org.neuralchilli.flotilla.domain.TaskEvent}s on the
 * {@code task.event} event bus address. A placed task reports READY once its container
 * waits for the start signal, and again after every restart.
 */
public interface BackendExecutor {

    /**
     * Place every task of a gang, or none of them.
     *
     * @param group      the gang being placed
     * @param pool       pool the gang was admitted to
     * @param placements tasks to place
     * @return accepted with a node per task, or rejected
     */
    PlacementResult placeGang(GroupKey group, String pool, List<TaskPlacement> placements);

    /**
     * Start the user command of placed tasks.
     */
    void start(GroupKey group, List<UUID> taskInstanceIds);

    /**
     * Re-run the user command of a placed task without re-provisioning it.
     */
    void restart(UUID taskInstanceId);

    /**
     * Stop a task. Idempotent; a task that already finished may still report its outcome.
     */
    void cancel(UUID taskInstanceId);
}
