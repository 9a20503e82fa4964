package org.neuralchilli.flotilla;

import org.neuralchilli.flotilla.domain.Capacity;
import org.neuralchilli.flotilla.domain.ExitActionRules;
import org.neuralchilli.flotilla.domain.GroupSpec;
import org.neuralchilli.flotilla.domain.Platform;
import org.neuralchilli.flotilla.domain.Pool;
import org.neuralchilli.flotilla.domain.PoolStatus;
import org.neuralchilli.flotilla.domain.Priority;
import org.neuralchilli.flotilla.domain.ResourceRequest;
import org.neuralchilli.flotilla.domain.TaskSpec;
import org.neuralchilli.flotilla.domain.WorkflowSpec;

import java.util.List;
import java.util.Map;

/**
 * Pools and workflow definitions shared by tests.
 * <p>
 * {@link #POOL} has 2 GPUs of HIGH and of NORMAL quota and no LOW quota;
 * {@link #SIBLING} shares its backend with 2 GPUs of NORMAL quota only.
 */
public final class TestWorkflows {

    public static final String POOL = "gpu-pool";
    public static final String SIBLING = "sibling-pool";
    public static final String BACKEND = "test-cluster";

    private TestWorkflows() {
    }

    public static Platform platform() {
        return new Platform("standard", 8, 64, 512, 1000, false, false);
    }

    public static Pool pool(String name, Capacity high, Capacity normal, Capacity low) {
        return new Pool(
                name,
                BACKEND,
                PoolStatus.ONLINE,
                Map.of(Priority.HIGH, high, Priority.NORMAL, normal, Priority.LOW, low),
                List.of(platform()),
                ExitActionRules.NONE,
                null,
                null
        );
    }

    public static List<Pool> pools() {
        return List.of(
                pool(POOL, Capacity.of(2, 16), Capacity.of(2, 16), Capacity.ZERO),
                pool(SIBLING, Capacity.ZERO, Capacity.of(2, 16), Capacity.ZERO)
        );
    }

    public static TaskSpec task(String name, int gpu, String... dependsOn) {
        return TaskSpec.of(name, ResourceRequest.of(gpu, 1), dependsOn);
    }

    public static TaskSpec lead(String name, int gpu, String... dependsOn) {
        return task(name, gpu, dependsOn).asLead();
    }

    public static GroupSpec gang(String name, boolean ignoreNonleadStatus, TaskSpec... tasks) {
        return new GroupSpec(name, List.of(tasks), ignoreNonleadStatus, true);
    }

    public static WorkflowSpec workflow(String name, String pool, Priority priority, GroupSpec... groups) {
        return WorkflowSpec.of(name, pool, priority, groups);
    }

    /**
     * One single-task group using {@code gpu} GPUs
     */
    public static WorkflowSpec single(String name, String pool, Priority priority, int gpu) {
        return WorkflowSpec.ofTasks(name, pool, priority, List.of(task(name + "-task", gpu)));
    }
}
