package org.neuralchilli.flotilla.gang;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.flotilla.config.TimeoutDefaults;
import org.neuralchilli.flotilla.core.WorkflowDag;
import org.neuralchilli.flotilla.domain.GroupKey;
import org.neuralchilli.flotilla.domain.GroupSpec;
import org.neuralchilli.flotilla.domain.TaskInstance;
import org.neuralchilli.flotilla.domain.TaskSpec;
import org.neuralchilli.flotilla.domain.TaskStatus;
import org.neuralchilli.flotilla.executor.BackendExecutor;
import org.neuralchilli.flotilla.executor.PlacementResult;
import org.neuralchilli.flotilla.executor.TaskPlacement;
import org.neuralchilli.flotilla.monitoring.SchedulingMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Places admitted groups on the backend as one unit and decides when placed tasks
 * may start their user command.
 * <p>
 * Task statuses are not written here; the lifecycle state machine applies the
 * outcome of every call.
 */
@ApplicationScoped
public class GangCoordinator {

    private static final Logger log = LoggerFactory.getLogger(GangCoordinator.class);

    @Inject
    BackendExecutor executor;

    @Inject
    SchedulingMonitor monitor;

    @Inject
    TimeoutDefaults timeouts;

    private final Map<GroupKey, StartBarrier> barriers = new ConcurrentHashMap<>();
    private final Set<GroupKey> placed = ConcurrentHashMap.newKeySet();

    /**
     * Ask the backend to place every given task of the group at once.
     * A result that leaves any task without a node is treated as a rejection and
     * whatever was placed is canceled again.
     */
    public PlacementResult place(GroupKey key, String pool, GroupSpec group, List<TaskInstance> instances) {
        List<TaskPlacement> placements = instances.stream()
                .map(instance -> toPlacement(group, instance))
                .collect(Collectors.toList());

        PlacementResult result = requestPlacement(key, pool, placements);
        if (result.accepted()) {
            List<TaskInstance> unplaced = instances.stream()
                    .filter(instance -> result.nodeOf(instance.id()).isEmpty())
                    .collect(Collectors.toList());
            if (unplaced.isEmpty()) {
                placed.add(key);
                log.info("Placed gang {} ({} task(s)) in pool {}", key, instances.size(), pool);
                return result;
            }
            log.warn("Backend placed gang {} only partially, {} task(s) without a node; undoing",
                    key, unplaced.size());
            instances.stream()
                    .filter(instance -> result.nodeOf(instance.id()).isPresent())
                    .forEach(this::cancel);
            monitor.recordGangRejection();
            return PlacementResult.rejected("Partial placement");
        }

        log.info("Backend rejected gang {}: {}", key, result.reason());
        monitor.recordGangRejection();
        return result;
    }

    private PlacementResult requestPlacement(GroupKey key, String pool, List<TaskPlacement> placements) {
        SchedulingMonitor.Timer timer = monitor.startTimer("gang.place");
        try {
            return executor.placeGang(key, pool, placements);
        } catch (RuntimeException e) {
            log.error("Backend failed placing gang {}", key, e);
            return PlacementResult.rejected("Placement failed: " + e.getMessage());
        } finally {
            timer.stop();
        }
    }

    /**
     * Tasks of a group that take part in its start barrier: those without upstream
     * tasks inside the group. Empty when the group starts without a barrier.
     */
    public static Set<String> barrierMembers(GroupSpec group, WorkflowDag dag) {
        if (!group.usesBarrier()) {
            return Set.of();
        }
        return group.tasks().stream()
                .map(TaskSpec::name)
                .filter(name -> dag.intraGroupUpstream(name).isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Arm (or re-arm) the start barrier of a placed group. Re-arming forgets earlier arrivals.
     */
    public void arm(GroupKey key, Set<String> members, Instant now) {
        if (members.isEmpty()) {
            barriers.remove(key);
            return;
        }
        StartBarrier barrier = new StartBarrier(key, members, now.plus(timeouts.start()));
        barriers.put(key, barrier);
        log.debug("Armed {}", barrier);
    }

    /**
     * A placed task reported READY. Returns the tasks whose user command starts now:
     * every barrier member when this arrival completes the barrier, the task itself
     * when it is not gated, nothing otherwise.
     *
     * @param current current instances of the group's tasks by name, the arriving one included
     */
    public List<TaskInstance> onReady(GroupKey key, String taskName, WorkflowDag dag, Map<String, TaskInstance> current) {
        StartBarrier barrier = barriers.get(key);
        if (barrier != null && barrier.isMember(taskName)) {
            if (!barrier.arrive(taskName)) {
                log.debug("Task {} of {} waiting at barrier, pending {}", taskName, key, barrier.pending());
                return List.of();
            }
            barriers.remove(key, barrier);
            log.info("Start barrier of {} released", key);
            return barrier.members().stream()
                    .map(current::get)
                    .filter(GangCoordinator::isStartable)
                    .collect(Collectors.toList());
        }

        TaskInstance task = current.get(taskName);
        if (isStartable(task) && upstreamCompleted(taskName, dag, current)) {
            return List.of(task);
        }
        log.debug("Task {} of {} held until its upstream tasks complete", taskName, key);
        return List.of();
    }

    /**
     * A task of the group completed. Returns held tasks that depended on it and may start now.
     */
    public List<TaskInstance> onCompleted(GroupKey key, String taskName, WorkflowDag dag, Map<String, TaskInstance> current) {
        StartBarrier barrier = barriers.get(key);
        List<TaskInstance> released = new ArrayList<>();
        for (String downstream : dag.downstreamTasks(taskName)) {
            if (!key.groupName().equals(dag.groupOf(downstream))) {
                continue;
            }
            if (barrier != null && barrier.isMember(downstream)) {
                continue;
            }
            TaskInstance task = current.get(downstream);
            if (isStartable(task) && upstreamCompleted(downstream, dag, current)) {
                released.add(task);
            }
        }
        return released;
    }

    /**
     * Start the user command of the given tasks in one call.
     */
    public void start(GroupKey key, Collection<TaskInstance> tasks) {
        if (tasks.isEmpty()) {
            return;
        }
        List<UUID> ids = tasks.stream().map(TaskInstance::id).collect(Collectors.toList());
        executor.start(key, ids);
        log.debug("Started {} task(s) of {}", ids.size(), key);
    }

    public void restart(TaskInstance task) {
        executor.restart(task.id());
        monitor.recordRestart();
        log.info("Restarting task {} of {} on {}", task.taskName(), task.groupKey(), task.node());
    }

    /**
     * Ask the backend to stop a task. Failures are logged; the caller has already moved on.
     */
    public void cancel(TaskInstance task) {
        try {
            executor.cancel(task.id());
        } catch (RuntimeException e) {
            log.warn("Backend failed to cancel task {} ({}): {}", task.taskName(), task.id(), e.getMessage());
        }
    }

    public Optional<StartBarrier> barrier(GroupKey key) {
        return Optional.ofNullable(barriers.get(key));
    }

    public List<StartBarrier> expiredBarriers(Instant now) {
        return barriers.values().stream()
                .filter(barrier -> barrier.isExpired(now))
                .collect(Collectors.toList());
    }

    public void disarm(GroupKey key) {
        if (barriers.remove(key) != null) {
            log.debug("Disarmed start barrier of {}", key);
        }
    }

    /**
     * Groups that hold a placement on the backend
     */
    public Set<GroupKey> placedGroups() {
        return Set.copyOf(placed);
    }

    public boolean isPlaced(GroupKey key) {
        return placed.contains(key);
    }

    /**
     * Forget a group that left the backend: finished, preempted or canceled.
     */
    public void discard(GroupKey key) {
        placed.remove(key);
        disarm(key);
    }

    public void reset() {
        barriers.clear();
        placed.clear();
    }

    private static boolean isStartable(TaskInstance task) {
        return task != null && task.awaitingStart();
    }

    private static boolean upstreamCompleted(String taskName, WorkflowDag dag, Map<String, TaskInstance> current) {
        return dag.intraGroupUpstream(taskName).stream()
                .map(current::get)
                .allMatch(upstream -> upstream != null && upstream.status() == TaskStatus.COMPLETED);
    }

    private static TaskPlacement toPlacement(GroupSpec group, TaskInstance instance) {
        TaskSpec spec = group.task(instance.taskName())
                .orElseThrow(() -> new IllegalStateException(
                        "Task " + instance.taskName() + " not found in group " + group.name()));
        return new TaskPlacement(
                instance.id(),
                instance.taskName(),
                instance.retryId(),
                instance.lead(),
                spec.image(),
                spec.command(),
                spec.resources()
        );
    }
}
