package org.neuralchilli.flotilla.core;

import io.quarkus.vertx.ConsumeEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.flotilla.domain.ExitAction;
import org.neuralchilli.flotilla.domain.ExitActionRules;
import org.neuralchilli.flotilla.domain.GroupKey;
import org.neuralchilli.flotilla.domain.GroupSpec;
import org.neuralchilli.flotilla.domain.Pool;
import org.neuralchilli.flotilla.domain.RetryPolicy;
import org.neuralchilli.flotilla.domain.TaskEvent;
import org.neuralchilli.flotilla.domain.TaskInstance;
import org.neuralchilli.flotilla.domain.TaskSpec;
import org.neuralchilli.flotilla.domain.TaskStatus;
import org.neuralchilli.flotilla.domain.WorkflowRecord;
import org.neuralchilli.flotilla.domain.WorkflowStatus;
import org.neuralchilli.flotilla.executor.PlacementResult;
import org.neuralchilli.flotilla.gang.GangCoordinator;
import org.neuralchilli.flotilla.monitoring.SchedulingMonitor;
import org.neuralchilli.flotilla.quota.QuotaLedger;
import org.neuralchilli.flotilla.quota.Reservation;
import org.neuralchilli.flotilla.scheduler.AdmissionScheduler;
import org.neuralchilli.flotilla.scheduler.QueuedGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owner of every workflow and task status.
 * <p>
 * All mutations of a workflow run under that workflow's lock: submission, admission
 * hand-off from the scheduler, executor reports, preemption, cancellation and deadline
 * expiry. Group and workflow statuses are never stored per group; they are reduced from
 * the current task instances after each change.
 * <p>
 * Admission passes requested while a workflow lock is held are only triggered after the
 * lock is released.
 */
@ApplicationScoped
public class LifecycleStateMachine {

    private static final Logger log = LoggerFactory.getLogger(LifecycleStateMachine.class);

    static final String TASK_EVENT_ADDRESS = "task.event";
    static final String LEAD_FINISHED = "Lead task finished";

    @Inject
    WorkflowStore store;

    @Inject
    DagResolver dagResolver;

    @Inject
    QuotaLedger ledger;

    @Inject
    AdmissionScheduler scheduler;

    @Inject
    GangCoordinator gang;

    @Inject
    SchedulingMonitor monitor;

    @ConfigProperty(name = "orchestrator.max-retry-per-task", defaultValue = "3")
    int maxRetryPerTask;

    @ConfigProperty(name = "orchestrator.retry.backoff-base", defaultValue = "PT10S")
    Duration backoffBase;

    private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

    // DAG Cache - rebuilt lazily from the stored spec
    private final Map<UUID, WorkflowDag> dagCache = new ConcurrentHashMap<>();

    /**
     * Take over a validated workflow: create the first instance of every task and
     * release the groups whose dependencies are already met.
     */
    public void accept(WorkflowRecord workflow) {
        Instant now = Instant.now();
        List<TaskInstance> instances = new ArrayList<>();
        for (GroupSpec group : workflow.spec().groups()) {
            for (TaskSpec task : group.tasks()) {
                instances.add(TaskInstance.create(workflow.id(), group.name(), task.name(), task.lead(), now));
            }
        }

        mutate(workflow.id(), effects -> {
            store.saveCurrent(instances);
            store.saveWorkflow(workflow);
            log.info("Accepted workflow {} ({}) with {} task(s) in pool {} at {} priority",
                    workflow.name(), workflow.id(), instances.size(), workflow.pool(), workflow.priority());
            evaluateLocked(workflow.id(), effects, now);
            return null;
        });
    }

    /**
     * Hand-off from the admission scheduler: the group holds a reservation and is placed now.
     * A reservation the ledger no longer holds, reclaimed by preemption in between, is stale.
     */
    public PlacementOutcome admit(GroupKey key, Reservation reservation) {
        return mutate(key.workflowId(), effects -> {
            if (ledger.reservation(key).filter(reservation::equals).isEmpty()) {
                log.info("Reservation of {} was revoked before placement, admission is stale", key);
                return PlacementOutcome.STALE;
            }
            Optional<WorkflowRecord> found = store.workflow(key.workflowId());
            if (found.isEmpty() || found.get().isFinished() || found.get().cancelStatus() != null) {
                log.debug("Workflow of {} is gone or stopped, admission is stale", key);
                return PlacementOutcome.STALE;
            }
            WorkflowRecord workflow = found.get();
            GroupSpec group = groupSpec(workflow, key.groupName());
            List<TaskInstance> tasks = groupTasks(workflow, group);

            boolean waiting = tasks.stream()
                    .allMatch(task -> task.status() == TaskStatus.PROCESSING || task.status() == TaskStatus.SCHEDULING);
            if (!waiting) {
                log.debug("Group {} is no longer waiting for admission", key);
                return PlacementOutcome.STALE;
            }

            Instant now = Instant.now();
            List<TaskInstance> scheduling = tasks.stream()
                    .map(task -> task.status() == TaskStatus.SCHEDULING ? task : task.withStatus(TaskStatus.SCHEDULING, now))
                    .collect(Collectors.toList());
            store.saveCurrent(scheduling);

            PlacementResult result = gang.place(key, reservation.pool(), group, scheduling);
            if (!result.accepted()) {
                ledger.release(key);
                refreshWorkflow(workflow, now);
                return PlacementOutcome.REJECTED;
            }

            List<TaskInstance> placed = scheduling.stream()
                    .map(task -> task.place(result.nodeOf(task.id()).orElseThrow()))
                    .collect(Collectors.toList());
            store.saveCurrent(placed);
            gang.arm(key, GangCoordinator.barrierMembers(group, dag(workflow)), now);
            refreshWorkflow(workflow, now);
            return PlacementOutcome.PLACED;
        });
    }

    /**
     * Revoke borrower groups whose reservations the ledger reclaimed. Their tasks end
     * FAILED_PREEMPTED; unless the workflow opted out, the group gets fresh instances and
     * goes back to its queue. Preemption does not count towards the retry ceiling.
     */
    public void preempt(Collection<Reservation> victims) {
        for (Reservation victim : victims) {
            GroupKey key = victim.group();
            mutate(key.workflowId(), effects -> {
                preemptLocked(key, effects, Instant.now());
                return null;
            });
        }
    }

    /**
     * Report from the backend executor about one task instance.
     */
    @ConsumeEvent(value = TASK_EVENT_ADDRESS, blocking = true)
    public void onTaskEvent(TaskEvent event) {
        Optional<TaskInstance> task = store.task(event.taskInstanceId());
        if (task.isEmpty()) {
            log.warn("Event for unknown task instance: {}", event);
            return;
        }
        mutate(task.get().workflowId(), effects -> {
            handleEvent(event, effects, Instant.now());
            return null;
        });
    }

    /**
     * Stop a workflow. Every unfinished task moves to the task variant of {@code stopStatus}
     * right away; running tasks are asked to stop without waiting for the backend.
     *
     * @return false if the workflow had already finished
     */
    public boolean cancel(UUID workflowId, String user, WorkflowStatus stopStatus) {
        return mutate(workflowId, effects -> {
            WorkflowRecord workflow = store.workflow(workflowId)
                    .orElseThrow(() -> new IllegalArgumentException("Workflow not found: " + workflowId));
            if (workflow.isFinished()) {
                return false;
            }

            Instant now = Instant.now();
            TaskStatus taskStatus = stopStatus.toTaskStatus();
            String reason = stopStatus == WorkflowStatus.FAILED_CANCELED
                    ? "Canceled by " + user
                    : stopStatus.name().substring("FAILED_".length()).toLowerCase().replace('_', ' ') + " exceeded";

            scheduler.removeWorkflow(workflowId);

            List<TaskInstance> stopped = new ArrayList<>();
            for (TaskInstance task : currentTasks(workflow).values()) {
                if (task.isFinished()) {
                    continue;
                }
                if (task.node() != null) {
                    gang.cancel(task);
                }
                stopped.add(task.finish(taskStatus, reason, null, now));
            }
            store.saveCurrent(stopped);

            for (GroupSpec group : workflow.spec().groups()) {
                GroupKey key = GroupKey.of(workflowId, group.name());
                releaseGroup(key, effects);
            }

            WorkflowRecord canceled = workflow.cancel(user, stopStatus);
            store.saveWorkflow(canceled);
            log.info("Workflow {} stopped with {} by {}, {} task(s) stopped",
                    workflowId, stopStatus, user, stopped.size());
            refreshWorkflow(canceled, now);
            return true;
        });
    }

    /**
     * A start barrier ran out: tasks still waiting to start fail with FAILED_START_TIMEOUT.
     */
    public void failStartTimeout(GroupKey key) {
        mutate(key.workflowId(), effects -> {
            Instant now = Instant.now();
            Optional<WorkflowRecord> workflow = store.workflow(key.workflowId());
            if (workflow.isEmpty() || workflow.get().isFinished()) {
                gang.disarm(key);
                return null;
            }
            String pending = gang.barrier(key).map(barrier -> String.join(", ", barrier.pending())).orElse("");
            GroupSpec group = groupSpec(workflow.get(), key.groupName());

            List<TaskInstance> failed = new ArrayList<>();
            for (TaskInstance task : groupTasks(workflow.get(), group)) {
                if (task.isFinished()) {
                    continue;
                }
                if (task.node() != null) {
                    gang.cancel(task);
                }
                TaskStatus status = task.status() == TaskStatus.RUNNING ? TaskStatus.FAILED : TaskStatus.FAILED_START_TIMEOUT;
                failed.add(task.finish(status, "Start barrier timed out waiting for: " + pending, null, now));
            }
            store.saveCurrent(failed);
            gang.disarm(key);
            monitor.recordStartTimeout();
            log.warn("Group {} failed to start in time, waiting for [{}]", key, pending);

            afterGroupChange(workflow.get(), group, effects, now);
            return null;
        });
    }

    /**
     * Place replacement instances of placed groups whose backoff has elapsed, and
     * retry replacements the backend refused earlier.
     */
    public void placeDueReplacements(Instant now) {
        for (GroupKey key : gang.placedGroups()) {
            mutate(key.workflowId(), effects -> {
                Optional<WorkflowRecord> workflow = store.workflow(key.workflowId());
                if (workflow.isEmpty() || workflow.get().isFinished()) {
                    return null;
                }
                GroupSpec group = groupSpec(workflow.get(), key.groupName());
                for (TaskInstance task : groupTasks(workflow.get(), group)) {
                    boolean waiting = task.status() == TaskStatus.PROCESSING || task.status() == TaskStatus.SCHEDULING;
                    if (waiting && task.isEligible(now)) {
                        placeReplacement(workflow.get(), group, task, now);
                    }
                }
                return null;
            });
        }
    }

    /**
     * Validated DAG of a workflow, from the cache or built from its spec.
     */
    public WorkflowDag dag(WorkflowRecord workflow) {
        WorkflowDag cached = dagCache.get(workflow.id());
        if (cached != null) {
            monitor.recordDagCacheHit();
            return cached;
        }
        monitor.recordDagCacheMiss();
        return dagCache.computeIfAbsent(workflow.id(), id -> dagResolver.buildDag(workflow.spec()));
    }

    /**
     * Current group statuses of a workflow, reduced from its current task instances.
     */
    public Map<String, TaskStatus> groupStatuses(WorkflowRecord workflow) {
        return groupStatuses(workflow, currentTasks(workflow));
    }

    /**
     * Forget a finished workflow: its stored state, cached DAG and lock.
     *
     * @return false if the workflow is unknown or not finished
     */
    public boolean evict(UUID workflowId) {
        boolean evicted = mutate(workflowId, effects -> {
            Optional<WorkflowRecord> workflow = store.workflow(workflowId);
            if (workflow.isEmpty() || !workflow.get().isFinished()) {
                return false;
            }
            store.removeWorkflow(workflowId);
            dagCache.remove(workflowId);
            return true;
        });
        locks.remove(workflowId);
        return evicted;
    }

    public void reset() {
        dagCache.clear();
        locks.clear();
        gang.reset();
        scheduler.reset();
    }

    // ---- locked steps ----

    private void evaluateLocked(UUID workflowId, Effects effects, Instant now) {
        Optional<WorkflowRecord> found = store.workflow(workflowId);
        if (found.isEmpty()) {
            log.warn("Workflow not found: {}", workflowId);
            return;
        }
        WorkflowRecord workflow = found.get();
        if (workflow.isFinished()) {
            log.debug("Workflow already finished: {}", workflowId);
            return;
        }

        WorkflowDag dag = dag(workflow);
        Map<String, TaskInstance> current = currentTasks(workflow);
        Map<String, TaskStatus> groupStatuses = groupStatuses(workflow, current);
        List<TaskInstance> changed = new ArrayList<>();

        for (String groupName : dag.topologicalGroups()) {
            GroupSpec group = groupSpec(workflow, groupName);
            List<TaskInstance> tasks = tasksOf(group, current);
            boolean unreleased = tasks.stream()
                    .allMatch(task -> task.status() == TaskStatus.SUBMITTING || task.status() == TaskStatus.WAITING);
            if (!unreleased) {
                continue;
            }

            Optional<String> failedUpstream = dag.upstreamGroups(groupName).stream()
                    .filter(upstream -> groupStatuses.get(upstream).isFailed())
                    .findFirst();

            TaskStatus groupStatus;
            if (failedUpstream.isPresent()) {
                String reason = "Upstream group failed: " + failedUpstream.get();
                for (TaskInstance task : tasks) {
                    changed.add(task.finish(TaskStatus.FAILED_UPSTREAM, reason, null, now));
                }
                groupStatus = TaskStatus.FAILED_UPSTREAM;
                log.info("Group {} of workflow {} failed upstream ({})", groupName, workflowId, failedUpstream.get());
            } else if (dag.isGroupReady(groupName, groupStatuses::get)) {
                for (TaskInstance task : tasks) {
                    changed.add(task.withStatus(TaskStatus.PROCESSING, now));
                }
                enqueue(workflow, group, effects);
                groupStatus = TaskStatus.PROCESSING;
            } else {
                for (TaskInstance task : tasks) {
                    if (task.status() == TaskStatus.SUBMITTING) {
                        changed.add(task.withStatus(TaskStatus.WAITING, now));
                    }
                }
                groupStatus = TaskStatus.WAITING;
            }
            groupStatuses.put(groupName, groupStatus);
        }

        store.saveCurrent(changed);
        refreshWorkflow(workflow, now);
    }

    private void handleEvent(TaskEvent event, Effects effects, Instant now) {
        TaskInstance task = store.task(event.taskInstanceId()).orElseThrow();
        WorkflowRecord workflow = store.workflow(task.workflowId()).orElse(null);
        if (workflow == null) {
            log.warn("Event for task {} of unknown workflow {}", task.taskName(), task.workflowId());
            return;
        }

        boolean isCurrent = store.currentTask(task.workflowId(), task.taskName())
                .map(currentTask -> currentTask.id().equals(task.id()))
                .orElse(false);
        if (!isCurrent) {
            log.debug("Ignoring {} for retired instance {} of task {}", event.phase(), task.id(), task.taskName());
            return;
        }

        if (task.isFinished()) {
            if (task.status().isCanceled() && event.phase().isTerminal()) {
                reconcile(task, event, now);
            } else {
                log.debug("Ignoring {} for finished task {} ({})", event.phase(), task.taskName(), task.status());
            }
            return;
        }

        GroupSpec group = groupSpec(workflow, task.groupName());
        switch (event.phase()) {
            case INITIALIZING, RUNNING -> log.debug("Task {} reported {}", task.taskName(), event.phase());
            case READY -> onReady(workflow, group, task, now);
            default -> onTerminal(workflow, group, task, event, effects, now);
        }
    }

    private void onReady(WorkflowRecord workflow, GroupSpec group, TaskInstance task, Instant now) {
        if (!task.status().isActive()) {
            log.warn("Task {} reported READY while {}", task.taskName(), task.status());
            return;
        }
        TaskInstance ready = task.ready(now);
        store.saveCurrent(ready);

        Map<String, TaskInstance> current = groupTaskMap(workflow, group);
        List<TaskInstance> toStart = gang.onReady(ready.groupKey(), ready.taskName(), dag(workflow), current);
        startTasks(workflow, toStart, now);
    }

    private void onTerminal(
            WorkflowRecord workflow,
            GroupSpec group,
            TaskInstance task,
            TaskEvent event,
            Effects effects,
            Instant now
    ) {
        TaskStatus status = event.phase().terminalStatus();
        String reason = event.reason();
        Integer exitCode = event.exitCode();
        boolean reschedule = false;
        Instant notBefore = null;
        int retriesUsed = retriesUsed(task);

        Optional<ExitAction> action = exitCode == null
                ? Optional.empty()
                : exitActions(workflow, group, task).actionFor(exitCode);

        if (action.isPresent()) {
            switch (action.get()) {
                case COMPLETE -> status = TaskStatus.COMPLETED;
                case FAIL -> status = TaskStatus.FAILED;
                case RESCHEDULE -> {
                    if (retriesUsed < maxRetryPerTask) {
                        reschedule = true;
                    } else {
                        log.info("Exit action RESCHEDULE for task {} ignored, retry limit {} reached",
                                task.taskName(), maxRetryPerTask);
                    }
                }
            }
            if (reason == null) {
                reason = "Exit code " + exitCode + " (" + action.get() + ")";
            }
        } else {
            RetryPolicy policy = status.retryPolicy();
            if (policy.isAutomatic() && retriesUsed < maxRetryPerTask) {
                reschedule = true;
                if (policy == RetryPolicy.BACKOFF) {
                    notBefore = now.plus(backoffBase.multipliedBy(1L << Math.min(retriesUsed, 20)));
                }
            }
        }

        if (reschedule) {
            String retiredReason = reason != null ? reason : status.name();
            TaskInstance retired = task.finish(TaskStatus.RESCHEDULED, retiredReason, exitCode, now);
            TaskInstance successor = successor(retired, now, notBefore);
            store.saveRetired(retired);
            store.saveCurrent(successor);
            monitor.recordReschedule();
            log.info("Rescheduling task {} of {} as retry {} ({}){}",
                    task.taskName(), task.groupKey(), successor.retryId(), retiredReason,
                    notBefore != null ? ", not before " + notBefore : "");
            onRescheduled(workflow, group, retired, successor, now);
        } else {
            TaskInstance finished = task.finish(status, reason, exitCode, now);
            store.saveCurrent(finished);
            if (status == TaskStatus.COMPLETED) {
                monitor.recordTaskCompleted();
                log.info("Task {} of {} completed", task.taskName(), task.groupKey());
            } else {
                monitor.recordTaskFailed();
                log.warn("Task {} of {} ended {}: {}", task.taskName(), task.groupKey(), status, reason);
            }
            onFinished(workflow, group, finished, now);
        }

        afterGroupChange(workflow, group, effects, now);
    }

    private void onRescheduled(
            WorkflowRecord workflow,
            GroupSpec group,
            TaskInstance retired,
            TaskInstance successor,
            Instant now
    ) {
        boolean restartOthers = retired.lead() || !group.ignoreNonleadStatus();
        if (restartOthers) {
            List<TaskInstance> restarted = new ArrayList<>();
            for (TaskInstance other : groupTasks(workflow, group)) {
                if (!other.taskName().equals(retired.taskName()) && other.status().isActive()) {
                    gang.restart(other);
                    restarted.add(other.restart());
                }
            }
            store.saveCurrent(restarted);
            gang.arm(retired.groupKey(), GangCoordinator.barrierMembers(group, dag(workflow)), now);
        }

        if (successor.isEligible(now)) {
            placeReplacement(workflow, group, successor, now);
        }
    }

    private void onFinished(WorkflowRecord workflow, GroupSpec group, TaskInstance finished, Instant now) {
        GroupKey key = finished.groupKey();

        if (finished.status() == TaskStatus.COMPLETED) {
            List<TaskInstance> released = gang.onCompleted(
                    key, finished.taskName(), dag(workflow), groupTaskMap(workflow, group));
            startTasks(workflow, released, now);
        }

        String stopReason = null;
        TaskStatus stopStatus = null;
        if (finished.lead()) {
            stopReason = LEAD_FINISHED;
            stopStatus = finished.status() == TaskStatus.COMPLETED ? TaskStatus.COMPLETED : TaskStatus.FAILED;
        } else if (finished.status().isFailed() && !group.ignoreNonleadStatus()) {
            stopReason = "Group member " + finished.taskName() + " failed";
            stopStatus = TaskStatus.FAILED;
        }
        if (stopStatus == null) {
            return;
        }

        List<TaskInstance> stopped = new ArrayList<>();
        for (TaskInstance other : groupTasks(workflow, group)) {
            if (other.isFinished()) {
                continue;
            }
            if (other.node() != null) {
                gang.cancel(other);
            }
            stopped.add(other.finish(stopStatus, stopReason, null, now));
        }
        store.saveCurrent(stopped);
        if (!stopped.isEmpty()) {
            log.info("Stopped {} remaining task(s) of {}: {}", stopped.size(), key, stopReason);
        }
    }

    private void afterGroupChange(WorkflowRecord workflow, GroupSpec group, Effects effects, Instant now) {
        GroupKey key = GroupKey.of(workflow.id(), group.name());
        TaskStatus groupStatus = StatusReducer.reduceGroup(group, groupTasks(workflow, group));
        if (groupStatus.isGroupFinished()) {
            releaseGroup(key, effects);
            log.info("Group {} finished: {}", key, groupStatus);
        }
        evaluateLocked(workflow.id(), effects, now);
    }

    private void preemptLocked(GroupKey key, Effects effects, Instant now) {
        Optional<WorkflowRecord> found = store.workflow(key.workflowId());
        if (found.isEmpty() || found.get().isFinished()) {
            return;
        }
        WorkflowRecord workflow = found.get();
        GroupSpec group = groupSpec(workflow, key.groupName());
        List<TaskInstance> tasks = groupTasks(workflow, group);
        gang.discard(key);

        List<TaskInstance> retired = new ArrayList<>();
        for (TaskInstance task : tasks) {
            if (task.isFinished()) {
                retired.add(task);
                continue;
            }
            if (task.node() != null) {
                gang.cancel(task);
            }
            retired.add(task.finish(TaskStatus.FAILED_PREEMPTED, "Preempted to reclaim borrowed capacity", null, now));
        }

        if (workflow.spec().reschedulePreempted()) {
            retired.forEach(store::saveRetired);
            List<TaskInstance> successors = retired.stream()
                    .map(task -> successor(task, now, null))
                    .collect(Collectors.toList());
            store.saveCurrent(successors);
            enqueue(workflow, group, effects);
            monitor.recordReschedule();
            log.info("Group {} preempted, re-queued with {} new task instance(s)", key, successors.size());
            refreshWorkflow(workflow, now);
        } else {
            store.saveCurrent(retired);
            log.info("Group {} preempted, workflow opted out of rescheduling", key);
            afterGroupChange(workflow, group, effects, now);
        }
    }

    private void reconcile(TaskInstance task, TaskEvent event, Instant now) {
        TaskStatus reported = event.phase().terminalStatus();
        TaskInstance reconciled = task.reconcile(reported, event.reason(), event.exitCode(), now);
        store.saveCurrent(reconciled);
        log.info("Reconciled canceled task {} with reported outcome {}", task.taskName(), reported);
    }

    private void placeReplacement(WorkflowRecord workflow, GroupSpec group, TaskInstance task, Instant now) {
        TaskInstance scheduling = task.status() == TaskStatus.SCHEDULING
                ? task
                : task.withStatus(TaskStatus.SCHEDULING, now);
        store.saveCurrent(scheduling);

        PlacementResult result = gang.place(task.groupKey(), workflow.pool(), group, List.of(scheduling));
        if (!result.accepted()) {
            log.info("Replacement of task {} not placed yet: {}", task.taskName(), result.reason());
            return;
        }
        store.saveCurrent(scheduling.place(result.nodeOf(scheduling.id()).orElseThrow()));
    }

    private void startTasks(WorkflowRecord workflow, List<TaskInstance> tasks, Instant now) {
        if (tasks.isEmpty()) {
            return;
        }
        gang.start(tasks.get(0).groupKey(), tasks);
        List<TaskInstance> running = tasks.stream()
                .map(task -> task.start(now))
                .collect(Collectors.toList());
        store.saveCurrent(running);
        refreshWorkflow(workflow, now);
    }

    /**
     * Recompute the derived workflow status and store it if it changed.
     */
    private void refreshWorkflow(WorkflowRecord stale, Instant now) {
        WorkflowRecord workflow = store.workflow(stale.id()).orElse(stale);
        if (workflow.isFinished()) {
            return;
        }
        WorkflowDag dag = dag(workflow);
        Map<String, TaskInstance> current = currentTasks(workflow);
        Map<String, TaskStatus> statuses = groupStatuses(workflow, current);
        WorkflowStatus status = StatusReducer.reduceWorkflow(workflow, dag.topologicalGroups(), statuses);
        if (status == workflow.status()) {
            return;
        }

        String reason = null;
        if (status.isFailed() && workflow.failureReason() == null) {
            reason = failureReason(workflow, dag, statuses, current);
        }
        WorkflowRecord updated = workflow.withStatus(status, reason, now);
        store.saveWorkflow(updated);

        if (status.isFinished()) {
            dagCache.remove(workflow.id());
            log.info("Workflow {} ({}) finished: {}", workflow.name(), workflow.id(), status);
        } else {
            log.debug("Workflow {} is now {}", workflow.id(), status);
        }
    }

    private String failureReason(
            WorkflowRecord workflow,
            WorkflowDag dag,
            Map<String, TaskStatus> statuses,
            Map<String, TaskInstance> current
    ) {
        if (workflow.canceledBy() != null) {
            return workflow.cancelStatus() == WorkflowStatus.FAILED_CANCELED
                    ? "Canceled by " + workflow.canceledBy()
                    : workflow.cancelStatus().name();
        }
        for (String groupName : dag.topologicalGroups()) {
            TaskStatus status = statuses.get(groupName);
            if (status == null || !status.isFailed() || status == TaskStatus.FAILED_UPSTREAM) {
                continue;
            }
            GroupSpec group = groupSpec(workflow, groupName);
            return tasksOf(group, current).stream()
                    .filter(task -> task.status().isFailed() && task.reason() != null)
                    .map(task -> task.taskName() + ": " + task.reason())
                    .findFirst()
                    .orElse("Group " + groupName + " " + status);
        }
        return null;
    }

    private void enqueue(WorkflowRecord workflow, GroupSpec group, Effects effects) {
        scheduler.enqueue(new QueuedGroup(
                GroupKey.of(workflow.id(), group.name()),
                workflow.pool(),
                workflow.priority(),
                workflow.submittedAt(),
                workflow.sequence(),
                group.demand()
        ));
        effects.admit(workflow.pool());
    }

    private void releaseGroup(GroupKey key, Effects effects) {
        gang.discard(key);
        ledger.release(key).ifPresent(released -> {
            effects.admit(released.pool());
            if (released.isBorrowing()) {
                released.loans().forEach(loan -> effects.admit(loan.lenderPool()));
            }
            // Capacity in this pool may have been all that a borrowing sibling was waiting for
            ledger.siblings(released.pool()).forEach(sibling -> effects.admit(sibling.name()));
        });
    }

    /**
     * Successor of a retired instance. The group was released already, so it leaves
     * SUBMITTING for PROCESSING straight away.
     */
    private static TaskInstance successor(TaskInstance retired, Instant now, Instant notBefore) {
        return retired.retry(now, notBefore).withStatus(TaskStatus.PROCESSING, now);
    }

    // ---- reads ----

    private int retriesUsed(TaskInstance task) {
        return store.reschedules(task.workflowId(), task.taskName());
    }

    private ExitActionRules exitActions(WorkflowRecord workflow, GroupSpec group, TaskInstance task) {
        ExitActionRules taskRules = group.task(task.taskName())
                .map(TaskSpec::exitActions)
                .orElse(ExitActionRules.NONE);
        if (!taskRules.isEmpty()) {
            return taskRules;
        }
        return ledger.pool(workflow.pool())
                .map(Pool::defaultExitActions)
                .orElse(ExitActionRules.NONE);
    }

    private GroupSpec groupSpec(WorkflowRecord workflow, String groupName) {
        return workflow.spec().group(groupName)
                .orElseThrow(() -> new IllegalStateException(
                        "Group " + groupName + " not found in workflow " + workflow.id()));
    }

    private Map<String, TaskInstance> currentTasks(WorkflowRecord workflow) {
        return store.currentTasks(workflow.id(), workflow.spec().taskNames());
    }

    private Map<String, TaskInstance> groupTaskMap(WorkflowRecord workflow, GroupSpec group) {
        List<String> names = group.tasks().stream().map(TaskSpec::name).collect(Collectors.toList());
        return store.currentTasks(workflow.id(), names);
    }

    private List<TaskInstance> groupTasks(WorkflowRecord workflow, GroupSpec group) {
        return tasksOf(group, groupTaskMap(workflow, group));
    }

    private static List<TaskInstance> tasksOf(GroupSpec group, Map<String, TaskInstance> current) {
        List<TaskInstance> tasks = new ArrayList<>();
        for (TaskSpec spec : group.tasks()) {
            TaskInstance task = current.get(spec.name());
            if (task == null) {
                throw new IllegalStateException("No instance of task " + spec.name() + " in group " + group.name());
            }
            tasks.add(task);
        }
        return tasks;
    }

    private static Map<String, TaskStatus> groupStatuses(WorkflowRecord workflow, Map<String, TaskInstance> current) {
        Map<String, TaskStatus> statuses = new HashMap<>();
        for (GroupSpec group : workflow.spec().groups()) {
            statuses.put(group.name(), StatusReducer.reduceGroup(group, tasksOf(group, current)));
        }
        return statuses;
    }

    // ---- locking ----

    private <T> T mutate(UUID workflowId, Function<Effects, T> action) {
        Effects effects = new Effects();
        ReentrantLock lock = locks.computeIfAbsent(workflowId, id -> new ReentrantLock());
        T result;
        lock.lock();
        try {
            result = action.apply(effects);
        } finally {
            lock.unlock();
        }
        effects.pools.forEach(scheduler::requestAdmission);
        return result;
    }

    /**
     * Follow-up work collected under a workflow lock and run after it is released.
     */
    private static final class Effects {
        private final Set<String> pools = new LinkedHashSet<>();

        void admit(String pool) {
            pools.add(pool);
        }
    }
}
