package org.neuralchilli.flotilla.core;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.flakeidgen.FlakeIdGenerator;
import com.hazelcast.map.IMap;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.flotilla.domain.TaskInstance;
import org.neuralchilli.flotilla.domain.TaskLookupKey;
import org.neuralchilli.flotilla.domain.TaskStatus;
import org.neuralchilli.flotilla.domain.WorkflowRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Workflow and task instance state in Hazelcast.
 * <p>
 * {@code task-instances} keeps every instance ever created, retired ones included;
 * {@code task-instance-index} points each (workflow, task) at its current instance;
 * {@code task-reschedules} counts the RESCHEDULED instances of each (workflow, task).
 * Multi-instance writes go through one {@code putAll} per map.
 */
@ApplicationScoped
public class WorkflowStore {

    private static final Logger log = LoggerFactory.getLogger(WorkflowStore.class);

    @Inject
    HazelcastInstance hazelcast;

    private IMap<UUID, WorkflowRecord> workflows;
    private IMap<UUID, TaskInstance> taskInstances;
    private IMap<TaskLookupKey, UUID> taskInstanceIndex;
    private IMap<TaskLookupKey, Integer> taskReschedules;
    private FlakeIdGenerator submissionSequence;

    @PostConstruct
    void init() {
        workflows = hazelcast.getMap("workflows");
        taskInstances = hazelcast.getMap("task-instances");
        taskInstanceIndex = hazelcast.getMap("task-instance-index");
        taskReschedules = hazelcast.getMap("task-reschedules");
        submissionSequence = hazelcast.getFlakeIdGenerator("submission-sequence");
        log.info("WorkflowStore initialized");
    }

    /**
     * Next submission sequence number. Increasing for submissions on this member.
     */
    public long nextSequence() {
        return submissionSequence.newId();
    }

    public void saveWorkflow(WorkflowRecord workflow) {
        workflows.set(workflow.id(), workflow);
    }

    public Optional<WorkflowRecord> workflow(UUID workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    public Collection<WorkflowRecord> workflows() {
        return new ArrayList<>(workflows.values());
    }

    public List<WorkflowRecord> unfinishedWorkflows() {
        return workflows.values().stream()
                .filter(workflow -> !workflow.isFinished())
                .collect(Collectors.toList());
    }

    public Optional<TaskInstance> task(UUID taskInstanceId) {
        return Optional.ofNullable(taskInstances.get(taskInstanceId));
    }

    /**
     * Store instances that are the current attempt of their task.
     */
    public void saveCurrent(List<TaskInstance> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return;
        }

        Map<UUID, TaskInstance> batch = tasks.stream()
                .collect(Collectors.toMap(TaskInstance::id, Function.identity()));
        Map<TaskLookupKey, UUID> indexBatch = tasks.stream()
                .collect(Collectors.toMap(TaskInstance::lookupKey, TaskInstance::id));

        // Instances first, so the index never points at a missing instance
        taskInstances.putAll(batch);
        taskInstanceIndex.putAll(indexBatch);
        log.trace("Stored {} current task instance(s)", batch.size());
    }

    public void saveCurrent(TaskInstance task) {
        saveCurrent(List.of(task));
    }

    /**
     * Store retired instances. The index is left alone.
     */
    public void saveRetired(TaskInstance task) {
        taskInstances.set(task.id(), task);
        if (task.status() == TaskStatus.RESCHEDULED) {
            taskReschedules.merge(task.lookupKey(), 1, Integer::sum);
        }
    }

    /**
     * Number of instances of a task retired as RESCHEDULED so far.
     */
    public int reschedules(UUID workflowId, String taskName) {
        Integer count = taskReschedules.get(new TaskLookupKey(workflowId, taskName));
        return count == null ? 0 : count;
    }

    public Optional<TaskInstance> currentTask(UUID workflowId, String taskName) {
        UUID id = taskInstanceIndex.get(new TaskLookupKey(workflowId, taskName));
        return id == null ? Optional.empty() : task(id);
    }

    /**
     * Current instances of the named tasks, keyed by task name. Tasks without an
     * instance are absent from the result.
     */
    public Map<String, TaskInstance> currentTasks(UUID workflowId, Collection<String> taskNames) {
        Set<TaskLookupKey> keys = taskNames.stream()
                .map(name -> new TaskLookupKey(workflowId, name))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<TaskLookupKey, UUID> ids = taskInstanceIndex.getAll(keys);
        Map<UUID, TaskInstance> instances = taskInstances.getAll(new LinkedHashSet<>(ids.values()));

        Map<String, TaskInstance> result = new HashMap<>();
        for (Map.Entry<TaskLookupKey, UUID> entry : ids.entrySet()) {
            TaskInstance instance = instances.get(entry.getValue());
            if (instance != null) {
                result.put(entry.getKey().taskName(), instance);
            }
        }
        return result;
    }

    /**
     * Every instance of a workflow, retired ones included, by task then retry id.
     */
    public List<TaskInstance> allInstances(UUID workflowId) {
        return taskInstances.values().stream()
                .filter(task -> task.workflowId().equals(workflowId))
                .sorted(Comparator.comparing(TaskInstance::taskName).thenComparingInt(TaskInstance::retryId))
                .collect(Collectors.toList());
    }

    /**
     * Workflows that finished before {@code cutoff}, rejected submissions included.
     */
    public List<UUID> finishedBefore(Instant cutoff) {
        return workflows.values().stream()
                .filter(WorkflowRecord::isFinished)
                .filter(workflow -> workflow.finishedAt() != null && workflow.finishedAt().isBefore(cutoff))
                .map(WorkflowRecord::id)
                .collect(Collectors.toList());
    }

    /**
     * Drop a workflow with every instance of its tasks.
     */
    public void removeWorkflow(UUID workflowId) {
        List<TaskInstance> instances = allInstances(workflowId);
        for (TaskInstance instance : instances) {
            taskInstances.delete(instance.id());
            taskInstanceIndex.delete(instance.lookupKey());
            taskReschedules.delete(instance.lookupKey());
        }
        workflows.delete(workflowId);
        log.debug("Removed workflow {} and {} task instance(s)", workflowId, instances.size());
    }

    /**
     * Remove all state. Used between tests.
     */
    public void clear() {
        workflows.clear();
        taskInstances.clear();
        taskInstanceIndex.clear();
        taskReschedules.clear();
    }
}
