package org.neuralchilli.flotilla.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.flotilla.config.TimeoutDefaults;
import org.neuralchilli.flotilla.config.YamlParser;
import org.neuralchilli.flotilla.core.LifecycleStateMachine;
import org.neuralchilli.flotilla.core.WorkflowStore;
import org.neuralchilli.flotilla.domain.GroupSpec;
import org.neuralchilli.flotilla.domain.Pool;
import org.neuralchilli.flotilla.domain.Priority;
import org.neuralchilli.flotilla.domain.TaskInstance;
import org.neuralchilli.flotilla.domain.TaskSpec;
import org.neuralchilli.flotilla.domain.TaskStatus;
import org.neuralchilli.flotilla.domain.WorkflowRecord;
import org.neuralchilli.flotilla.domain.WorkflowSpec;
import org.neuralchilli.flotilla.domain.WorkflowStatus;
import org.neuralchilli.flotilla.quota.PoolUsage;
import org.neuralchilli.flotilla.quota.QuotaLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Submission, query and cancel operations on workflows.
 * <p>
 * A submission is validated before anything is scheduled. Rejected submissions are kept
 * in history with status FAILED_SUBMISSION and never reach the admission queues.
 */
@ApplicationScoped
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    @Inject
    WorkflowValidatorService validator;

    @Inject
    LifecycleStateMachine lifecycle;

    @Inject
    WorkflowStore store;

    @Inject
    QuotaLedger ledger;

    @Inject
    YamlParser yamlParser;

    @Inject
    TimeoutDefaults timeouts;

    /**
     * Submit a workflow on behalf of a user.
     *
     * @return id of the accepted workflow
     * @throws SubmissionException if the workflow was rejected
     */
    public UUID submit(WorkflowSpec spec, String user) {
        Instant now = Instant.now();
        try {
            validator.validateWorkflow(spec);
        } catch (CyclicDependencyException | ValidationException e) {
            throw reject(spec.name(), spec.pool(), spec.priority(), spec, user, now, e);
        }

        Pool pool = ledger.pool(spec.pool()).orElseThrow();
        WorkflowRecord workflow = WorkflowRecord.create(
                spec,
                user,
                store.nextSequence(),
                now,
                firstNonNull(spec.queueTimeout(), pool.defaultQueueTimeout(), timeouts.queue()),
                firstNonNull(spec.execTimeout(), pool.defaultExecTimeout(), timeouts.exec())
        );
        lifecycle.accept(workflow);

        log.info("Workflow {} submitted by {}: {}", workflow.name(), user, workflow.id());
        return workflow.id();
    }

    /**
     * Parse and submit a YAML workflow definition
     *
     * @throws SubmissionException if the YAML is invalid or the workflow was rejected
     */
    public UUID submitYaml(String yaml, String user) {
        WorkflowSpec spec;
        try {
            spec = yamlParser.parseWorkflow(yaml);
        } catch (IllegalArgumentException | YAMLException e) {
            throw reject(null, null, Priority.NORMAL, null, user, Instant.now(), e);
        }
        return submit(spec, user);
    }

    /**
     * Status tree of a workflow
     *
     * @throws WorkflowNotFoundException if no such workflow was ever submitted
     */
    public WorkflowView getStatus(UUID workflowId) {
        WorkflowRecord workflow = store.workflow(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));

        List<GroupView> groups = new ArrayList<>();
        if (workflow.spec() != null) {
            Map<String, TaskStatus> statuses = lifecycle.groupStatuses(workflow);
            Map<String, TaskInstance> current = store.currentTasks(workflowId, workflow.spec().taskNames());
            for (GroupSpec group : workflow.spec().groups()) {
                List<TaskView> tasks = group.tasks().stream()
                        .map(TaskSpec::name)
                        .map(current::get)
                        .filter(Objects::nonNull)
                        .map(TaskView::of)
                        .collect(Collectors.toList());
                groups.add(new GroupView(group.name(), statuses.get(group.name()), tasks));
            }
        }

        return new WorkflowView(
                workflow.id(),
                workflow.name(),
                workflow.user(),
                workflow.pool(),
                workflow.priority(),
                workflow.status(),
                workflow.submittedAt(),
                workflow.startedAt(),
                workflow.finishedAt(),
                workflow.canceledBy(),
                workflow.failureReason(),
                groups
        );
    }

    /**
     * Every attempt of every task of a workflow, retired ones included
     */
    public List<TaskView> getAttempts(UUID workflowId) {
        if (store.workflow(workflowId).isEmpty()) {
            throw new WorkflowNotFoundException(workflowId);
        }
        return store.allInstances(workflowId).stream()
                .map(TaskView::of)
                .collect(Collectors.toList());
    }

    /**
     * Cancel a workflow on behalf of a user.
     *
     * @return false if the workflow had already finished
     * @throws WorkflowNotFoundException if no such workflow was ever submitted
     */
    public boolean cancel(UUID workflowId, String user) {
        if (store.workflow(workflowId).isEmpty()) {
            throw new WorkflowNotFoundException(workflowId);
        }
        boolean canceled = lifecycle.cancel(workflowId, user, WorkflowStatus.FAILED_CANCELED);
        if (!canceled) {
            log.info("Workflow {} already finished, cancel by {} ignored", workflowId, user);
        }
        return canceled;
    }

    /**
     * Workflow history, newest submission first
     */
    public List<WorkflowSummary> getHistory(HistoryQuery query) {
        return store.workflows().stream()
                .filter(query::matches)
                .sorted(Comparator.comparing(WorkflowRecord::submittedAt)
                        .thenComparingLong(WorkflowRecord::sequence)
                        .reversed())
                .limit(query.limit())
                .map(WorkflowSummary::of)
                .collect(Collectors.toList());
    }

    public Optional<PoolUsage> getPoolUsage(String pool) {
        return ledger.pool(pool).map(found -> ledger.usage(found.name()));
    }

    public List<PoolUsage> getPoolUsage() {
        return ledger.pools().stream()
                .map(pool -> ledger.usage(pool.name()))
                .collect(Collectors.toList());
    }

    private SubmissionException reject(
            String name,
            String pool,
            Priority priority,
            WorkflowSpec spec,
            String user,
            Instant now,
            RuntimeException cause
    ) {
        WorkflowRecord rejected = WorkflowRecord.rejected(
                name, pool, priority, spec, user, store.nextSequence(), now, cause.getMessage());
        store.saveWorkflow(rejected);
        log.warn("Rejected workflow {} submitted by {}: {}", rejected.name(), user, cause.getMessage());
        return new SubmissionException(rejected.id(), cause.getMessage(), cause);
    }

    private static Duration firstNonNull(Duration... candidates) {
        for (Duration candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
