package org.neuralchilli.flotilla.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.flotilla.core.DagResolver;
import org.neuralchilli.flotilla.domain.GroupSpec;
import org.neuralchilli.flotilla.domain.Pool;
import org.neuralchilli.flotilla.domain.TaskSpec;
import org.neuralchilli.flotilla.domain.WorkflowSpec;
import org.neuralchilli.flotilla.quota.QuotaLedger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Submission checks beyond record validation: the DAG must be acyclic and fully
 * resolved, the pool must exist, and every group must be able to run in it at all.
 */
@ApplicationScoped
public class WorkflowValidatorService {

    @Inject
    DagResolver dagResolver;

    @Inject
    QuotaLedger ledger;

    /**
     * Validate a workflow against its target pool
     *
     * @throws CyclicDependencyException if the workflow's dependencies form a cycle
     * @throws ValidationException       for any other reason the workflow can never run
     */
    public void validateWorkflow(WorkflowSpec spec) {
        List<String> errors = new ArrayList<>();

        try {
            dagResolver.buildDag(spec);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }

        Optional<Pool> pool = ledger.pool(spec.pool());
        if (pool.isEmpty()) {
            errors.add("Pool '" + spec.pool() + "' does not exist");
        } else {
            validatePlatforms(spec, pool.get(), errors);
            validateFeasibility(spec, errors);
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(spec.name(), errors);
        }
    }

    private void validatePlatforms(WorkflowSpec spec, Pool pool, List<String> errors) {
        for (GroupSpec group : spec.groups()) {
            for (TaskSpec task : group.tasks()) {
                if (!pool.acceptsTask(task.resources())) {
                    errors.add("Task '" + task.name() + "' fits no platform of pool '" + pool.name() + "'");
                }
            }
        }
    }

    private void validateFeasibility(WorkflowSpec spec, List<String> errors) {
        for (GroupSpec group : spec.groups()) {
            if (!ledger.isStaticallyFeasible(spec.pool(), spec.priority(), group.demand())) {
                errors.add("Group '" + group.name() + "' needs " + group.demand() + ", more than "
                        + spec.priority() + " work can ever get in pool '" + spec.pool() + "'");
            }
        }
    }
}
