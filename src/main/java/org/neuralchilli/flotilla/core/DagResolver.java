package org.neuralchilli.flotilla.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.flotilla.domain.GroupSpec;
import org.neuralchilli.flotilla.domain.TaskNode;
import org.neuralchilli.flotilla.domain.TaskSpec;
import org.neuralchilli.flotilla.domain.WorkflowSpec;
import org.neuralchilli.flotilla.service.CyclicDependencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds workflow DAGs using JGraphT.
 * Task dependencies across groups are promoted to group dependencies; dependencies
 * inside a group only order tasks within the gang.
 */
@ApplicationScoped
public class DagResolver {

    private static final Logger log = LoggerFactory.getLogger(DagResolver.class);

    /**
     * Build and validate the DAG of a workflow.
     *
     * @param spec The workflow definition
     * @return the validated DAG
     * @throws CyclicDependencyException if tasks or groups depend on each other in a cycle
     * @throws IllegalArgumentException  if a task depends on a task the workflow does not define
     */
    public WorkflowDag buildDag(WorkflowSpec spec) {
        log.debug("Building DAG for workflow: {}", spec.name());

        DirectedAcyclicGraph<TaskNode, DefaultEdge> tasks = new DirectedAcyclicGraph<>(DefaultEdge.class);
        DirectedAcyclicGraph<String, DefaultEdge> groups = new DirectedAcyclicGraph<>(DefaultEdge.class);
        Map<String, TaskNode> nodes = new HashMap<>();

        // First pass: vertices
        for (GroupSpec group : spec.groups()) {
            groups.addVertex(group.name());
            for (TaskSpec task : group.tasks()) {
                TaskNode node = new TaskNode(task.name(), group.name());
                tasks.addVertex(node);
                nodes.put(task.name(), node);
            }
        }

        // Second pass: edges, from dependency to dependent
        for (GroupSpec group : spec.groups()) {
            for (TaskSpec task : group.tasks()) {
                TaskNode target = nodes.get(task.name());

                for (String dependencyName : task.dependsOn()) {
                    TaskNode source = nodes.get(dependencyName);
                    if (source == null) {
                        throw new IllegalArgumentException(
                                "Task '" + task.name() + "' depends on '" + dependencyName +
                                        "' which does not exist in workflow '" + spec.name() + "'");
                    }

                    try {
                        tasks.addEdge(source, target);
                    } catch (IllegalArgumentException e) {
                        // JGraphT rejects edges that would close a cycle
                        throw new CyclicDependencyException(
                                "Adding dependency '" + dependencyName + "' -> '" + task.name() +
                                        "' would create a cycle in workflow '" + spec.name() + "'", e);
                    }

                    if (!source.groupName().equals(group.name())) {
                        addGroupEdge(groups, source.groupName(), group.name(), spec.name());
                    }
                }
            }
        }

        WorkflowDag dag = new WorkflowDag(tasks, groups, nodes);
        log.debug("DAG built for workflow {}: {}", spec.name(), dag);
        return dag;
    }

    private void addGroupEdge(
            DirectedAcyclicGraph<String, DefaultEdge> groups,
            String upstream,
            String downstream,
            String workflowName
    ) {
        try {
            groups.addEdge(upstream, downstream);
        } catch (IllegalArgumentException e) {
            throw new CyclicDependencyException(
                    "Groups '" + upstream + "' and '" + downstream +
                            "' depend on each other in workflow '" + workflowName + "'", e);
        }
    }
}
