package org.neuralchilli.flotilla.core;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.flotilla.domain.TaskNode;
import org.neuralchilli.flotilla.domain.TaskStatus;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Validated dependency structure of one workflow: a task-level DAG plus the group-level
 * DAG derived from cross-group task dependencies.
 * Immutable once built; cached per workflow to avoid rebuilding on every event.
 */
public final class WorkflowDag {

    private final DirectedAcyclicGraph<TaskNode, DefaultEdge> tasks;
    private final DirectedAcyclicGraph<String, DefaultEdge> groups;
    private final Map<String, TaskNode> nodes;

    WorkflowDag(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> tasks,
            DirectedAcyclicGraph<String, DefaultEdge> groups,
            Map<String, TaskNode> nodes
    ) {
        this.tasks = Objects.requireNonNull(tasks);
        this.groups = Objects.requireNonNull(groups);
        this.nodes = Map.copyOf(nodes);
    }

    /**
     * Groups whose tasks are depended on by tasks of {@code group}.
     */
    public Set<String> upstreamGroups(String group) {
        return groups.incomingEdgesOf(group).stream()
                .map(groups::getEdgeSource)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<String> downstreamGroups(String group) {
        return groups.outgoingEdgesOf(group).stream()
                .map(groups::getEdgeTarget)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Every group reachable from {@code group}, in topological order.
     */
    public List<String> transitiveDownstreamGroups(String group) {
        Set<String> descendants = groups.getDescendants(group);
        return topologicalGroups().stream()
                .filter(descendants::contains)
                .collect(Collectors.toList());
    }

    public Set<String> upstreamTasks(String task) {
        TaskNode node = node(task);
        return tasks.incomingEdgesOf(node).stream()
                .map(tasks::getEdgeSource)
                .map(TaskNode::taskName)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Upstream tasks that belong to the same group. These hold a task back
     * inside a placed gang instead of creating a group dependency.
     */
    public Set<String> intraGroupUpstream(String task) {
        TaskNode node = node(task);
        return tasks.incomingEdgesOf(node).stream()
                .map(tasks::getEdgeSource)
                .filter(upstream -> upstream.groupName().equals(node.groupName()))
                .map(TaskNode::taskName)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<String> downstreamTasks(String task) {
        TaskNode node = node(task);
        return tasks.outgoingEdgesOf(node).stream()
                .map(tasks::getEdgeTarget)
                .map(TaskNode::taskName)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * A group is ready when every upstream group has COMPLETED.
     */
    public boolean isGroupReady(String group, Function<String, TaskStatus> groupStatus) {
        for (String upstream : upstreamGroups(group)) {
            if (groupStatus.apply(upstream) != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    public List<String> topologicalGroups() {
        List<String> order = new ArrayList<>();
        TopologicalOrderIterator<String, DefaultEdge> iterator = new TopologicalOrderIterator<>(groups);
        while (iterator.hasNext()) {
            order.add(iterator.next());
        }
        return order;
    }

    public Set<String> rootGroups() {
        return groups.vertexSet().stream()
                .filter(group -> groups.incomingEdgesOf(group).isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public String groupOf(String task) {
        return node(task).groupName();
    }

    public int groupCount() {
        return groups.vertexSet().size();
    }

    public int taskCount() {
        return tasks.vertexSet().size();
    }

    private TaskNode node(String task) {
        TaskNode node = nodes.get(task);
        if (node == null) {
            throw new IllegalArgumentException("Unknown task: " + task);
        }
        return node;
    }

    @Override
    public String toString() {
        return "WorkflowDag[groups=" + groups.vertexSet().size() +
                ", tasks=" + tasks.vertexSet().size() +
                ", edges=" + tasks.edgeSet().size() + "]";
    }
}
