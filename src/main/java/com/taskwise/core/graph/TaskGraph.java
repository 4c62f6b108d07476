package com.taskwise.core.graph;

import com.taskwise.core.error.TaskGraphException;
import com.taskwise.core.model.TaskDefinition;
import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.KosarajuStrongConnectivityInspector;
import org.jgrapht.graph.AsSubgraph;
import org.jgrapht.graph.MaskSubgraph;
import org.jgrapht.traverse.TopologicalOrderIterator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed dependency graph over full task names, built by {@link DependencyGraphBuilder}.
 * <p>
 * Vertices keep their declaration order, which every query uses for tie-breaking so
 * results are stable across runs. Immutable once built.
 */
public final class TaskGraph {

    private final Graph<String, DependencyEdge> graph;
    private final Graph<String, DependencyEdge> hardView;
    private final Graph<String, DependencyEdge> waitView;
    private final Map<String, TaskDefinition> tasks;
    private final List<DanglingReference> danglingReferences;
    private final Comparator<String> declarationOrder;

    TaskGraph(Graph<String, DependencyEdge> graph,
              Map<String, TaskDefinition> tasks,
              Map<String, Integer> declarationIndex,
              List<DanglingReference> danglingReferences) {
        this.graph = graph;
        this.hardView = new MaskSubgraph<>(graph, v -> false, e -> e.kind() != EdgeKind.HARD);
        this.waitView = new MaskSubgraph<>(graph, v -> false, e -> e.kind() != EdgeKind.WAIT);
        this.tasks = tasks;
        this.danglingReferences = List.copyOf(danglingReferences);
        this.declarationOrder = Comparator.comparingInt(name -> declarationIndex.getOrDefault(name, Integer.MAX_VALUE));
    }

    /** All tasks in declaration order. */
    public List<TaskDefinition> tasks() {
        return List.copyOf(tasks.values());
    }

    public Optional<TaskDefinition> task(String fullName) {
        return Optional.ofNullable(tasks.get(fullName));
    }

    public boolean contains(String fullName) {
        return tasks.containsKey(fullName);
    }

    public int edgeCount() {
        return graph.edgeSet().size();
    }

    public Set<DependencyEdge> edges() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(graph.edgeSet()));
    }

    public List<DanglingReference> danglingReferences() {
        return danglingReferences;
    }

    public Comparator<String> declarationOrder() {
        return declarationOrder;
    }

    /** Direct hard dependencies of a task, in declaration order. */
    public List<String> hardDependencies(String fullName) {
        return sorted(hardView.incomingEdgesOf(fullName).stream().map(DependencyEdge::source).toList());
    }

    /** Tasks that directly declare a hard dependency on the given task. */
    public List<String> hardDependents(String fullName) {
        return sorted(hardView.outgoingEdgesOf(fullName).stream().map(DependencyEdge::target).toList());
    }

    /** Tasks reached through {@code depends_post} of the given task. */
    public List<String> postTasks(String fullName) {
        return sorted(graph.outgoingEdgesOf(fullName).stream()
                .filter(e -> e.kind() == EdgeKind.POST)
                .map(DependencyEdge::target)
                .toList());
    }

    /** Tasks the given task waits for. */
    public List<String> waitForTasks(String fullName) {
        return sorted(waitView.incomingEdgesOf(fullName).stream().map(DependencyEdge::source).toList());
    }

    /**
     * Every task that names the given task in any of its dependency lists
     * ({@code depends}, {@code depends_post} or {@code wait_for}).
     */
    public List<String> referrers(String fullName) {
        var referrers = new LinkedHashSet<String>();
        for (var edge : graph.outgoingEdgesOf(fullName)) {
            if (edge.kind() != EdgeKind.POST) {
                referrers.add(edge.target());
            }
        }
        for (var edge : graph.incomingEdgesOf(fullName)) {
            if (edge.kind() == EdgeKind.POST) {
                referrers.add(edge.source());
            }
        }
        referrers.remove(fullName);
        return sorted(referrers);
    }

    /** Whether the task has no edges of any kind. */
    public boolean isIsolated(String fullName) {
        return graph.degreeOf(fullName) == 0;
    }

    /** Transitive closure of hard dependencies, in declaration order. */
    public List<String> ancestors(String fullName) {
        return closure(fullName, true);
    }

    /** Transitive closure of hard dependents, in declaration order. */
    public List<String> descendants(String fullName) {
        return closure(fullName, false);
    }

    private List<String> closure(String start, boolean upstream) {
        var seen = new LinkedHashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            var next = upstream ? hardView.incomingEdgesOf(current) : hardView.outgoingEdgesOf(current);
            for (var edge : next) {
                String neighbour = upstream ? edge.source() : edge.target();
                if (seen.add(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
        // A task on a cycle reaches itself; callers report it through the cycle check.
        seen.remove(start);
        return sorted(seen);
    }

    /** Groups of tasks that form cycles through hard edges, each in declaration order. */
    public List<List<String>> hardCycles() {
        return cycles(hardView);
    }

    /** Groups of tasks that form cycles through {@code wait_for} edges alone. */
    public List<List<String>> waitForCycles() {
        return cycles(waitView);
    }

    /**
     * Topological order of the given tasks over hard edges, ties broken by
     * declaration order.
     *
     * @throws TaskGraphException ({@code CYCLE_DETECTED}) naming the members of the first cycle found
     */
    public List<String> topologicalOrder(Set<String> subset) {
        var subgraph = new AsSubgraph<>(hardView, subset);
        var cycles = cycles(subgraph);
        if (!cycles.isEmpty()) {
            throw TaskGraphException.cycle(cycles.get(0));
        }
        var order = new ArrayList<String>(subset.size());
        new TopologicalOrderIterator<>(subgraph, declarationOrder).forEachRemaining(order::add);
        return order;
    }

    private List<List<String>> cycles(Graph<String, DependencyEdge> view) {
        var inspector = new KosarajuStrongConnectivityInspector<>(view);
        var cycles = new ArrayList<List<String>>();
        for (Set<String> component : inspector.stronglyConnectedSets()) {
            String first = component.iterator().next();
            if (component.size() > 1 || view.containsEdge(first, first)) {
                cycles.add(sorted(component));
            }
        }
        cycles.sort(Comparator.comparing(c -> c.get(0), declarationOrder));
        return cycles;
    }

    private List<String> sorted(Collection<String> names) {
        return names.stream().distinct().sorted(declarationOrder).toList();
    }
}
