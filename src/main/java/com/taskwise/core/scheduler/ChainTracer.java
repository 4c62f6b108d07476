package com.taskwise.core.scheduler;

import com.taskwise.core.error.TaskGraphException;
import com.taskwise.core.graph.TaskGraph;
import com.taskwise.core.model.ChainTrace;
import com.taskwise.core.model.TaskDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Computes the execution order and parallel layers for a task.
 * <p>
 * Layer {@code i} holds every not-yet-placed task whose hard dependencies all sit in
 * layers {@code 0..i-1}. Within a layer, and in the overall order, ties are broken
 * by declaration order rather than by name so output is stable across runs.
 */
@Service
public class ChainTracer {

    private static final Logger log = LoggerFactory.getLogger(ChainTracer.class);

    /**
     * Traces the given task.
     *
     * @param graph    graph of the project's tasks
     * @param fullName full name of the root task
     * @return the trace
     * @throws TaskGraphException {@code TASK_NOT_FOUND} if the root is unknown,
     *                            {@code CYCLE_DETECTED} if its dependency chain has no valid order
     */
    public ChainTrace trace(TaskGraph graph, String fullName) {
        if (!graph.contains(fullName)) {
            throw TaskGraphException.taskNotFound(fullName);
        }

        List<String> ancestors = graph.ancestors(fullName);
        var chain = new LinkedHashSet<>(ancestors);
        chain.add(fullName);

        List<String> order = graph.topologicalOrder(chain);
        List<List<String>> layers = layers(graph, order);

        var details = new LinkedHashMap<String, TaskDefinition>();
        for (String name : order) {
            graph.task(name).ifPresent(task -> details.put(name, task));
        }

        log.debug("Traced {}: {} steps in {} layers", fullName, order.size(), layers.size());
        return new ChainTrace(
                fullName,
                ancestors,
                graph.descendants(fullName),
                order,
                layers,
                graph.postTasks(fullName),
                graph.waitForTasks(fullName),
                details
        );
    }

    /**
     * Partitions a topologically ordered chain into parallel layers. A task's layer is
     * one past the deepest layer among its hard dependencies, which is exactly the
     * earliest layer whose predecessors cover all of them.
     */
    List<List<String>> layers(TaskGraph graph, List<String> order) {
        var depth = new HashMap<String, Integer>();
        var layers = new ArrayList<List<String>>();
        for (String name : order) {
            int level = 0;
            for (String dependency : graph.hardDependencies(name)) {
                Integer dependencyLevel = depth.get(dependency);
                if (dependencyLevel != null) {
                    level = Math.max(level, dependencyLevel + 1);
                }
            }
            depth.put(name, level);
            if (level == layers.size()) {
                layers.add(new ArrayList<>());
            }
            layers.get(level).add(name);
        }
        return layers.stream().map(List::copyOf).toList();
    }
}
