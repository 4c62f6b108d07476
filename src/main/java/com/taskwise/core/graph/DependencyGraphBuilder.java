package com.taskwise.core.graph;

import com.taskwise.core.model.TaskDefinition;
import org.jgrapht.graph.DirectedPseudograph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a {@link TaskGraph} from extracted tasks.
 * <p>
 * References are resolved by full name first, then by a unique bare-name match
 * ({@code build} resolves to {@code build:build}). Unresolvable references are
 * kept as {@link DanglingReference}s rather than dropped.
 */
@Service
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    public TaskGraph build(List<TaskDefinition> tasks) {
        var graph = new DirectedPseudograph<String, DependencyEdge>(DependencyEdge.class);
        var byFullName = new LinkedHashMap<String, TaskDefinition>();
        var declarationIndex = new HashMap<String, Integer>();
        var byBareName = new HashMap<String, List<String>>();

        for (var task : tasks) {
            String fullName = task.fullName();
            if (byFullName.putIfAbsent(fullName, task) != null) {
                log.warn("Duplicate task {} ignored while building graph", fullName);
                continue;
            }
            declarationIndex.put(fullName, declarationIndex.size());
            graph.addVertex(fullName);
            byBareName.computeIfAbsent(task.name(), k -> new ArrayList<>()).add(fullName);
            if (!task.leafName().equals(task.name())) {
                byBareName.computeIfAbsent(task.leafName(), k -> new ArrayList<>()).add(fullName);
            }
        }

        var dangling = new ArrayList<DanglingReference>();
        for (var task : byFullName.values()) {
            String self = task.fullName();
            for (String dep : task.depends()) {
                resolve(dep, byFullName, byBareName).ifPresentOrElse(
                        target -> graph.addEdge(target, self, new DependencyEdge(target, self, EdgeKind.HARD)),
                        () -> dangling.add(new DanglingReference(self, dep, EdgeKind.HARD)));
            }
            for (String post : task.dependsPost()) {
                resolve(post, byFullName, byBareName).ifPresentOrElse(
                        target -> graph.addEdge(self, target, new DependencyEdge(self, target, EdgeKind.POST)),
                        () -> dangling.add(new DanglingReference(self, post, EdgeKind.POST)));
            }
            for (String wait : task.waitFor()) {
                resolve(wait, byFullName, byBareName).ifPresentOrElse(
                        target -> graph.addEdge(target, self, new DependencyEdge(target, self, EdgeKind.WAIT)),
                        () -> dangling.add(new DanglingReference(self, wait, EdgeKind.WAIT)));
            }
        }

        log.debug("Built task graph: {} tasks, {} edges, {} dangling references",
                byFullName.size(), graph.edgeSet().size(), dangling.size());
        return new TaskGraph(graph, byFullName, declarationIndex, dangling);
    }

    private Optional<String> resolve(String reference, Map<String, TaskDefinition> byFullName,
                                     Map<String, List<String>> byBareName) {
        String name = reference.trim();
        // "build --release" passes arguments; only the task name matters here
        int space = name.indexOf(' ');
        if (space > 0) {
            name = name.substring(0, space);
        }
        if (byFullName.containsKey(name)) {
            return Optional.of(name);
        }
        List<String> candidates = byBareName.getOrDefault(name, List.of());
        return candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
    }
}
