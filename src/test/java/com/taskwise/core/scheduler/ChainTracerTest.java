package com.taskwise.core.scheduler;

import com.taskwise.core.error.ErrorKind;
import com.taskwise.core.error.TaskGraphException;
import com.taskwise.core.graph.DependencyGraphBuilder;
import com.taskwise.core.graph.TaskGraph;
import com.taskwise.core.model.TaskDefinition;
import com.taskwise.core.model.TaskDomain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChainTracerTest {

    private final ChainTracer tracer = new ChainTracer();
    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();

    private static TaskDefinition task(String fullName, String... depends) {
        String prefix = fullName.substring(0, fullName.indexOf(':'));
        return TaskDefinition.builder(fullName, TaskDomain.fromValue(prefix).orElse(TaskDomain.BUILD))
                .run("make " + fullName.replace(':', '-'))
                .depends(List.of(depends))
                .build();
    }

    private TaskGraph graph(TaskDefinition... tasks) {
        return builder.build(List.of(tasks));
    }

    // ── Ordering ─────────────────────────────────────────────────────

    @Test
    @DisplayName("diamond yields three layers with the two branches in parallel")
    void diamond() {
        var graph = graph(
                task("setup:install"),
                task("build:api", "setup:install"),
                task("build:web", "setup:install"),
                task("test:all", "build:api", "build:web"));

        var trace = tracer.trace(graph, "test:all");

        assertEquals(List.of("setup:install", "build:api", "build:web"), trace.ancestors());
        assertEquals(List.of("setup:install", "build:api", "build:web", "test:all"), trace.executionOrder());
        assertEquals(List.of(
                List.of("setup:install"),
                List.of("build:api", "build:web"),
                List.of("test:all")), trace.layers());
        assertTrue(trace.descendants().isEmpty());
        assertEquals(4, trace.totalSteps());
        assertEquals(trace.executionOrder(), List.copyOf(trace.details().keySet()));
    }

    @Test
    @DisplayName("ties are broken by declaration order, not by name")
    void declarationOrderTieBreak() {
        var graph = graph(
                task("build:zeta"),
                task("build:alpha"),
                task("ci:all", "build:alpha", "build:zeta"));

        var trace = tracer.trace(graph, "ci:all");

        assertEquals(List.of("build:zeta", "build:alpha", "ci:all"), trace.executionOrder());
        assertEquals(List.of("build:zeta", "build:alpha"), trace.layers().get(0));
    }

    @Test
    @DisplayName("descendants and soft relations are reported for the root")
    void descendantsAndSoftRelations() {
        var graph = builder.build(List.of(
                task("build:app"),
                task("test:unit", "build:app"),
                task("deploy:prod", "test:unit"),
                TaskDefinition.builder("docs:publish", TaskDomain.DOCS).run("mkdocs gh-deploy").build(),
                TaskDefinition.builder("lint:check", TaskDomain.LINT).run("eslint .").build(),
                TaskDefinition.builder("build:bundle", TaskDomain.BUILD).run("vite build")
                        .depends(List.of("build:app"))
                        .dependsPost(List.of("docs:publish"))
                        .waitFor(List.of("lint:check"))
                        .build()));

        var fromApp = tracer.trace(graph, "build:app");
        assertEquals(List.of("test:unit", "deploy:prod", "build:bundle"), fromApp.descendants());
        assertEquals(List.of(List.of("build:app")), fromApp.layers());

        var fromBundle = tracer.trace(graph, "build:bundle");
        assertEquals(List.of("docs:publish"), fromBundle.postTasks());
        assertEquals(List.of("lint:check"), fromBundle.waitForTasks());
        // soft relations never enter the execution order
        assertEquals(List.of("build:app", "build:bundle"), fromBundle.executionOrder());
    }

    @Test
    @DisplayName("every task's hard dependencies lie in strictly earlier layers")
    void layerProperty() {
        var random = new Random(42);
        var tasks = new ArrayList<TaskDefinition>();
        for (int i = 0; i < 40; i++) {
            var deps = new ArrayList<String>();
            for (int j = 0; j < i; j++) {
                if (random.nextInt(6) == 0) {
                    deps.add("build:t" + j);
                }
            }
            tasks.add(task("build:t" + i, deps.toArray(String[]::new)));
        }
        tasks.add(task("ci:root", tasks.stream().map(TaskDefinition::fullName).toArray(String[]::new)));
        var graph = builder.build(tasks);

        var trace = tracer.trace(graph, "ci:root");

        var layerOf = new HashMap<String, Integer>();
        for (int i = 0; i < trace.layers().size(); i++) {
            for (String name : trace.layers().get(i)) {
                layerOf.put(name, i);
            }
        }
        assertEquals(41, layerOf.size());
        for (String name : trace.executionOrder()) {
            for (String dependency : graph.hardDependencies(name)) {
                assertTrue(layerOf.get(dependency) < layerOf.get(name),
                        dependency + " must be placed before " + name);
            }
        }
    }

    // ── Failures ─────────────────────────────────────────────────────

    @ParameterizedTest
    @ValueSource(strings = {"build:a", "build:b", "build:c"})
    @DisplayName("tracing any member of A->B->C->A fails naming all three")
    void cycleDetected(String root) {
        var graph = graph(
                task("build:a", "build:c"),
                task("build:b", "build:a"),
                task("build:c", "build:b"));

        var ex = assertThrows(TaskGraphException.class, () -> tracer.trace(graph, root));
        assertEquals(ErrorKind.CYCLE_DETECTED, ex.getKind());
        assertEquals(Set.of("build:a", "build:b", "build:c"), Set.copyOf(ex.getTasks()));
    }

    @Test
    @DisplayName("unknown root fails with TASK_NOT_FOUND")
    void taskNotFound() {
        var graph = graph(task("build:app"));

        var ex = assertThrows(TaskGraphException.class, () -> tracer.trace(graph, "build:nope"));
        assertEquals(ErrorKind.TASK_NOT_FOUND, ex.getKind());
        assertEquals(List.of("build:nope"), ex.getTasks());
    }

    @Test
    @DisplayName("a cycle elsewhere in the project does not block unrelated traces")
    void unrelatedCycle() {
        var graph = graph(
                task("build:a", "build:b"),
                task("build:b", "build:a"),
                task("test:unit"));

        assertEquals(List.of("test:unit"), tracer.trace(graph, "test:unit").executionOrder());
    }
}
