package com.taskwise.core.graph;

import com.taskwise.core.model.TaskDefinition;
import com.taskwise.core.model.TaskDomain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphBuilderTest {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();

    private static TaskDefinition.Builder task(String fullName) {
        String prefix = fullName.substring(0, fullName.indexOf(':'));
        return TaskDefinition.builder(fullName, TaskDomain.fromValue(prefix).orElse(TaskDomain.BUILD))
                .run("make " + fullName.replace(':', '-'));
    }

    @Test
    @DisplayName("depends creates hard edges from dependency to dependent")
    void hardEdges() {
        var graph = builder.build(List.of(
                task("build:app").build(),
                task("test:unit").depends(List.of("build:app")).build()));

        assertEquals(1, graph.edgeCount());
        assertTrue(graph.edges().contains(new DependencyEdge("build:app", "test:unit", EdgeKind.HARD)));
        assertEquals(List.of("build:app"), graph.hardDependencies("test:unit"));
        assertEquals(List.of("test:unit"), graph.hardDependents("build:app"));
    }

    @Test
    @DisplayName("bare names resolve when unambiguous and arguments are ignored")
    void bareNameResolution() {
        var graph = builder.build(List.of(
                TaskDefinition.builder("build", TaskDomain.BUILD).run("make").build(),
                task("test:unit").depends(List.of("build --release")).build()));

        assertEquals(List.of("build:build"), graph.hardDependencies("test:unit"));
        assertTrue(graph.danglingReferences().isEmpty());
    }

    @Test
    @DisplayName("ambiguous bare names are dangling")
    void ambiguousBareName() {
        var graph = builder.build(List.of(
                task("build:web").build(),
                task("docs:web").build(),
                task("ci:all").depends(List.of("web")).build()));

        assertEquals(List.of(new DanglingReference("ci:all", "web", EdgeKind.HARD)), graph.danglingReferences());
    }

    @Test
    @DisplayName("missing references of every kind are reported, never dropped")
    void danglingReferences() {
        var graph = builder.build(List.of(
                task("build:app")
                        .depends(List.of("setup:missing"))
                        .dependsPost(List.of("docs:missing"))
                        .waitFor(List.of("lint:missing"))
                        .build()));

        assertEquals(List.of(
                new DanglingReference("build:app", "setup:missing", EdgeKind.HARD),
                new DanglingReference("build:app", "docs:missing", EdgeKind.POST),
                new DanglingReference("build:app", "lint:missing", EdgeKind.WAIT)
        ), graph.danglingReferences());
        assertEquals(0, graph.edgeCount());
    }

    @Test
    @DisplayName("depends_post and wait_for create soft edges")
    void softEdges() {
        var graph = builder.build(List.of(
                task("lint:check").build(),
                task("docs:publish").build(),
                task("build:app").dependsPost(List.of("docs:publish")).waitFor(List.of("lint:check")).build()));

        assertEquals(List.of("docs:publish"), graph.postTasks("build:app"));
        assertEquals(List.of("lint:check"), graph.waitForTasks("build:app"));
        assertTrue(graph.hardDependencies("build:app").isEmpty());
        assertFalse(graph.isIsolated("build:app"));
    }

    @Test
    @DisplayName("referrers cover every dependency list")
    void referrers() {
        var graph = builder.build(List.of(
                task("build:app").build(),
                task("test:unit").depends(List.of("build:app")).build(),
                task("deploy:prod").waitFor(List.of("build:app")).build(),
                task("ci:all").dependsPost(List.of("build:app")).build(),
                task("docs:site").build()));

        assertEquals(List.of("test:unit", "deploy:prod", "ci:all"), graph.referrers("build:app"));
        assertTrue(graph.referrers("docs:site").isEmpty());
    }

    @Test
    @DisplayName("hard cycles and wait_for cycles are found separately")
    void cycles() {
        var graph = builder.build(List.of(
                task("build:a").depends(List.of("build:b")).build(),
                task("build:b").depends(List.of("build:a")).build(),
                task("dev:x").waitFor(List.of("dev:y")).build(),
                task("dev:y").waitFor(List.of("dev:x")).build()));

        assertEquals(List.of(List.of("build:a", "build:b")), graph.hardCycles());
        assertEquals(List.of(List.of("dev:x", "dev:y")), graph.waitForCycles());
    }

    @Test
    @DisplayName("a task depending on itself is a cycle")
    void selfLoop() {
        var graph = builder.build(List.of(task("build:self").depends(List.of("build:self")).build()));

        assertEquals(List.of(List.of("build:self")), graph.hardCycles());
    }

    @Test
    @DisplayName("duplicate full names keep the first declaration")
    void duplicatesIgnored() {
        var graph = builder.build(List.of(
                task("build:app").run("first").build(),
                task("build:app").run("second").build()));

        assertEquals(1, graph.tasks().size());
        assertEquals(List.of("first"), graph.task("build:app").orElseThrow().run());
    }
}
