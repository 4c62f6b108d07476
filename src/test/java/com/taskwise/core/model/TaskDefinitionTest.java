package com.taskwise.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskDefinitionTest {

    @Test
    @DisplayName("bare names are prefixed with the domain")
    void fullName() {
        var task = TaskDefinition.builder("unit", TaskDomain.TEST).run("pytest").build();
        assertEquals("test:unit", task.fullName());
        assertEquals("unit", task.leafName());
        assertEquals("test", task.declaredPrefix());
    }

    @Test
    @DisplayName("colon names are used as-is")
    void prefixedName() {
        var task = TaskDefinition.builder("docs:site:build", TaskDomain.DOCS).run("mkdocs build").build();
        assertEquals("docs:site:build", task.fullName());
        assertEquals("build", task.leafName());
        assertEquals("docs", task.declaredPrefix());
    }

    @Test
    @DisplayName("file tasks are never simple")
    void fileTaskNeverSimple() {
        var task = TaskDefinition.builder("build:x", TaskDomain.BUILD)
                .run("make")
                .complexity(TaskComplexity.SIMPLE)
                .filePath(Path.of(".mise/tasks/build/x"))
                .build();
        assertEquals(TaskComplexity.MODERATE, task.complexity());
        assertEquals("file", task.storage().kind());
    }

    @Test
    @DisplayName("effective command joins run entries")
    void effectiveCommand() {
        var task = TaskDefinition.builder("build:x", TaskDomain.BUILD).run(List.of("npm ci", "npm run build ")).build();
        assertEquals("npm ci\nnpm run build", task.effectiveCommand());
        assertEquals(new TaskStorage.Inline(List.of("npm ci", "npm run build ")), task.storage());
    }

    @Test
    @DisplayName("domains and complexities parse case-insensitively")
    void enumParsing() {
        assertEquals(TaskDomain.DB, TaskDomain.fromValue("DB").orElseThrow());
        assertTrue(TaskDomain.fromValue("frontend").isEmpty());
        assertEquals(TaskComplexity.COMPLEX, TaskComplexity.fromValue(" Complex ").orElseThrow());
        assertEquals(10, TaskDomain.allValues().size());
    }

    @Test
    @DisplayName("generated summaries are recognized as missing descriptions")
    void generatedDescriptions() {
        assertEquals("Runs: make", GeneratedDescriptions.forCommands(List.of("make")));
        assertEquals("Runs 2 commands starting with: npm ci", GeneratedDescriptions.forCommands(List.of("npm ci", "npm test")));
        assertTrue(GeneratedDescriptions.isMissing(GeneratedDescriptions.forScript("build/x.sh")));
        assertTrue(GeneratedDescriptions.isMissing(""));
        assertFalse(GeneratedDescriptions.isMissing("Build the app"));
    }

    @Test
    @DisplayName("env keeps declaration order")
    void envOrder() {
        var env = new LinkedHashMap<String, String>();
        env.put("ZETA", "1");
        env.put("ALPHA", "2");
        env.put("MIDDLE", "3");

        var task = TaskDefinition.builder("dev:serve", TaskDomain.DEV).run("vite").env(env).build();
        assertEquals(List.of("ZETA", "ALPHA", "MIDDLE"), List.copyOf(task.env().keySet()));
    }
}
