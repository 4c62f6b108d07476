package com.taskwise.core.scanner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ProjectStructureAnalyzer}, each against its own
 * {@code @TempDir} project.
 */
class ProjectStructureAnalyzerTest {

    @TempDir
    Path tempDir;

    ProjectStructureAnalyzer analyzer = new ProjectStructureAnalyzer();

    // ── Empty project ────────────────────────────────────────────────

    @Test
    @DisplayName("empty directory has no managers, languages or markers")
    void emptyDirectory() {
        var structure = analyzer.analyze(tempDir);
        assertTrue(structure.packageManagers().isEmpty());
        assertTrue(structure.languages().isEmpty());
        assertTrue(structure.frameworks().isEmpty());
        assertFalse(structure.hasTests());
        assertFalse(structure.hasDocs());
        assertFalse(structure.hasCi());
        assertFalse(structure.hasDatabase());
        assertEquals(tempDir, structure.rootPath());
    }

    // ── Node detection ───────────────────────────────────────────────

    @Test
    @DisplayName("detects npm, typescript and frameworks from package.json")
    void detectsNodeProject() throws IOException {
        Files.writeString(tempDir.resolve("package.json"), """
                {"dependencies": {"react": "^18.0.0", "express": "4"},
                 "devDependencies": {"jest": "29"}}
                """);
        Files.writeString(tempDir.resolve("tsconfig.json"), "{}");

        var structure = analyzer.analyze(tempDir);
        assertTrue(structure.uses("npm"));
        assertTrue(structure.languages().contains("javascript"));
        assertTrue(structure.languages().contains("typescript"));
        assertTrue(structure.frameworks().containsAll(List.of("react", "express", "jest")));
    }

    @Test
    @DisplayName("unparseable package.json still marks an npm project")
    void brokenPackageJson() throws IOException {
        Files.writeString(tempDir.resolve("package.json"), "{ not json");

        var structure = analyzer.analyze(tempDir);
        assertTrue(structure.uses("npm"));
        assertTrue(structure.frameworks().isEmpty());
    }

    // ── Other ecosystems ─────────────────────────────────────────────

    @Test
    @DisplayName("detects python frameworks from requirements.txt")
    void detectsPythonProject() throws IOException {
        Files.writeString(tempDir.resolve("requirements.txt"), "Django==5.0\npytest\n");

        var structure = analyzer.analyze(tempDir);
        assertTrue(structure.uses("pip"));
        assertTrue(structure.languages().contains("python"));
        assertTrue(structure.frameworks().contains("django"));
        assertTrue(structure.frameworks().contains("pytest"));
    }

    @Test
    @DisplayName("detects cargo, go, maven and gradle manifests")
    void detectsOtherManifests() throws IOException {
        Files.writeString(tempDir.resolve("Cargo.toml"), "[dependencies]\naxum = \"0.7\"\n");
        Files.writeString(tempDir.resolve("go.mod"), "module example.com/x\n");
        Files.writeString(tempDir.resolve("pom.xml"), "<project/>");
        Files.writeString(tempDir.resolve("build.gradle.kts"), "");

        var structure = analyzer.analyze(tempDir);
        assertTrue(structure.packageManagers().containsAll(Set.of("cargo", "go", "maven", "gradle")));
        assertTrue(structure.languages().containsAll(Set.of("rust", "go", "java")));
        assertTrue(structure.frameworks().contains("axum"));
    }

    // ── Conventional directories ─────────────────────────────────────

    @Test
    @DisplayName("detects tests, docs, CI, database and artifact directories")
    void detectsConventionalDirectories() throws IOException {
        Files.createDirectories(tempDir.resolve("src"));
        Files.createDirectories(tempDir.resolve("tests"));
        Files.createDirectories(tempDir.resolve("docs"));
        Files.createDirectories(tempDir.resolve(".github/workflows"));
        Files.createDirectories(tempDir.resolve("migrations"));
        Files.createDirectories(tempDir.resolve("dist"));

        var structure = analyzer.analyze(tempDir);
        assertTrue(structure.hasTests());
        assertTrue(structure.hasDocs());
        assertTrue(structure.hasCi());
        assertTrue(structure.hasDatabase());
        assertEquals(List.of("src"), structure.sourceDirs());
        assertEquals(List.of("dist"), structure.buildArtifacts());
    }

    @Test
    @DisplayName("analysis is deterministic for an unchanged directory")
    void deterministic() throws IOException {
        Files.writeString(tempDir.resolve("package.json"), "{}");
        Files.createDirectories(tempDir.resolve("test"));

        assertEquals(analyzer.analyze(tempDir), analyzer.analyze(tempDir));
    }

    @Test
    @DisplayName("frameworks are reported in a fixed order regardless of manifest order")
    void frameworkOrder() throws IOException {
        Files.writeString(tempDir.resolve("package.json"), """
                {"dependencies": {"vitest": "1", "express": "4", "react": "18"}}
                """);

        var frameworks = List.copyOf(analyzer.analyze(tempDir).frameworks());
        assertEquals(List.of("react", "express", "vitest"), frameworks);
    }
}
