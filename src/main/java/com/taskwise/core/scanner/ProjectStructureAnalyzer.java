package com.taskwise.core.scanner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskwise.core.model.ProjectStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link ProjectStructure} snapshot from marker files and conventional
 * directory names in a project root.
 * <p>
 * Only presence checks and manifest dependency names are inspected; source files
 * are never read.
 */
@Service
public class ProjectStructureAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ProjectStructureAnalyzer.class);

    private static final List<String> SOURCE_DIRS = List.of("src", "lib", "app");
    private static final List<String> TEST_DIRS = List.of("tests", "test", "__tests__", "spec");
    private static final List<String> DOC_DIRS = List.of("docs", "doc", "documentation");
    private static final List<String> CI_MARKERS = List.of(".github/workflows", ".gitlab-ci.yml", "Jenkinsfile", ".circleci");
    private static final List<String> DB_MARKERS = List.of("migrations", "schema.sql", "models", "alembic", "prisma");
    private static final List<String> ARTIFACT_DIRS = List.of("dist", "build", "target", "out");

    /** npm dependency name → framework label, in reporting order. */
    private static final List<Map.Entry<String, String>> NODE_FRAMEWORKS = List.of(
            Map.entry("react", "react"),
            Map.entry("vue", "vue"),
            Map.entry("next", "nextjs"),
            Map.entry("svelte", "svelte"),
            Map.entry("@angular/core", "angular"),
            Map.entry("express", "express"),
            Map.entry("@nestjs/core", "nestjs"),
            Map.entry("jest", "jest"),
            Map.entry("vitest", "vitest"),
            Map.entry("prisma", "prisma")
    );

    private static final List<String> PYTHON_FRAMEWORKS = List.of("fastapi", "django", "flask", "pytest");

    private static final List<String> RUST_FRAMEWORKS = List.of("actix-web", "axum", "tokio", "rocket");

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Analyzes the given project root.
     *
     * @param root an existing project directory
     * @return the detected structure
     */
    public ProjectStructure analyze(Path root) {
        var packageManagers = new LinkedHashSet<String>();
        var languages = new LinkedHashSet<String>();
        var frameworks = new LinkedHashSet<String>();

        // Detect package managers and languages from manifest files
        if (exists(root, "package.json")) {
            packageManagers.add("npm");
            languages.add("javascript");
            frameworks.addAll(nodeFrameworks(root.resolve("package.json")));
        }
        if (exists(root, "tsconfig.json")) {
            languages.add("typescript");
        }
        if (exists(root, "Cargo.toml")) {
            packageManagers.add("cargo");
            languages.add("rust");
            frameworks.addAll(textFrameworks(root.resolve("Cargo.toml"), RUST_FRAMEWORKS));
        }
        if (exists(root, "pyproject.toml") || exists(root, "setup.py") || exists(root, "requirements.txt")) {
            packageManagers.add("pip");
            languages.add("python");
            frameworks.addAll(textFrameworks(root.resolve("pyproject.toml"), PYTHON_FRAMEWORKS));
            frameworks.addAll(textFrameworks(root.resolve("requirements.txt"), PYTHON_FRAMEWORKS));
        }
        if (exists(root, "go.mod")) {
            packageManagers.add("go");
            languages.add("go");
        }
        if (exists(root, "pom.xml")) {
            packageManagers.add("maven");
            languages.add("java");
        }
        if (exists(root, "build.gradle") || exists(root, "build.gradle.kts")) {
            packageManagers.add("gradle");
            languages.add("java");
        }

        var sourceDirs = present(root, SOURCE_DIRS);
        var artifacts = present(root, ARTIFACT_DIRS);

        var structure = new ProjectStructure(
                root,
                packageManagers,
                languages,
                frameworks,
                !present(root, TEST_DIRS).isEmpty(),
                !present(root, DOC_DIRS).isEmpty(),
                !present(root, CI_MARKERS).isEmpty(),
                !present(root, DB_MARKERS).isEmpty(),
                artifacts,
                sourceDirs
        );
        log.debug("Analyzed {}: managers={}, languages={}, frameworks={}",
                root, packageManagers, languages, frameworks);
        return structure;
    }

    private boolean exists(Path root, String relative) {
        return Files.exists(root.resolve(relative));
    }

    private List<String> present(Path root, List<String> candidates) {
        var found = new ArrayList<String>();
        for (String candidate : candidates) {
            if (exists(root, candidate)) {
                found.add(candidate);
            }
        }
        return found;
    }

    private Set<String> nodeFrameworks(Path packageJson) {
        var found = new LinkedHashSet<String>();
        try {
            JsonNode root = objectMapper.readTree(packageJson.toFile());
            if (root == null) {
                return found;
            }
            for (String section : List.of("dependencies", "devDependencies")) {
                JsonNode deps = root.path(section);
                for (var framework : NODE_FRAMEWORKS) {
                    if (deps.has(framework.getKey())) {
                        found.add(framework.getValue());
                    }
                }
            }
        } catch (IOException e) {
            log.debug("Could not read {}: {}", packageJson, e.getMessage());
        }
        return found;
    }

    private Set<String> textFrameworks(Path manifest, List<String> candidates) {
        var found = new LinkedHashSet<String>();
        if (!Files.isRegularFile(manifest)) {
            return found;
        }
        try {
            String content = Files.readString(manifest).toLowerCase(Locale.ROOT);
            for (String candidate : candidates) {
                if (content.contains(candidate)) {
                    found.add(candidate);
                }
            }
        } catch (IOException e) {
            log.debug("Could not read {}: {}", manifest, e.getMessage());
        }
        return found;
    }
}
