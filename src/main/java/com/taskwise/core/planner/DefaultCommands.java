package com.taskwise.core.planner;

import com.taskwise.core.model.TaskDomain;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Conventional commands, sources and outputs per package manager and domain, used
 * when a new task is described in prose rather than as a command.
 */
public final class DefaultCommands {

    /** Package managers in the order their commands are preferred. */
    private static final List<String> PREFERENCE = List.of("npm", "cargo", "pip", "go", "maven", "gradle");

    private static final Map<String, Map<String, String>> COMMANDS = Map.of(
            "npm", Map.of(
                    "install", "npm install",
                    "build", "npm run build",
                    "test", "npm test",
                    "lint", "npm run lint",
                    "format", "npx prettier --write .",
                    "dev", "npm run dev",
                    "docs", "npm run docs",
                    "clean", "rm -rf dist build node_modules/.cache"),
            "cargo", Map.of(
                    "install", "cargo fetch",
                    "build", "cargo build --release",
                    "test", "cargo test",
                    "lint", "cargo clippy -- -D warnings",
                    "format", "cargo fmt",
                    "dev", "cargo run",
                    "docs", "cargo doc --no-deps",
                    "clean", "cargo clean"),
            "pip", Map.of(
                    "install", "pip install -r requirements.txt",
                    "build", "python -m build",
                    "test", "pytest",
                    "lint", "ruff check .",
                    "format", "ruff format .",
                    "docs", "mkdocs build",
                    "clean", "rm -rf dist build .pytest_cache"),
            "go", Map.of(
                    "install", "go mod download",
                    "build", "go build ./...",
                    "test", "go test ./...",
                    "lint", "go vet ./...",
                    "format", "gofmt -w .",
                    "dev", "go run .",
                    "docs", "go doc ./...",
                    "clean", "go clean"),
            "maven", Map.of(
                    "install", "mvn -B dependency:resolve",
                    "build", "mvn -B package -DskipTests",
                    "test", "mvn -B test",
                    "lint", "mvn -B verify -DskipTests",
                    "docs", "mvn -B javadoc:javadoc",
                    "clean", "mvn -B clean"),
            "gradle", Map.of(
                    "install", "./gradlew dependencies",
                    "build", "./gradlew build -x test",
                    "test", "./gradlew test",
                    "lint", "./gradlew check -x test",
                    "docs", "./gradlew javadoc",
                    "clean", "./gradlew clean")
    );

    private static final Map<TaskDomain, String> ACTION_BY_DOMAIN = Map.of(
            TaskDomain.SETUP, "install",
            TaskDomain.BUILD, "build",
            TaskDomain.TEST, "test",
            TaskDomain.LINT, "lint",
            TaskDomain.DEV, "dev",
            TaskDomain.DOCS, "docs",
            TaskDomain.CLEAN, "clean");

    private static final Map<TaskDomain, List<String>> SOURCES = Map.of(
            TaskDomain.BUILD, List.of("src/**/*", "package.json", "tsconfig.json"),
            TaskDomain.TEST, List.of("src/**/*", "test/**/*", "tests/**/*"),
            TaskDomain.LINT, List.of("src/**/*", "test/**/*"),
            TaskDomain.DEPLOY, List.of("dist/**/*", "build/**/*"));

    private static final Map<TaskDomain, List<String>> OUTPUTS = Map.of(
            TaskDomain.BUILD, List.of("dist/**/*", "build/**/*"),
            TaskDomain.TEST, List.of("coverage/**/*", "test-results/**/*"),
            TaskDomain.LINT, List.of("lint-results.json"),
            TaskDomain.DEPLOY, List.of("deployment-info.json"));

    private DefaultCommands() {} // utility class

    /**
     * The conventional command for an action ({@code install}, {@code build},
     * {@code test}, {@code lint}, {@code format}, {@code dev}, {@code docs},
     * {@code clean}) under the first detected package manager that has one.
     */
    public static Optional<String> forAction(String action, Set<String> packageManagers) {
        for (String pm : PREFERENCE) {
            if (!packageManagers.contains(pm)) continue;
            String command = COMMANDS.get(pm).get(action);
            if (command != null) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }

    public static Optional<String> forDomain(TaskDomain domain, Set<String> packageManagers) {
        String action = ACTION_BY_DOMAIN.get(domain);
        return action == null ? Optional.empty() : forAction(action, packageManagers);
    }

    public static List<String> sources(TaskDomain domain) {
        return SOURCES.getOrDefault(domain, List.of());
    }

    public static List<String> outputs(TaskDomain domain) {
        return OUTPUTS.getOrDefault(domain, List.of());
    }
}
