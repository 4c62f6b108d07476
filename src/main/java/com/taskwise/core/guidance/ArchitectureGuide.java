package com.taskwise.core.guidance;

import com.taskwise.core.config.TaskwiseProperties;
import com.taskwise.core.guidance.ArchitectureRules.ComplexityGuide;
import com.taskwise.core.guidance.ArchitectureRules.DomainGuide;
import com.taskwise.core.model.TaskComplexity;
import com.taskwise.core.model.TaskDomain;
import com.taskwise.core.planner.DefaultCommands;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles {@link ArchitectureRules}: the domain hierarchy with the sources and
 * outputs new tasks receive, complexity levels from the configured thresholds, and
 * general practices. Reads nothing from disk.
 */
@Component
public class ArchitectureGuide {

    private static final List<String> PRINCIPLES = List.of(
            "Tasks are organized by functional domain (build, test, lint, ...)",
            "Names are colon-separated and start with their domain, e.g. test:unit or deploy:staging",
            "Every dependency is declared explicitly in depends, depends_post or wait_for",
            "Sources are tracked so unchanged inputs can be skipped",
            "Outputs are declared for caching and dependency resolution");

    private static final Map<TaskDomain, String> PURPOSES = Map.of(
            TaskDomain.BUILD, "Compilation, bundling, asset processing",
            TaskDomain.TEST, "Unit, integration and end-to-end testing",
            TaskDomain.LINT, "Code quality, formatting, static analysis",
            TaskDomain.DEV, "Development servers, hot reloading",
            TaskDomain.DEPLOY, "Deployment, release, publishing",
            TaskDomain.DB, "Database operations, migrations, seeding",
            TaskDomain.CI, "Aggregate checks run by continuous integration",
            TaskDomain.DOCS, "Documentation generation and serving",
            TaskDomain.CLEAN, "Cleanup and reset operations",
            TaskDomain.SETUP, "Installing tools and dependencies");

    private static final Map<TaskDomain, List<String>> SUB_DOMAINS = Map.of(
            TaskDomain.BUILD, List.of("dev", "prod", "watch"),
            TaskDomain.TEST, List.of("unit", "integration", "e2e", "watch", "coverage"),
            TaskDomain.LINT, List.of("code", "types", "format", "fix"),
            TaskDomain.DEV, List.of("server", "watch"),
            TaskDomain.DEPLOY, List.of("staging", "prod", "preview"),
            TaskDomain.DB, List.of("migrate", "seed", "reset"),
            TaskDomain.CI, List.of("check", "all"),
            TaskDomain.DOCS, List.of("build", "serve"),
            TaskDomain.CLEAN, List.of("cache", "all"),
            TaskDomain.SETUP, List.of("install", "tools"));

    private final TaskwiseProperties properties;

    public ArchitectureGuide(TaskwiseProperties properties) {
        this.properties = properties;
    }

    public ArchitectureRules rules() {
        var domains = new ArrayList<DomainGuide>();
        for (TaskDomain domain : TaskDomain.values()) {
            domains.add(new DomainGuide(domain, PURPOSES.get(domain), SUB_DOMAINS.get(domain),
                    DefaultCommands.sources(domain), DefaultCommands.outputs(domain)));
        }
        return new ArchitectureRules(PRINCIPLES, domains, complexityLevels(),
                dependencyPatterns(), bestPractices(), commonPipelines());
    }

    private List<ComplexityGuide> complexityLevels() {
        int simpleMax = properties.getSimpleMaxCommands();
        int moderateMax = properties.getModerateMaxCommands();
        return List.of(
                new ComplexityGuide(TaskComplexity.SIMPLE, "Single command, no logic",
                        "at most " + simpleMax + ", no longer than " + properties.getLongCommandLength() + " characters",
                        "inline"),
                new ComplexityGuide(TaskComplexity.MODERATE, "A few steps or some conditional logic",
                        (simpleMax + 1) + " to " + moderateMax, "inline"),
                new ComplexityGuide(TaskComplexity.COMPLEX, "Workflows spanning several tools",
                        "more than " + moderateMax, "script file"));
    }

    private static Map<String, String> dependencyPatterns() {
        var patterns = new LinkedHashMap<String, String>();
        patterns.put("sequential", "A -> B -> C, each step depends on the previous one");
        patterns.put("parallel", "A + B -> C, independent tasks feeding one");
        patterns.put("fan-out", "A -> B + C, one task enabling several");
        patterns.put("diamond", "A -> B + C -> D, parallel middle converging at the end");
        return patterns;
    }

    private static Map<String, List<String>> bestPractices() {
        var practices = new LinkedHashMap<String, List<String>>();
        practices.put("naming", List.of(
                "Use hierarchical names with domains (build:dev, test:unit)",
                "Keep names short but descriptive",
                "Use only lowercase letters, digits, '-', '_' and ':'"));
        practices.put("organization", List.of(
                "Group related tasks by domain",
                "Use sub-domains for environment or kind (deploy:staging, test:e2e)",
                "Keep multi-step tasks as scripts under .mise/tasks/"));
        practices.put("dependencies", List.of(
                "Declare dependencies instead of relying on ordering",
                "Avoid circular dependencies",
                "Keep dependency chains shallow"));
        practices.put("performance", List.of(
                "Track sources to avoid needless rebuilds",
                "Declare outputs to enable incremental workflows",
                "Let independent tasks run in parallel"));
        return practices;
    }

    private static Map<String, String> commonPipelines() {
        var pipelines = new LinkedHashMap<String, String>();
        pipelines.put("build", "lint -> test -> build -> deploy");
        pipelines.put("development", "install -> dev (alongside test:watch)");
        pipelines.put("ci", "install -> lint -> test -> build -> deploy");
        pipelines.put("release", "test -> build -> version -> publish");
        return pipelines;
    }
}
