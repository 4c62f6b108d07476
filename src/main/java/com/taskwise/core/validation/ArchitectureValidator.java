package com.taskwise.core.validation;

import com.taskwise.core.graph.DanglingReference;
import com.taskwise.core.graph.TaskGraph;
import com.taskwise.core.model.GeneratedDescriptions;
import com.taskwise.core.model.TaskDefinition;
import com.taskwise.core.model.TaskDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Runs a fixed battery of checks over a project's task graph.
 * <p>
 * The validator is pure: it never touches the filesystem, and the same graph always
 * yields the same issues and suggestions in the same order.
 */
@Service
public class ArchitectureValidator {

    private static final Logger log = LoggerFactory.getLogger(ArchitectureValidator.class);

    private static final Pattern VALID_NAME = Pattern.compile("[a-z0-9_-]+(:[a-z0-9_-]+)*");

    /** Leaf names people run directly, so having no edges is expected. */
    private static final Set<String> ENTRY_POINTS = Set.of(
            "default", "dev", "build", "test", "lint", "ci", "setup", "install",
            "clean", "deploy", "docs", "serve", "start", "watch", "format", "release", "all");

    private static final int DEEP_CHAIN = 5;

    private static final Comparator<ValidationIssue> ISSUE_ORDER = Comparator
            .comparing(ValidationIssue::severity)
            .thenComparing(ValidationIssue::category)
            .thenComparing(ValidationIssue::task)
            .thenComparing(ValidationIssue::message);

    public ValidationReport validate(TaskGraph graph) {
        List<TaskDefinition> tasks = graph.tasks();
        var issues = new ArrayList<ValidationIssue>();

        List<List<String>> hardCycles = graph.hardCycles();
        for (var cycle : hardCycles) {
            issues.add(new ValidationIssue(IssueCategory.CIRCULAR_DEPENDENCY, Severity.ERROR, cycle.get(0),
                    "Circular dependency: " + String.join(" -> ", cycle) + " -> " + cycle.get(0)));
        }

        for (DanglingReference ref : graph.danglingReferences()) {
            issues.add(new ValidationIssue(IssueCategory.DANGLING_DEPENDENCY, Severity.ERROR, ref.task(),
                    "Task '" + ref.task() + "' references missing task '" + ref.missing() + "' in "
                            + listName(ref)));
        }

        for (var cycle : graph.waitForCycles()) {
            issues.add(new ValidationIssue(IssueCategory.WAIT_FOR_CYCLE, Severity.WARNING, cycle.get(0),
                    "wait_for tasks wait on each other: " + String.join(", ", cycle)
                            + "; legal, but the ordering hint is meaningless"));
        }

        int orphans = 0;
        for (var task : tasks) {
            String name = task.fullName();

            String prefix = task.declaredPrefix();
            if (TaskDomain.fromValue(prefix).isEmpty()) {
                issues.add(new ValidationIssue(IssueCategory.DOMAIN_PREFIX, Severity.WARNING, name,
                        "Prefix '" + prefix + "' is not a recognized domain (" + String.join(", ", TaskDomain.allValues()) + ")"));
            }

            if (!VALID_NAME.matcher(name).matches()) {
                issues.add(new ValidationIssue(IssueCategory.NAMING, Severity.ERROR, name,
                        "Name contains disallowed characters; use lowercase letters, digits, '-', '_' and ':' separators"));
            }

            if (GeneratedDescriptions.isMissing(task.description())) {
                issues.add(new ValidationIssue(IssueCategory.MISSING_DESCRIPTION, Severity.WARNING, name,
                        "Task has no description"));
            }

            if (graph.isIsolated(name) && !isEntryPoint(task)) {
                orphans++;
                issues.add(new ValidationIssue(IssueCategory.ORPHAN_TASK, Severity.INFO, name,
                        "Task has no dependencies and nothing depends on it"));
            }
        }

        issues.sort(ISSUE_ORDER);

        var domains = new TreeSet<String>();
        tasks.forEach(t -> domains.add(t.domain().value()));

        var report = new ValidationReport(
                tasks.size(),
                graph.edgeCount(),
                List.copyOf(domains),
                issues,
                suggestions(graph, tasks, domains, hardCycles.isEmpty(), orphans)
        );
        log.debug("Validated {} tasks: {} errors, {} warnings", tasks.size(),
                report.count(Severity.ERROR), report.count(Severity.WARNING));
        return report;
    }

    private boolean isEntryPoint(TaskDefinition task) {
        String leaf = task.leafName();
        return ENTRY_POINTS.contains(leaf)
                || leaf.equals(task.declaredPrefix())
                || task.alias() != null;
    }

    private List<String> suggestions(TaskGraph graph, List<TaskDefinition> tasks, Set<String> domains,
                                     boolean acyclic, int orphans) {
        var suggestions = new ArrayList<String>();
        if (tasks.isEmpty()) {
            suggestions.add("No tasks declared; start with build, test and lint tasks");
            return suggestions;
        }
        if (!acyclic) {
            suggestions.add("Break circular dependencies, often by extracting the shared step into its own task");
        }
        if (!graph.danglingReferences().isEmpty()) {
            suggestions.add("Declare the missing tasks or remove the references to them");
        }
        if (tasks.stream().noneMatch(t -> !t.sources().isEmpty() || !t.outputs().isEmpty())) {
            suggestions.add("Add sources/outputs to build tasks so unchanged inputs can be skipped");
        }
        if (!domains.contains(TaskDomain.TEST.value())) {
            suggestions.add("Add test tasks (test domain)");
        }
        if (!domains.contains(TaskDomain.LINT.value())) {
            suggestions.add("Add lint tasks (lint domain) for code quality checks");
        }
        if (orphans > 0) {
            suggestions.add("Wire the " + orphans + " orphan task(s) into a pipeline or remove them");
        }
        if (acyclic && maxDepth(graph) > DEEP_CHAIN) {
            suggestions.add("Dependency chains deeper than " + DEEP_CHAIN + " steps slow every run; keep them shallow");
        }
        long undescribed = tasks.stream().filter(t -> GeneratedDescriptions.isMissing(t.description())).count();
        if (undescribed > 0) {
            suggestions.add("Describe the " + undescribed + " task(s) without a description");
        }
        return suggestions;
    }

    private int maxDepth(TaskGraph graph) {
        var all = new LinkedHashSet<String>();
        graph.tasks().forEach(t -> all.add(t.fullName()));
        var depth = new HashMap<String, Integer>();
        int max = 0;
        for (String name : graph.topologicalOrder(all)) {
            int level = 0;
            for (String dependency : graph.hardDependencies(name)) {
                level = Math.max(level, depth.getOrDefault(dependency, 0) + 1);
            }
            depth.put(name, level);
            max = Math.max(max, level);
        }
        return max;
    }

    private static String listName(DanglingReference ref) {
        return switch (ref.kind()) {
            case HARD -> "depends";
            case POST -> "depends_post";
            case WAIT -> "wait_for";
        };
    }
}
