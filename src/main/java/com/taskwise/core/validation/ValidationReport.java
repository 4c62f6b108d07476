package com.taskwise.core.validation;

import java.util.List;

/**
 * Result of validating a project's task architecture.
 */
public record ValidationReport(
    int totalTasks,
    int totalDependencies,
    List<String> domainsUsed,
    List<ValidationIssue> issues,
    List<String> suggestions
) {
    public ValidationReport {
        domainsUsed = List.copyOf(domainsUsed);
        issues = List.copyOf(issues);
        suggestions = List.copyOf(suggestions);
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(i -> i.severity() == Severity.ERROR);
    }

    public long count(Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).count();
    }
}
