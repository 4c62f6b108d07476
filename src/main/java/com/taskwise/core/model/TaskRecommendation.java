package com.taskwise.core.model;

import java.util.List;

/**
 * A task worth adding to the project.
 *
 * @param task               the synthesized definition
 * @param reasoning          why it is recommended
 * @param priority           1-10, higher is more important
 * @param estimatedEffort    {@code low}, {@code medium} or {@code high}
 * @param dependenciesNeeded full names that must exist before this task can be added
 */
public record TaskRecommendation(
    TaskDefinition task,
    String reasoning,
    int priority,
    String estimatedEffort,
    List<String> dependenciesNeeded
) {
    public TaskRecommendation {
        if (priority < 1 || priority > 10) {
            throw new IllegalArgumentException("priority must be between 1 and 10: " + priority);
        }
        dependenciesNeeded = dependenciesNeeded == null ? List.of() : List.copyOf(dependenciesNeeded);
    }
}
