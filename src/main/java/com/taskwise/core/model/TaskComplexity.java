package com.taskwise.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Complexity level of a task; decides whether it lives inline in the
 * document or in its own script file.
 */
public enum TaskComplexity {
    /** Single command, inline. */
    SIMPLE,
    /** A handful of commands, still inline. */
    MODERATE,
    /** Script file task. */
    COMPLEX;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TaskComplexity> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.value().equals(normalized))
                .findFirst();
    }

    public static List<String> allValues() {
        return Arrays.stream(values()).map(TaskComplexity::value).toList();
    }
}
