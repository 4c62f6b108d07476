package com.taskwise.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed functional category a task belongs to. The lowercase {@link #value()}
 * is the prefix used in full task names (e.g. {@code build:frontend}).
 */
public enum TaskDomain {
    BUILD,
    TEST,
    LINT,
    DEV,
    DEPLOY,
    DB,
    CI,
    DOCS,
    CLEAN,
    SETUP;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a domain from its textual value, case-insensitively.
     *
     * @return the matching domain, or empty when the value is not recognized
     */
    public static Optional<TaskDomain> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(d -> d.value().equals(normalized))
                .findFirst();
    }

    public static List<String> allValues() {
        return Arrays.stream(values()).map(TaskDomain::value).toList();
    }
}
