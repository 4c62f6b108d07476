package com.taskwise.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Tasks extracted from a project, in declaration order (inline entries first,
 * then file tasks in path order), plus notes for every skipped entry.
 */
public record ExtractionResult(List<TaskDefinition> tasks, List<ExtractionNote> notes) {

    public ExtractionResult {
        tasks = List.copyOf(tasks);
        notes = List.copyOf(notes);
    }

    /**
     * Finds a task by full name, falling back to a unique match on the bare name
     * (so {@code dev} finds {@code dev:dev} or {@code build:dev} when unambiguous).
     */
    public Optional<TaskDefinition> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (var task : tasks) {
            if (task.fullName().equals(name)) {
                return Optional.of(task);
            }
        }
        var byName = tasks.stream()
                .filter(t -> t.name().equals(name) || t.leafName().equals(name))
                .toList();
        return byName.size() == 1 ? Optional.of(byName.get(0)) : Optional.empty();
    }

    public List<String> fullNames() {
        return tasks.stream().map(TaskDefinition::fullName).toList();
    }
}
