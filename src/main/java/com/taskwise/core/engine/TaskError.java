package com.taskwise.core.engine;

import com.taskwise.core.error.ErrorKind;
import com.taskwise.core.error.TaskGraphException;

import java.util.List;

/**
 * Structured failure returned by {@link TaskArchitectureService}.
 *
 * @param kind    what went wrong
 * @param message human-readable detail
 * @param tasks   implicated task names, possibly empty
 */
public record TaskError(ErrorKind kind, String message, List<String> tasks) {

    public TaskError {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static TaskError from(TaskGraphException e) {
        return new TaskError(e.getKind(), e.getMessage(), e.getTasks());
    }

    public static TaskError of(ErrorKind kind, String message) {
        return new TaskError(kind, message, List.of());
    }
}
