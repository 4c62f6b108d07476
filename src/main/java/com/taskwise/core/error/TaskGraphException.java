package com.taskwise.core.error;

import java.util.List;

/**
 * Thrown by the engine components for every anticipated failure. The
 * {@link #getTasks()} list names the implicated tasks (cycle members, the
 * missing task, the colliding name).
 */
public class TaskGraphException extends RuntimeException {

    private final ErrorKind kind;
    private final List<String> tasks;

    public TaskGraphException(ErrorKind kind, String message) {
        this(kind, message, List.of());
    }

    public TaskGraphException(ErrorKind kind, String message, List<String> tasks) {
        super(message);
        this.kind = kind;
        this.tasks = List.copyOf(tasks);
    }

    public TaskGraphException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.tasks = List.of();
    }

    public ErrorKind getKind() {
        return kind;
    }

    public List<String> getTasks() {
        return tasks;
    }

    public static TaskGraphException taskNotFound(String name) {
        return new TaskGraphException(ErrorKind.TASK_NOT_FOUND, "Task '" + name + "' not found", List.of(name));
    }

    public static TaskGraphException cycle(List<String> members) {
        return new TaskGraphException(ErrorKind.CYCLE_DETECTED,
                "Circular dependency between " + String.join(", ", members), members);
    }
}
