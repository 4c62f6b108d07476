package com.taskwise.core.engine;

import java.util.NoSuchElementException;

/**
 * Either a value or a {@link TaskError}, never both.
 */
public record OperationResult<T>(T value, TaskError error) {

    public OperationResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of value and error must be set");
        }
    }

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(value, null);
    }

    public static <T> OperationResult<T> failure(TaskError error) {
        return new OperationResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** The value, or {@link NoSuchElementException} carrying the error message. */
    public T orElseThrow() {
        if (error != null) {
            throw new NoSuchElementException(error.kind() + ": " + error.message());
        }
        return value;
    }
}
