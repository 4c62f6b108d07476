package com.taskwise.core.error;

/**
 * Tag carried by every structured failure the engine reports.
 */
public enum ErrorKind {
    PATH_NOT_FOUND,
    ACCESS_DENIED,
    MALFORMED_TASK,
    TASK_NOT_FOUND,
    CYCLE_DETECTED,
    DANGLING_DEPENDENCY,
    NAME_COLLISION,
    INVALID_COMPLEXITY,
    INVALID_DOMAIN,
    /** The project could not be read or written. */
    IO_ERROR,
    /** Unexpected fault inside an analysis operation. */
    INTERNAL_ERROR
}
