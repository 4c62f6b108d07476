package com.taskwise.core.graph;

/**
 * A dependency declaration that names a task which does not exist.
 *
 * @param task    full name of the declaring task
 * @param missing the name as written
 * @param kind    which list the reference came from
 */
public record DanglingReference(String task, String missing, EdgeKind kind) {}
