package com.taskwise.core.graph;

/**
 * Relation carried by a {@link DependencyEdge}.
 */
public enum EdgeKind {
    /** {@code depends}: source must succeed before target runs. */
    HARD,
    /** {@code depends_post}: target runs after source; its failure does not block source. */
    POST,
    /** {@code wait_for}: ordering hint only, never blocks on failure. */
    WAIT
}
