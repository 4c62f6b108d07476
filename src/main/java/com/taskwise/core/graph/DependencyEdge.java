package com.taskwise.core.graph;

/**
 * Directed edge between two full task names. Edges always point in execution
 * order: the source runs first.
 */
public record DependencyEdge(String source, String target, EdgeKind kind) {

    @Override
    public String toString() {
        return source + " -[" + kind.name().toLowerCase() + "]-> " + target;
    }
}
