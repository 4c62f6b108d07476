package com.taskwise.core.redundancy;

import com.taskwise.core.graph.TaskGraph;

import java.util.List;

/**
 * A single, inspectable rule for spotting tasks that could be removed.
 * Implementations: IsolatedTaskPolicy, DuplicateCommandPolicy, SupersededTaskPolicy.
 * <p>
 * Policies only report. They cannot see scripts outside the project that may still
 * invoke a task, so every candidate is a suggestion.
 */
public interface PruningPolicy {

    /** Short identifier shown next to each candidate. */
    String name();

    /**
     * @return candidates in declaration order; empty when nothing matches
     */
    List<PruningCandidate> evaluate(TaskGraph graph);
}
