package com.taskwise.core.engine;

import com.taskwise.core.redundancy.PruningCandidate;

import java.util.List;

/**
 * @param dryRun             whether anything was actually removed
 * @param candidates         everything the pruning policies flagged
 * @param pruned             full names removed; empty for a dry run
 * @param affectedDependents surviving tasks that still reference a pruned task
 */
public record PruneResult(
    boolean dryRun,
    List<PruningCandidate> candidates,
    List<String> pruned,
    List<String> affectedDependents
) {
    public PruneResult {
        candidates = List.copyOf(candidates);
        pruned = List.copyOf(pruned);
        affectedDependents = List.copyOf(affectedDependents);
    }
}
