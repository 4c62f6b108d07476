package com.taskwise.core.redundancy;

import com.taskwise.core.graph.TaskGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Runs every registered {@link PruningPolicy} over a graph. Advisory only: nothing
 * here deletes tasks.
 * <p>
 * A task flagged by several policies is reported once, by the first policy in order.
 */
@Service
public class RedundancyDetector {

    private static final Logger log = LoggerFactory.getLogger(RedundancyDetector.class);

    private final List<PruningPolicy> policies;

    public RedundancyDetector(List<PruningPolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    public List<PruningCandidate> findCandidates(TaskGraph graph) {
        var flagged = new LinkedHashSet<String>();
        var candidates = new ArrayList<PruningCandidate>();
        for (PruningPolicy policy : policies) {
            for (PruningCandidate candidate : policy.evaluate(graph)) {
                if (flagged.add(candidate.task())) {
                    candidates.add(candidate);
                }
            }
        }
        candidates.sort((a, b) -> graph.declarationOrder().compare(a.task(), b.task()));
        log.debug("{} pruning candidates from {} policies", candidates.size(), policies.size());
        return candidates;
    }
}
