package com.taskwise.core.redundancy;

/**
 * A task flagged by a {@link PruningPolicy}.
 *
 * @param task   full name of the flagged task
 * @param policy name of the policy that flagged it
 * @param reason human-readable explanation
 */
public record PruningCandidate(String task, String policy, String reason) {}
