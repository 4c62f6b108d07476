package com.taskwise.core.validation;

/**
 * A single finding of the architecture validator.
 *
 * @param category what kind of problem
 * @param severity how serious it is
 * @param task     full name of the offending task (first member for cycles)
 * @param message  human-readable explanation
 */
public record ValidationIssue(IssueCategory category, Severity severity, String task, String message) {}
