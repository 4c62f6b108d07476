package com.taskwise.core.validation;

public enum IssueCategory {
    CIRCULAR_DEPENDENCY,
    DANGLING_DEPENDENCY,
    DOMAIN_PREFIX,
    ORPHAN_TASK,
    NAMING,
    MISSING_DESCRIPTION,
    WAIT_FOR_CYCLE
}
