package com.taskwise.core.validation;

public enum Severity {
    ERROR,
    WARNING,
    INFO
}
