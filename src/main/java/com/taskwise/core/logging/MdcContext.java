package com.taskwise.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Taskwise-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setOperation(String operation, String projectPath) {
        MDC.put("operation", operation);
        MDC.put("projectPath", projectPath);
    }

    public static void setTask(String taskName) {
        MDC.put("taskName", taskName);
    }

    public static void clear() {
        MDC.remove("operation");
        MDC.remove("projectPath");
        MDC.remove("taskName");
    }
}
