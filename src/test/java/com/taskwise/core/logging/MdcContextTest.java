package com.taskwise.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setOperation puts operation and projectPath in MDC")
    void setOperation() {
        MdcContext.setOperation("validateArchitecture", "/work/app");
        assertEquals("validateArchitecture", MDC.get("operation"));
        assertEquals("/work/app", MDC.get("projectPath"));
    }

    @Test
    @DisplayName("setTask puts taskName in MDC")
    void setTask() {
        MdcContext.setTask("build:app");
        assertEquals("build:app", MDC.get("taskName"));
    }

    @Test
    @DisplayName("clear removes all taskwise MDC keys")
    void clear() {
        MdcContext.setOperation("removeTask", "/work/app");
        MdcContext.setTask("build:app");
        MdcContext.clear();
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("projectPath"));
        assertNull(MDC.get("taskName"));
    }
}
