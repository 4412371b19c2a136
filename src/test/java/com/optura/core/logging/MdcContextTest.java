package com.optura.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setTask sets both project and task keys")
    void setTask() {
        MdcContext.setTask(7L, 42L);

        assertEquals("7", MDC.get("projectId"));
        assertEquals("42", MDC.get("taskId"));
    }

    @Test
    @DisplayName("clear removes only Optura keys")
    void clearKeepsOtherKeys() {
        MDC.put("requestId", "abc");
        MdcContext.setProject(7L);
        MdcContext.setAction("approve");

        MdcContext.clear();

        assertNull(MDC.get("projectId"));
        assertNull(MDC.get("action"));
        assertEquals("abc", MDC.get("requestId"));
    }
}
