package com.optura.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Optura-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProject(long projectId) {
        MDC.put("projectId", String.valueOf(projectId));
    }

    public static void setTask(long projectId, long taskId) {
        MDC.put("projectId", String.valueOf(projectId));
        MDC.put("taskId", String.valueOf(taskId));
    }

    public static void setAction(String action) {
        MDC.put("action", action);
    }

    public static void clear() {
        MDC.remove("projectId");
        MDC.remove("taskId");
        MDC.remove("action");
    }
}
