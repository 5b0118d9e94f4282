package com.frameception.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing dashboard-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProject(String projectId) {
        if (projectId == null) {
            MDC.remove("projectId");
        } else {
            MDC.put("projectId", projectId);
        }
    }

    public static void setAction(String projectId, String action) {
        setProject(projectId);
        MDC.put("action", action);
    }

    public static void clear() {
        MDC.remove("projectId");
        MDC.remove("action");
    }
}
