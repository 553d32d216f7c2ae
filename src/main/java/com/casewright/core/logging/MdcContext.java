package com.casewright.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Casewright-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId, String taskKind) {
        MDC.put("taskId", taskId);
        MDC.put("taskKind", taskKind);
    }

    public static void setFunctionPoint(String taskId, String taskKind, String functionPointId) {
        setTask(taskId, taskKind);
        MDC.put("functionPointId", functionPointId);
    }

    public static void clearFunctionPoint() {
        MDC.remove("functionPointId");
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("taskKind");
        MDC.remove("functionPointId");
    }
}
