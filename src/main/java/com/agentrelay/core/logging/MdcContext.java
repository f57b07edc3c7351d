package com.agentrelay.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing relay-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TASK_ID = "taskId";
    public static final String PROCESS_ID = "processId";
    public static final String ORIGIN = "origin";

    private MdcContext() {}

    public static void setTask(String taskId, String origin) {
        putIfPresent(TASK_ID, taskId);
        putIfPresent(ORIGIN, origin);
    }

    public static void setProcess(String taskId, String processId) {
        putIfPresent(TASK_ID, taskId);
        putIfPresent(PROCESS_ID, processId);
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(PROCESS_ID);
        MDC.remove(ORIGIN);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }
}
