package com.enterprise.taskrouting.logging;

import org.slf4j.MDC;

/**
 * Utility for managing task routing MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TASK_ID = "taskId";
    public static final String SOURCE = "source";
    public static final String WINDOW = "window";

    private MdcContext() {}

    public static void setTask(String taskId, String source) {
        MDC.put(TASK_ID, taskId);
        MDC.put(SOURCE, source);
    }

    public static void setReport(String window) {
        MDC.put(WINDOW, window);
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(SOURCE);
        MDC.remove(WINDOW);
    }
}
