package com.a2dd.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing converter-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSource(String sourceFile) {
        MDC.put("sourceFile", sourceFile);
    }

    public static void setTask(String taskName) {
        MDC.put("task", taskName);
    }

    public static void clearTask() {
        MDC.remove("task");
    }

    public static void clear() {
        MDC.remove("sourceFile");
        MDC.remove("task");
    }
}
