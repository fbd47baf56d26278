package com.scatterbrain.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Scatterbrain-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPlan(long planId) {
        MDC.put("planId", String.valueOf(planId));
    }

    public static void setTask(long planId, String taskPath) {
        MDC.put("planId", String.valueOf(planId));
        MDC.put("taskPath", taskPath);
    }

    public static void clear() {
        MDC.remove("planId");
        MDC.remove("taskPath");
    }
}
