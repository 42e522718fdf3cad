package com.seqflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Seqflow-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String TASK_ID = "taskId";
    public static final String TASK_TYPE = "taskType";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setTask(String runId, String taskName, String taskType) {
        MDC.put(RUN_ID, runId);
        MDC.put(TASK_ID, taskName);
        MDC.put(TASK_TYPE, taskType);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(TASK_ID);
        MDC.remove(TASK_TYPE);
    }
}
