package com.chainwright.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Chainwright-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setStage(String runId, String stage) {
        MDC.put("runId", runId);
        MDC.put("stage", stage);
    }

    public static void setAgent(String runId, String stage, String agentKind, String instanceId) {
        MDC.put("runId", runId);
        MDC.put("stage", stage);
        MDC.put("agentKind", agentKind);
        MDC.put("instanceId", instanceId);
    }

    public static void setWave(String runId, String wavePhase) {
        MDC.put("runId", runId);
        MDC.put("wavePhase", wavePhase);
    }

    public static void clearWave() {
        MDC.remove("wavePhase");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("stage");
        MDC.remove("agentKind");
        MDC.remove("instanceId");
        MDC.remove("wavePhase");
    }
}
