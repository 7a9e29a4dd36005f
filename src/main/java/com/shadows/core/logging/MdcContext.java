package com.shadows.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Shadows-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setScenario(String scenarioId) {
        if (scenarioId != null) {
            MDC.put("scenarioId", scenarioId);
        }
    }

    public static void setAttempt(int attempt) {
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void setRound(String scenarioId, int round) {
        setScenario(scenarioId);
        MDC.put("round", String.valueOf(round));
    }

    public static void clear() {
        MDC.remove("scenarioId");
        MDC.remove("attempt");
        MDC.remove("round");
    }
}
