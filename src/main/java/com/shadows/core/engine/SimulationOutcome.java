package com.shadows.core.engine;

public enum SimulationOutcome {
    VICTORY,
    DEFEAT,
    /** Round limit reached with neither victory nor defeat. */
    STALLED
}
