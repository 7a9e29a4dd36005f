package com.shadows.core.model;

import java.io.Serializable;

/**
 * Fires once, the first time the doom counter descends to or below {@code threshold}.
 */
public record DoomEvent(
    int threshold,
    DoomEventType type,
    String targetId,
    int amount,
    String message,
    boolean triggered
) implements Serializable {

    public static DoomEvent of(int threshold, DoomEventType type, String targetId, int amount, String message) {
        return new DoomEvent(threshold, type, targetId, amount, message, false);
    }

    public DoomEvent withTriggered() {
        return new DoomEvent(threshold, type, targetId, amount, message, true);
    }

    public DoomEvent withThreshold(int newThreshold) {
        return new DoomEvent(newThreshold, type, targetId, amount, message, triggered);
    }

    /** Player-facing foreshadowing line, e.g. "At doom 7: The dead stir below." */
    public String prophecyLine() {
        return "At doom " + threshold + ": " + message;
    }
}
