package com.shadows.core.validation;

/**
 * Stable identifiers for validation findings. Each code always carries the same severity.
 */
public enum IssueCode {
    NO_VICTORY_CONDITIONS(IssueSeverity.ERROR),
    INVALID_VICTORY_OBJECTIVE_REF(IssueSeverity.ERROR),
    INVALID_REVEAL_REFERENCE(IssueSeverity.ERROR),
    UNREVEALED_REQUIRED_OBJECTIVE(IssueSeverity.ERROR),
    CIRCULAR_REVEAL_CHAIN(IssueSeverity.ERROR),
    DOOM_TOO_LOW(IssueSeverity.ERROR),
    SURVIVAL_DOOM_MISMATCH(IssueSeverity.ERROR),
    MISSING_BOSS_SPAWN(IssueSeverity.ERROR),
    INSUFFICIENT_ENEMY_SPAWNS(IssueSeverity.ERROR),
    PURGE_IMPOSSIBLE(IssueSeverity.ERROR),
    NO_ACHIEVABLE_VICTORY(IssueSeverity.ERROR),
    DOOM_TIGHT(IssueSeverity.WARNING),
    HIGH_ENEMY_PRESSURE(IssueSeverity.WARNING),
    MISSING_TARGET_ID(IssueSeverity.WARNING),
    ESCAPE_PATH_UNCLEAR(IssueSeverity.WARNING),
    COLLECTION_UNLIKELY(IssueSeverity.WARNING),
    HIGH_COLLECTION_TARGET(IssueSeverity.WARNING);

    private final IssueSeverity severity;

    IssueCode(IssueSeverity severity) {
        this.severity = severity;
    }

    public IssueSeverity severity() {
        return severity;
    }
}
