package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Game difficulty. Drives doom budgets, enemy pools, boss eligibility and spawn pacing.
 */
public enum Difficulty {
    @JsonProperty("Normal") NORMAL("Normal"),
    @JsonProperty("Hard") HARD("Hard"),
    @JsonProperty("Nightmare") NIGHTMARE("Nightmare");

    private final String label;

    Difficulty(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a difficulty from its display label or constant name, ignoring case.
     *
     * @throws IllegalArgumentException if the label matches no difficulty
     */
    public static Difficulty fromLabel(String label) {
        if (label != null) {
            for (Difficulty d : values()) {
                if (d.label.equalsIgnoreCase(label.trim()) || d.name().equalsIgnoreCase(label.trim())) {
                    return d;
                }
            }
        }
        throw new IllegalArgumentException("Unknown difficulty: " + label);
    }
}
