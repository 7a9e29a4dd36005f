package com.shadows.core.catalog;

import java.util.Random;

/**
 * Inclusive integer range.
 */
public record AmountRange(int min, int max) {

    public AmountRange {
        if (max < min) {
            throw new IllegalArgumentException("max " + max + " < min " + min);
        }
    }

    public static AmountRange exactly(int value) {
        return new AmountRange(value, value);
    }

    public int roll(Random random) {
        return min + random.nextInt(max - min + 1);
    }
}
