package com.neuroshield.common;

/**
 * Exact integer arithmetic helpers.
 */
public final class IntMath {

    private IntMath() {
    }

    /**
     * floor(sqrt(value)) for any non-negative long. Corrects the double estimate so the result is
     * exact even where Math.sqrt rounds across an integer boundary.
     */
    public static long floorSqrt(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("value must be non-negative: " + value);
        }
        if (value < 2) {
            return value;
        }
        long root = (long) Math.sqrt((double) value);
        while (root > 0 && root > value / root) {
            root--;
        }
        while ((root + 1) <= value / (root + 1)) {
            root++;
        }
        return root;
    }
}
