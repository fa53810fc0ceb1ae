package com.riskradar.common;

/**
 * Helpers for values constrained to [0,1].
 */
public final class Scores {

    private Scores() {
    }

    /** Clamps to [0,1]; NaN and infinities map to 0. */
    public static double clamp(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static boolean isUnitInterval(double value) {
        return Double.isFinite(value) && value >= 0.0 && value <= 1.0;
    }
}
