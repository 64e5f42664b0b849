package com.autonomous.treasury.model;

/**
 * ROI bands used to rescale spending ceilings. Lower bounds are inclusive.
 */
public enum PerformanceTier {
    EXCELLENT(2.0, 1.5),
    GOOD(1.5, 1.2),
    NEUTRAL(0.8, 1.0),
    POOR(0.4, 0.8),
    CRITICAL(Double.NEGATIVE_INFINITY, 0.5),
    NO_DATA(Double.NaN, 1.0);

    private final double lowerBound;
    private final double multiplier;

    PerformanceTier(double lowerBound, double multiplier) {
        this.lowerBound = lowerBound;
        this.multiplier = multiplier;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public double multiplier() {
        return multiplier;
    }

    public static PerformanceTier forRoi(double roi) {
        if (Double.isNaN(roi)) return NO_DATA;
        if (roi >= EXCELLENT.lowerBound) return EXCELLENT;
        if (roi >= GOOD.lowerBound) return GOOD;
        if (roi >= NEUTRAL.lowerBound) return NEUTRAL;
        if (roi >= POOR.lowerBound) return POOR;
        return CRITICAL;
    }
}
