package com.jay.valuation.model;

/**
 * A low / median / high triple. Used both for multiple bands and for valuation ranges.
 */
public record ValueRange(double low, double median, double high) {

    public static final ValueRange ZERO = new ValueRange(0, 0, 0);

    public ValueRange scale(double factor) {
        return new ValueRange(low * factor, median * factor, high * factor);
    }

    /** Brackets a point value, e.g. around(100, 0.8, 1.2) = {80, 100, 120}. */
    public static ValueRange around(double median, double lowFactor, double highFactor) {
        return new ValueRange(median * lowFactor, median, median * highFactor);
    }

    public ValueRange floorAtZero() {
        return new ValueRange(Math.max(0, low), Math.max(0, median), Math.max(0, high));
    }
}
