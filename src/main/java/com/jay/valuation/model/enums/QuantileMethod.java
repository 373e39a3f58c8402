package com.jay.valuation.model.enums;

/**
 * Quantile rule used by the multiple statistics.
 */
public enum QuantileMethod {

    /** sorted[floor(n * p)], clamped to the last index. */
    NEAREST_RANK {
        @Override
        public double quantile(double[] sorted, double p) {
            int idx = (int) Math.floor(sorted.length * p);
            return sorted[Math.min(idx, sorted.length - 1)];
        }
    },

    /** Linear interpolation between closest ranks over positions 0..n-1. */
    LINEAR_INTERPOLATION {
        @Override
        public double quantile(double[] sorted, double p) {
            double pos = (sorted.length - 1) * p;
            int lower = (int) Math.floor(pos);
            int upper = (int) Math.ceil(pos);
            double frac = pos - lower;
            return sorted[lower] + (sorted[upper] - sorted[lower]) * frac;
        }
    };

    /** @param sorted non-empty, ascending sample */
    public abstract double quantile(double[] sorted, double p);
}
