package com.jay.valuation.model;

/**
 * Distribution of a multiple sample. sampleSize == 0 is the explicit "no data" state,
 * in which every statistic is reported as 0.
 */
public record MultipleStatistics(
    int sampleSize,
    double min,
    double q1,
    double median,
    double q3,
    double max,
    double mean,
    double standardDeviation
) {

    public static MultipleStatistics empty() {
        return new MultipleStatistics(0, 0, 0, 0, 0, 0, 0, 0);
    }

    public boolean hasData() {
        return sampleSize > 0;
    }
}
