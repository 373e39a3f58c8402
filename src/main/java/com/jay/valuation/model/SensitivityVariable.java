package com.jay.valuation.model;

/**
 * One input varied across a band, with the documented percentage impact on valuation
 * at each end of the band.
 */
public record SensitivityVariable(String variable, double baseCase, Bounds range, Impact impact) {

    public record Bounds(double low, double high) {}

    public record Impact(double lowCase, double highCase) {}
}
