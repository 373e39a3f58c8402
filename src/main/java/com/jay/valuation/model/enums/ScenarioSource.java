package com.jay.valuation.model.enums;

/**
 * Where scenario valuations come from.
 * REVENUE_MULTIPLE reads the revenue-multiple method's low/median/high directly;
 * WEIGHTED_AGGREGATE re-runs every selected method under perturbed inputs.
 */
public enum ScenarioSource {
    REVENUE_MULTIPLE,
    WEIGHTED_AGGREGATE
}
