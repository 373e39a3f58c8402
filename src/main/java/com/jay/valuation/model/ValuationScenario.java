package com.jay.valuation.model;

import com.jay.valuation.model.enums.ScenarioType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Probability is informational; scenario probabilities need not sum to 1. */
public record ValuationScenario(
    ScenarioType scenario,
    Map<String, Double> assumptions,
    double valuation,
    double probability
) {
    public ValuationScenario {
        assumptions = Collections.unmodifiableMap(new LinkedHashMap<>(assumptions));
    }
}
