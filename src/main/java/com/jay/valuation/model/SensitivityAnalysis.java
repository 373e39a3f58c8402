package com.jay.valuation.model;

import com.jay.valuation.model.enums.ScenarioSource;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SensitivityAnalysis {
    List<SensitivityVariable> variables;
    List<ValuationScenario> scenarios;
    ScenarioSource scenarioSource;

    public static SensitivityAnalysis empty() {
        return SensitivityAnalysis.builder()
            .variables(List.of())
            .scenarios(List.of())
            .build();
    }
}
