package com.jay.valuation.model.methods;

import com.jay.valuation.model.ProjectedCashFlow;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.util.List;

@Getter
@SuperBuilder
public class DcfMethodResult extends MethodResult {
    private final int projectionYears;
    private final double discountRate;          // WACC, %
    private final double terminalGrowthRate;    // %
    private final List<ProjectedCashFlow> projectedCashFlows;
    private final double terminalValue;
    private final double presentValueOfTerminal;
    private final double presentValueOfCashFlows;
    private final double enterpriseValue;
    // Net debt is not subtracted, equity value equals enterprise value.
    private final double equityValue;
}
