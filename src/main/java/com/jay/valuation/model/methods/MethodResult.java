package com.jay.valuation.model.methods;

import com.jay.valuation.model.ValueRange;
import com.jay.valuation.model.enums.ValuationMethod;
import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * Common shape of one methodology's output.
 * confidence is on a 1-10 scale; weight is this run's blending weight in [0, 1]
 * and is renormalised by the aggregator.
 */
@Getter
@SuperBuilder
public abstract class MethodResult {
    private final ValuationMethod method;
    private final ValueRange valuationRange;
    private final double confidence;
    private final double weight;
    @Builder.Default
    private final List<String> warnings = List.of();
}
