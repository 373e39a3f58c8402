package com.jay.valuation.model.methods;

import com.jay.valuation.model.MultipleStatistics;
import com.jay.valuation.model.ValuationAdjustment;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * Shared payload of the market-based methods: sample statistics, the premium or
 * discount applied to the median multiples, and the two point valuations.
 */
@Getter
@SuperBuilder
public abstract class MarketMethodResult extends MethodResult {
    private final MultipleStatistics revenueMultiples;
    private final MultipleStatistics ebitdaMultiples;
    private final List<ValuationAdjustment> adjustments;
    private final double revenueValuation;
    private final double ebitdaValuation;
}
