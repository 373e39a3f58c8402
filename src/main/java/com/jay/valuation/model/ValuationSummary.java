package com.jay.valuation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jay.valuation.model.enums.DataQuality;
import lombok.Builder;
import lombok.Value;

/**
 * Blend of all successful methods.
 * valuationRange.low/high are the min/max over method ranges (a union), while
 * valuationRange.median is the weighted point value. The two are not a
 * consistent probabilistic range.
 */
@Value
@Builder
public class ValuationSummary {
    double weightedValuation;
    ValueRange valuationRange;
    ImpliedMultiples impliedMultiples;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    PerShareMetrics perShareMetrics;
    double overallConfidence;
    int methodCount;
    DataQuality dataQuality;

    public static ValuationSummary empty(int methodCount) {
        return ValuationSummary.builder()
            .weightedValuation(0)
            .valuationRange(ValueRange.ZERO)
            .impliedMultiples(ImpliedMultiples.NONE)
            .overallConfidence(0)
            .methodCount(methodCount)
            .dataQuality(DataQuality.LOW)
            .build();
    }
}
