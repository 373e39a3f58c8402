package com.jay.valuation.layer2_methods;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.FinancialInputs;
import com.jay.valuation.model.ValuationAdjustment;
import com.jay.valuation.model.ValueRange;
import com.jay.valuation.model.enums.AdjustmentType;
import com.jay.valuation.model.enums.ValuationMethod;
import com.jay.valuation.model.methods.MultipleMethodResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 2 — EBITDA Multiple.
 * Non-positive EBITDA does not make the method unavailable: the range floors at zero
 * and the method drops to the configured low weight and confidence.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EbitdaMultipleCalculator implements MethodCalculator {

    private final ValuationConfig config;

    @Override
    public ValuationMethod method() {
        return ValuationMethod.EBITDA_MULTIPLE;
    }

    @Override
    public MultipleMethodResult calculate(FinancialInputs inputs) {
        ValuationConfig.EbitdaMultiple cfg = config.ebitdaMultiple();
        ValueRange industryMultiples = cfg.multiplesFor(inputs.getIndustryType());

        List<ValuationAdjustment> adjustments = new ArrayList<>();
        if (inputs.getEbitdaMargin() > cfg.getHighMarginPct()) {
            adjustments.add(new ValuationAdjustment(AdjustmentType.TECHNOLOGY_PREMIUM,
                "High EBITDA margin premium", cfg.getMarginPremiumPct(),
                "Strong operational efficiency"));
        }

        ValueRange adjustedMultiples = industryMultiples.scale(MethodCalculator.adjustmentMultiplier(adjustments));
        ValueRange valuationRange = adjustedMultiples.scale(inputs.getEbitda()).floorAtZero();

        boolean profitable = inputs.getEbitda() > 0;
        List<String> warnings = profitable ? List.of()
            : List.of(String.format("EBITDA %.0f is not positive; EBITDA multiple down-weighted to %.2f",
                inputs.getEbitda(), cfg.getUnprofitableWeight()));

        return MultipleMethodResult.builder()
            .method(method())
            .industryMultiples(industryMultiples)
            .adjustments(List.copyOf(adjustments))
            .adjustedMultiples(adjustedMultiples)
            .valuationRange(valuationRange)
            .confidence(profitable ? cfg.getConfidence() : cfg.getUnprofitableConfidence())
            .weight(profitable ? cfg.getWeight() : cfg.getUnprofitableWeight())
            .warnings(warnings)
            .build();
    }
}
