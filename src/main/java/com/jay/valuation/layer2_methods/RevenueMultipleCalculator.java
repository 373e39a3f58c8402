package com.jay.valuation.layer2_methods;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.exception.MethodUnavailableException;
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
 * Layer 2 — Revenue Multiple.
 * Industry revenue-multiple band, shifted by additive size / growth / margin
 * adjustments, applied to annual revenue.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RevenueMultipleCalculator implements MethodCalculator {

    private final ValuationConfig config;

    @Override
    public ValuationMethod method() {
        return ValuationMethod.REVENUE_MULTIPLE;
    }

    @Override
    public MultipleMethodResult calculate(FinancialInputs inputs) throws MethodUnavailableException {
        ValuationConfig.RevenueMultiple cfg = config.revenueMultiple();
        ValueRange industryMultiples = cfg.multiplesFor(inputs.getIndustryType());

        List<ValuationAdjustment> adjustments = new ArrayList<>();

        // ── Size ───────────────────────────────────────────────────────────────
        if (inputs.getRevenue() < cfg.getSmallCompanyRevenue()) {
            adjustments.add(new ValuationAdjustment(AdjustmentType.SIZE,
                "Small company size discount", cfg.getSizeDiscountPct(),
                "Smaller companies typically trade at a discount to larger peers"));
        }

        // ── Growth ─────────────────────────────────────────────────────────────
        if (inputs.getRevenueGrowthRate() > cfg.getHighGrowthPct()) {
            adjustments.add(new ValuationAdjustment(AdjustmentType.GROWTH_PREMIUM,
                "High growth premium", cfg.getGrowthPremiumPct(),
                "High growth rate justifies premium valuation"));
        } else if (inputs.getRevenueGrowthRate() < cfg.getLowGrowthPct()) {
            adjustments.add(new ValuationAdjustment(AdjustmentType.GROWTH_PREMIUM,
                "Low growth discount", cfg.getGrowthDiscountPct(),
                "Below average growth rate"));
        }

        // ── Gross margin ───────────────────────────────────────────────────────
        if (inputs.getGrossMargin() > cfg.getHighGrossMarginPct()) {
            adjustments.add(new ValuationAdjustment(AdjustmentType.TECHNOLOGY_PREMIUM,
                "High margin premium", cfg.getMarginPremiumPct(),
                "Strong margin profile indicates scalable business model"));
        }

        double multiplier = MethodCalculator.adjustmentMultiplier(adjustments);
        if (multiplier <= 0) {
            throw new MethodUnavailableException(method(),
                String.format("adjustments total %.0f%% leave no positive multiple", (multiplier - 1) * 100));
        }
        ValueRange adjustedMultiples = industryMultiples.scale(multiplier);
        ValueRange valuationRange = adjustedMultiples.scale(inputs.getRevenue());

        log.debug("Revenue multiple: band {} x {} → median {}", industryMultiples, multiplier,
            valuationRange.median());

        return MultipleMethodResult.builder()
            .method(method())
            .industryMultiples(industryMultiples)
            .adjustments(List.copyOf(adjustments))
            .adjustedMultiples(adjustedMultiples)
            .valuationRange(valuationRange)
            .confidence(cfg.getConfidence())
            .weight(cfg.weightFor(inputs.getIndustryType()))
            .build();
    }
}
