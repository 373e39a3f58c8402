package com.jay.valuation.layer4_risk;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.FinancialInputs;
import com.jay.valuation.model.ValuationRiskFactor;
import com.jay.valuation.model.enums.RiskCategory;
import com.jay.valuation.model.enums.RiskImpact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 4 — Risk Factor Identifier.
 * Flags qualitative risks from fixed thresholds on the normalised inputs.
 * Rules are evaluated in a fixed order, so the same inputs always give the same list.
 * An empty list means nothing tripped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskFactorIdentifier {

    private final ValuationConfig config;

    public List<ValuationRiskFactor> identify(FinancialInputs inputs) {
        ValuationConfig.Risk risk = config.risk();
        List<ValuationRiskFactor> factors = new ArrayList<>();

        // ── Financial: thin EBITDA margin ─────────────────────────────────────
        if (inputs.getEbitdaMargin() < risk.getLowEbitdaMarginPct()) {
            factors.add(ValuationRiskFactor.builder()
                .category(RiskCategory.FINANCIAL)
                .factor("Low Profitability")
                .impact(RiskImpact.HIGH)
                .description("Low EBITDA margin indicates potential profitability challenges")
                .mitigation("Focus on cost optimization and pricing strategy")
                .discountAdjustment(risk.getLowProfitabilityDiscountPct())
                .build());
        }

        // ── Market: slow growth ───────────────────────────────────────────────
        if (inputs.getRevenueGrowthRate() < risk.getSlowGrowthPct()) {
            factors.add(ValuationRiskFactor.builder()
                .category(RiskCategory.MARKET)
                .factor("Slow Growth")
                .impact(RiskImpact.MEDIUM)
                .description("Below-average growth rate may indicate market maturity or competitive pressure")
                .mitigation("Explore new markets or product innovations")
                .build());
        }

        // ── Operational: small team ───────────────────────────────────────────
        Integer employees = inputs.getEmployeeCount();
        if (employees != null && employees < risk.getSmallTeamEmployees()) {
            factors.add(ValuationRiskFactor.builder()
                .category(RiskCategory.OPERATIONAL)
                .factor("Key Person Risk")
                .impact(RiskImpact.MEDIUM)
                .description("Small team size may create dependency on key individuals")
                .mitigation("Develop succession planning and knowledge transfer processes")
                .build());
        }

        log.debug("Risk factors identified: {}", factors.size());
        return List.copyOf(factors);
    }
}
