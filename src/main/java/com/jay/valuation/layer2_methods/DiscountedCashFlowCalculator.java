package com.jay.valuation.layer2_methods;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.exception.MethodUnavailableException;
import com.jay.valuation.model.FinancialInputs;
import com.jay.valuation.model.ProjectedCashFlow;
import com.jay.valuation.model.ValueRange;
import com.jay.valuation.model.enums.IndustryType;
import com.jay.valuation.model.enums.ValuationMethod;
import com.jay.valuation.model.methods.DcfMethodResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 2 — Discounted Cash Flow.
 *
 * Projection, per year y = 1..N:
 *   growth_y  = baseGrowth × decay^(y-1)
 *   revenue_y = revenue_(y-1) × (1 + growth_y)
 *   EBITDA_y  = revenue_y × EBITDA margin
 *   FCF_y     = EBITDA_y − tax − capex − 5% × (revenue_y − base revenue)
 * Discounted at WACC = risk-free + beta × market risk premium.
 * Terminal value uses the perpetuity-growth formula on FCF_N with
 * terminal growth = min(cap, factor × baseGrowth).
 *
 * Equity value is taken equal to enterprise value (net debt is not subtracted).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiscountedCashFlowCalculator implements MethodCalculator {

    private final ValuationConfig config;

    @Override
    public ValuationMethod method() {
        return ValuationMethod.DISCOUNTED_CASH_FLOW;
    }

    /** WACC in percent for the given industry. */
    public double wacc(IndustryType industry) {
        ValuationConfig.Dcf cfg = config.dcf();
        return cfg.getRiskFreeRatePct() + cfg.betaFor(industry) * cfg.getMarketRiskPremiumPct();
    }

    public double terminalGrowthRate(double baseGrowthRate) {
        ValuationConfig.Dcf cfg = config.dcf();
        return Math.min(cfg.getTerminalGrowthCapPct(), baseGrowthRate * cfg.getTerminalGrowthFactor());
    }

    @Override
    public DcfMethodResult calculate(FinancialInputs inputs) throws MethodUnavailableException {
        ValuationConfig.Dcf cfg = config.dcf();
        int years = cfg.getProjectionYears();
        double discountRate = wacc(inputs.getIndustryType());
        double terminalGrowth = terminalGrowthRate(inputs.getRevenueGrowthRate());

        if (years < 1) {
            throw new MethodUnavailableException(method(), "projection horizon must be at least one year");
        }
        if (discountRate <= terminalGrowth) {
            throw new MethodUnavailableException(method(), String.format(
                "WACC %.2f%% does not exceed terminal growth %.2f%%", discountRate, terminalGrowth));
        }

        // ── Projection ─────────────────────────────────────────────────────────
        List<ProjectedCashFlow> projected = new ArrayList<>(years);
        double baseRevenue = inputs.getRevenue();
        double revenue = baseRevenue;
        for (int year = 1; year <= years; year++) {
            double growth = inputs.getRevenueGrowthRate() * Math.pow(cfg.getGrowthDecay(), year - 1);
            revenue *= 1 + growth / 100;
            double ebitda = revenue * inputs.getEbitdaMargin() / 100;
            double taxes = ebitda * cfg.getTaxRatePct() / 100;
            double capex = revenue * cfg.getCapexPctOfRevenue() / 100;
            double workingCapitalChange = (revenue - baseRevenue) * cfg.getWorkingCapitalPctOfGrowth() / 100;
            double fcf = ebitda - taxes - capex - workingCapitalChange;
            double presentValue = fcf / Math.pow(1 + discountRate / 100, year);
            projected.add(new ProjectedCashFlow(year, revenue, ebitda, taxes, capex,
                workingCapitalChange, fcf, presentValue));
        }

        // ── Terminal value ─────────────────────────────────────────────────────
        double finalFcf = projected.get(years - 1).freeCashFlow();
        double terminalValue = finalFcf * (1 + terminalGrowth / 100) / ((discountRate - terminalGrowth) / 100);
        double pvTerminal = terminalValue / Math.pow(1 + discountRate / 100, years);

        double pvCashFlows = projected.stream().mapToDouble(ProjectedCashFlow::presentValue).sum();
        double enterpriseValue = pvCashFlows + pvTerminal;
        double equityValue = enterpriseValue;

        if (equityValue <= 0) {
            throw new MethodUnavailableException(method(), String.format(
                "projected cash flows give a non-positive equity value (%.0f)", equityValue));
        }

        log.debug("DCF: WACC={}% g∞={}% EV={}", discountRate, terminalGrowth, enterpriseValue);

        return DcfMethodResult.builder()
            .method(method())
            .projectionYears(years)
            .discountRate(discountRate)
            .terminalGrowthRate(terminalGrowth)
            .projectedCashFlows(List.copyOf(projected))
            .terminalValue(terminalValue)
            .presentValueOfTerminal(pvTerminal)
            .presentValueOfCashFlows(pvCashFlows)
            .enterpriseValue(enterpriseValue)
            .equityValue(equityValue)
            .valuationRange(ValueRange.around(equityValue, cfg.getRangeLowFactor(), cfg.getRangeHighFactor()))
            .confidence(cfg.getConfidence())
            .weight(cfg.getWeight())
            .build();
    }
}
