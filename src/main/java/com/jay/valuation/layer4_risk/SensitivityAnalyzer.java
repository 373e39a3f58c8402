package com.jay.valuation.layer4_risk;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.FinancialInputs;
import com.jay.valuation.model.SensitivityAnalysis;
import com.jay.valuation.model.SensitivityVariable;
import com.jay.valuation.model.ValuationScenario;
import com.jay.valuation.model.ValuationSummary;
import com.jay.valuation.model.ValueRange;
import com.jay.valuation.model.enums.ScenarioSource;
import com.jay.valuation.model.enums.ScenarioType;
import com.jay.valuation.model.enums.ValuationMethod;
import com.jay.valuation.model.methods.MethodOutcome;
import com.jay.valuation.model.methods.MultipleMethodResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Layer 4 — Sensitivity Analyzer.
 *
 * Variables: revenue growth, EBITDA margin and revenue multiple, each with a band and a
 * fixed percentage impact pair.
 *
 * Scenarios: Optimistic / Base Case / Pessimistic. Where their valuations come from is
 * controlled by {@link ScenarioSource}:
 *   REVENUE_MULTIPLE:   high / median / low of the revenue-multiple method's range.
 *                        Scenario values are therefore NOT derived from the weighted summary.
 *   WEIGHTED_AGGREGATE: inputs are shifted by the scenario assumptions, re-valued through
 *                        every selected method and scaled by the multiple premium/discount.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SensitivityAnalyzer {

    private static final String GROWTH = "Revenue Growth";
    private static final String MARGIN = "EBITDA Margin";
    private static final String PREMIUM = "Multiple Premium";
    private static final String DISCOUNT = "Multiple Discount";

    private final ValuationConfig config;

    /** Re-runs the methods and the aggregator over shifted inputs. */
    @FunctionalInterface
    public interface ScenarioRevaluer {
        ValuationSummary revalue(FinancialInputs inputs);
    }

    public record Result(SensitivityAnalysis analysis, List<String> warnings) {}

    public Result analyze(FinancialInputs inputs, List<MethodOutcome> outcomes,
                          ValuationSummary summary, ScenarioRevaluer revaluer) {
        ValuationConfig.Sensitivity cfg = config.sensitivity();
        List<String> warnings = new ArrayList<>();
        Optional<MultipleMethodResult> revenueMethod = revenueMultipleResult(outcomes);

        ValueRange multipleBand = revenueMethod
            .map(MultipleMethodResult::getAdjustedMultiples)
            .orElseGet(() -> config.revenueMultiple().multiplesFor(inputs.getIndustryType()));

        List<SensitivityVariable> variables = List.of(
            variable("Revenue Growth Rate", inputs.getRevenueGrowthRate(), cfg.getGrowthSwing(),
                cfg.getGrowthImpactLowPct(), cfg.getGrowthImpactHighPct()),
            variable("EBITDA Margin", inputs.getEbitdaMargin(), cfg.getMarginSwing(),
                cfg.getMarginImpactLowPct(), cfg.getMarginImpactHighPct()),
            new SensitivityVariable("Revenue Multiple", multipleBand.median(),
                new SensitivityVariable.Bounds(multipleBand.low(), multipleBand.high()),
                new SensitivityVariable.Impact(cfg.getMultipleImpactLowPct(), cfg.getMultipleImpactHighPct()))
        );

        ValueRange scenarioValues = switch (cfg.getScenarioSource()) {
            case WEIGHTED_AGGREGATE -> revalued(inputs, summary, revaluer, cfg);
            case REVENUE_MULTIPLE -> revenueMethod
                .map(MultipleMethodResult::getValuationRange)
                .orElseGet(() -> {
                    warnings.add("Revenue Multiple unavailable; scenarios use the weighted valuation range");
                    return summary.getValuationRange();
                });
        };

        List<ValuationScenario> scenarios = List.of(
            new ValuationScenario(ScenarioType.OPTIMISTIC,
                assumptions(inputs.getRevenueGrowthRate() + cfg.getGrowthSwing(),
                    inputs.getEbitdaMargin() + cfg.getMarginSwing(), PREMIUM, cfg.getMultipleSwingPct()),
                scenarioValues.high(), cfg.getOptimisticProbability()),
            new ValuationScenario(ScenarioType.BASE_CASE,
                assumptions(inputs.getRevenueGrowthRate(), inputs.getEbitdaMargin(), PREMIUM, 0),
                scenarioValues.median(), cfg.getBaseProbability()),
            new ValuationScenario(ScenarioType.PESSIMISTIC,
                assumptions(inputs.getRevenueGrowthRate() - cfg.getGrowthSwing(),
                    inputs.getEbitdaMargin() - cfg.getMarginSwing(), DISCOUNT, -cfg.getMultipleSwingPct()),
                scenarioValues.low(), cfg.getPessimisticProbability())
        );

        log.debug("Sensitivity scenarios ({}): {} / {} / {}", cfg.getScenarioSource(),
            scenarioValues.high(), scenarioValues.median(), scenarioValues.low());

        SensitivityAnalysis analysis = SensitivityAnalysis.builder()
            .variables(variables)
            .scenarios(scenarios)
            .scenarioSource(cfg.getScenarioSource())
            .build();
        return new Result(analysis, List.copyOf(warnings));
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    private ValueRange revalued(FinancialInputs inputs, ValuationSummary summary,
                                ScenarioRevaluer revaluer, ValuationConfig.Sensitivity cfg) {
        double multipleSwing = cfg.getMultipleSwingPct() / 100;
        ValuationSummary up = revaluer.revalue(shift(inputs, cfg.getGrowthSwing(), cfg.getMarginSwing()));
        ValuationSummary down = revaluer.revalue(shift(inputs, -cfg.getGrowthSwing(), -cfg.getMarginSwing()));
        return new ValueRange(
            down.getWeightedValuation() * (1 - multipleSwing),
            summary.getWeightedValuation(),
            up.getWeightedValuation() * (1 + multipleSwing));
    }

    /** Moves growth and EBITDA margin; EBITDA follows the new margin. */
    static FinancialInputs shift(FinancialInputs inputs, double growthDelta, double marginDelta) {
        double margin = inputs.getEbitdaMargin() + marginDelta;
        return inputs.toBuilder()
            .revenueGrowthRate(inputs.getRevenueGrowthRate() + growthDelta)
            .ebitdaMargin(margin)
            .ebitda(inputs.getRevenue() * margin / 100)
            .build();
    }

    private static SensitivityVariable variable(String name, double base, double swing,
                                                double impactLow, double impactHigh) {
        return new SensitivityVariable(name, base,
            new SensitivityVariable.Bounds(base - swing, base + swing),
            new SensitivityVariable.Impact(impactLow, impactHigh));
    }

    private static Map<String, Double> assumptions(double growth, double margin,
                                                   String multipleKey, double multiple) {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(GROWTH, growth);
        map.put(MARGIN, margin);
        map.put(multipleKey, multiple);
        return map;
    }

    private static Optional<MultipleMethodResult> revenueMultipleResult(List<MethodOutcome> outcomes) {
        return outcomes.stream()
            .filter(o -> o.method() == ValuationMethod.REVENUE_MULTIPLE && o.available())
            .map(MethodOutcome::result)
            .filter(MultipleMethodResult.class::isInstance)
            .map(MultipleMethodResult.class::cast)
            .findFirst();
    }
}
