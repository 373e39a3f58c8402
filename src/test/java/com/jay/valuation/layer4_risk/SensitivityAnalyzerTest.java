package com.jay.valuation.layer4_risk;

import com.jay.valuation.ValuationFixtures;
import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.FinancialInputs;
import com.jay.valuation.model.ImpliedMultiples;
import com.jay.valuation.model.SensitivityAnalysis;
import com.jay.valuation.model.SensitivityVariable;
import com.jay.valuation.model.ValuationScenario;
import com.jay.valuation.model.ValuationSummary;
import com.jay.valuation.model.ValueRange;
import com.jay.valuation.model.enums.DataQuality;
import com.jay.valuation.model.enums.ScenarioSource;
import com.jay.valuation.model.enums.ScenarioType;
import com.jay.valuation.model.enums.ValuationMethod;
import com.jay.valuation.model.methods.MethodOutcome;
import com.jay.valuation.model.methods.MultipleMethodResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.assertj.core.api.Assertions.within;

class SensitivityAnalyzerTest {

    private final ValuationConfig config = new ValuationConfig();
    private final SensitivityAnalyzer analyzer = new SensitivityAnalyzer(config);
    private final FinancialInputs inputs = ValuationFixtures.saas().build();

    private final MethodOutcome revenueOutcome = MethodOutcome.success(MultipleMethodResult.builder()
        .method(ValuationMethod.REVENUE_MULTIPLE)
        .industryMultiples(new ValueRange(4, 8, 15))
        .adjustments(List.of())
        .adjustedMultiples(new ValueRange(4.4, 8.8, 16.5))
        .valuationRange(new ValueRange(44_000_000, 88_000_000, 165_000_000))
        .weight(0.3)
        .confidence(7)
        .build());

    private static ValuationSummary summary(double weighted, ValueRange range) {
        return ValuationSummary.builder()
            .weightedValuation(weighted)
            .valuationRange(range)
            .impliedMultiples(ImpliedMultiples.NONE)
            .overallConfidence(7)
            .methodCount(1)
            .dataQuality(DataQuality.HIGH)
            .build();
    }

    private static SensitivityAnalyzer.ScenarioRevaluer unused() {
        return shifted -> fail("revaluation not expected");
    }

    @Test
    void variablesCarryBandsAndImpacts() {
        SensitivityAnalysis analysis = analyzer.analyze(inputs, List.of(revenueOutcome),
            summary(88_000_000, new ValueRange(40_000_000, 88_000_000, 170_000_000)), unused()).analysis();

        assertThat(analysis.getVariables()).extracting(SensitivityVariable::variable)
            .containsExactly("Revenue Growth Rate", "EBITDA Margin", "Revenue Multiple");

        SensitivityVariable growth = analysis.getVariables().get(0);
        assertThat(growth.baseCase()).isEqualTo(25);
        assertThat(growth.range()).isEqualTo(new SensitivityVariable.Bounds(15, 35));
        assertThat(growth.impact()).isEqualTo(new SensitivityVariable.Impact(-15, 20));

        SensitivityVariable margin = analysis.getVariables().get(1);
        assertThat(margin.range()).isEqualTo(new SensitivityVariable.Bounds(15, 25));
        assertThat(margin.impact()).isEqualTo(new SensitivityVariable.Impact(-12, 15));

        SensitivityVariable multiple = analysis.getVariables().get(2);
        assertThat(multiple.baseCase()).isEqualTo(8.8);
        assertThat(multiple.range()).isEqualTo(new SensitivityVariable.Bounds(4.4, 16.5));
        assertThat(multiple.impact()).isEqualTo(new SensitivityVariable.Impact(-25, 30));
    }

    @Test
    void scenariosReadRevenueMultipleRangeByDefault() {
        SensitivityAnalyzer.Result result = analyzer.analyze(inputs, List.of(revenueOutcome),
            summary(120_000_000, new ValueRange(40_000_000, 120_000_000, 200_000_000)), unused());
        List<ValuationScenario> scenarios = result.analysis().getScenarios();

        assertThat(result.analysis().getScenarioSource()).isEqualTo(ScenarioSource.REVENUE_MULTIPLE);
        assertThat(scenarios).extracting(ValuationScenario::scenario)
            .containsExactly(ScenarioType.OPTIMISTIC, ScenarioType.BASE_CASE, ScenarioType.PESSIMISTIC);
        assertThat(scenarios).extracting(ValuationScenario::valuation)
            .containsExactly(165_000_000.0, 88_000_000.0, 44_000_000.0);
        assertThat(scenarios).extracting(ValuationScenario::probability)
            .containsExactly(0.2, 0.6, 0.2);
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void scenarioAssumptionsShiftGrowthAndMargin() {
        List<ValuationScenario> scenarios = analyzer.analyze(inputs, List.of(revenueOutcome),
            summary(88_000_000, ValueRange.ZERO), unused()).analysis().getScenarios();

        assertThat(scenarios.get(0).assumptions())
            .containsEntry("Revenue Growth", 35.0)
            .containsEntry("EBITDA Margin", 25.0)
            .containsEntry("Multiple Premium", 20.0);
        assertThat(scenarios.get(1).assumptions()).containsEntry("Multiple Premium", 0.0);
        assertThat(scenarios.get(2).assumptions())
            .containsEntry("Revenue Growth", 15.0)
            .containsEntry("EBITDA Margin", 15.0)
            .containsEntry("Multiple Discount", -20.0);
        assertThat(scenarios.get(0).assumptions().keySet())
            .containsExactly("Revenue Growth", "EBITDA Margin", "Multiple Premium");
    }

    @Test
    void missingRevenueMethodFallsBackToAggregateWithWarning() {
        MethodOutcome unavailable = MethodOutcome.unavailable(ValuationMethod.REVENUE_MULTIPLE, "no band");

        SensitivityAnalyzer.Result result = analyzer.analyze(inputs, List.of(unavailable),
            summary(100, new ValueRange(50, 100, 180)), unused());

        assertThat(result.analysis().getScenarios()).extracting(ValuationScenario::valuation)
            .containsExactly(180.0, 100.0, 50.0);
        assertThat(result.warnings()).hasSize(1);
        // configured SaaS band stands in for the missing adjusted multiples
        assertThat(result.analysis().getVariables().get(2).baseCase()).isEqualTo(8);
    }

    @Test
    void weightedAggregateSourceRevaluesShiftedInputs() {
        config.sensitivity().setScenarioSource(ScenarioSource.WEIGHTED_AGGREGATE);
        List<FinancialInputs> seen = new ArrayList<>();
        SensitivityAnalyzer.ScenarioRevaluer revaluer = shifted -> {
            seen.add(shifted);
            return summary(shifted.getRevenueGrowthRate() * 1_000, ValueRange.ZERO);
        };

        SensitivityAnalyzer.Result result = analyzer.analyze(inputs, List.of(revenueOutcome),
            summary(25_000, ValueRange.ZERO), revaluer);

        assertThat(result.analysis().getScenarioSource()).isEqualTo(ScenarioSource.WEIGHTED_AGGREGATE);
        List<ValuationScenario> scenarios = result.analysis().getScenarios();
        assertThat(scenarios.get(0).valuation()).isCloseTo(35_000 * 1.2, within(1e-6));
        assertThat(scenarios.get(1).valuation()).isCloseTo(25_000, within(1e-6));
        assertThat(scenarios.get(2).valuation()).isCloseTo(15_000 * 0.8, within(1e-6));

        assertThat(seen).hasSize(2);
        FinancialInputs optimistic = seen.get(0);
        assertThat(optimistic.getEbitdaMargin()).isEqualTo(25);
        assertThat(optimistic.getEbitda()).isCloseTo(2_500_000, within(1e-6));
        assertThat(optimistic.getRevenue()).isEqualTo(inputs.getRevenue());
    }
}
