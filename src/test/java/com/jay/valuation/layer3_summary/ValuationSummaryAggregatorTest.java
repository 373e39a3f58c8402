package com.jay.valuation.layer3_summary;

import com.jay.valuation.ValuationFixtures;
import com.jay.valuation.model.ValuationSummary;
import com.jay.valuation.model.ValueRange;
import com.jay.valuation.model.enums.DataQuality;
import com.jay.valuation.model.enums.ValuationMethod;
import com.jay.valuation.model.methods.AssetBasedMethodResult;
import com.jay.valuation.model.methods.ComparableCompanyResult;
import com.jay.valuation.model.methods.DcfMethodResult;
import com.jay.valuation.model.methods.MethodOutcome;
import com.jay.valuation.model.methods.MultipleMethodResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ValuationSummaryAggregatorTest {

    private final ValuationSummaryAggregator aggregator = new ValuationSummaryAggregator();

    private static MethodOutcome revenue(double median, double weight, double confidence) {
        return MethodOutcome.success(MultipleMethodResult.builder()
            .method(ValuationMethod.REVENUE_MULTIPLE)
            .industryMultiples(new ValueRange(4, 8, 15))
            .adjustments(List.of())
            .adjustedMultiples(new ValueRange(8, 10, 12))
            .valuationRange(ValueRange.around(median, 0.8, 1.2))
            .weight(weight)
            .confidence(confidence)
            .build());
    }

    private static MethodOutcome dcf(double median, double weight, double confidence) {
        return MethodOutcome.success(DcfMethodResult.builder()
            .method(ValuationMethod.DISCOUNTED_CASH_FLOW)
            .projectedCashFlows(List.of())
            .equityValue(median)
            .valuationRange(ValueRange.around(median, 0.8, 1.2))
            .weight(weight)
            .confidence(confidence)
            .build());
    }

    @Test
    void weightedMedianAndUnionRange() {
        List<MethodOutcome> outcomes = List.of(revenue(100, 0.3, 7), dcf(200, 0.1, 5));

        ValuationSummary summary = aggregator.aggregate(outcomes, ValuationFixtures.saas().build());

        assertThat(summary.getWeightedValuation()).isCloseTo(125, within(1e-9));
        assertThat(summary.getValuationRange().low()).isCloseTo(80, within(1e-9));
        assertThat(summary.getValuationRange().median()).isCloseTo(125, within(1e-9));
        assertThat(summary.getValuationRange().high()).isCloseTo(240, within(1e-9));
        assertThat(summary.getOverallConfidence()).isCloseTo(6.5, within(1e-9));
        assertThat(summary.getDataQuality()).isEqualTo(DataQuality.MEDIUM);
        assertThat(summary.getMethodCount()).isEqualTo(2);
    }

    @Test
    void weightsOfSurvivorsAreRenormalised() {
        List<MethodOutcome> outcomes = List.of(
            revenue(100, 0.3, 8),
            MethodOutcome.unavailable(ValuationMethod.DISCOUNTED_CASH_FLOW, "WACC too low"));

        ValuationSummary summary = aggregator.aggregate(outcomes, ValuationFixtures.saas().build());

        assertThat(summary.getWeightedValuation()).isCloseTo(100, within(1e-9));
        assertThat(summary.getOverallConfidence()).isCloseTo(8, within(1e-9));
        assertThat(summary.getDataQuality()).isEqualTo(DataQuality.HIGH);
        assertThat(summary.getMethodCount()).isEqualTo(1);
    }

    @Test
    void zeroWeightMethodStaysOutOfTheRange() {
        MethodOutcome emptyComparables = MethodOutcome.success(ComparableCompanyResult.builder()
            .method(ValuationMethod.COMPARABLE_COMPANY)
            .comparables(List.of())
            .valuationRange(ValueRange.ZERO)
            .weight(0)
            .confidence(1)
            .build());

        ValuationSummary summary = aggregator.aggregate(
            List.of(revenue(100, 0.3, 7), emptyComparables), ValuationFixtures.saas().build());

        assertThat(summary.getValuationRange().low()).isCloseTo(80, within(1e-9));
        assertThat(summary.getOverallConfidence()).isCloseTo(7, within(1e-9));
        assertThat(summary.getMethodCount()).isEqualTo(2);
    }

    @Test
    void weightedValuationLiesWithinRange() {
        List<MethodOutcome> outcomes = List.of(revenue(90, 0.3, 7), dcf(400, 0.2, 6), revenue(10, 0.05, 3));

        ValuationSummary summary = aggregator.aggregate(outcomes, ValuationFixtures.saas().build());

        assertThat(summary.getValuationRange().low()).isLessThanOrEqualTo(summary.getWeightedValuation());
        assertThat(summary.getWeightedValuation()).isLessThanOrEqualTo(summary.getValuationRange().high());
    }

    @Test
    void impliedMultiplesAreBackSolved() {
        MethodOutcome asset = MethodOutcome.success(AssetBasedMethodResult.builder()
            .method(ValuationMethod.ASSET_BASED)
            .assetAdjustments(List.of())
            .adjustedBookValue(50)
            .valuationRange(ValueRange.around(50, 0.8, 1.2))
            .weight(0.1)
            .confidence(5)
            .build());

        ValuationSummary summary = aggregator.aggregate(
            List.of(revenue(100, 0.3, 7), dcf(200, 0.1, 5)), ValuationFixtures.saas().build());
        ValuationSummary withAssets = aggregator.aggregate(
            List.of(revenue(100, 0.3, 7), asset), ValuationFixtures.saas().build());

        // 125 / 100 x adjusted median 10
        assertThat(summary.getImpliedMultiples().revenueMultiple()).isCloseTo(12.5, within(1e-9));
        assertThat(summary.getImpliedMultiples().ebitdaMultiple()).isZero();
        assertThat(summary.getImpliedMultiples().bookValueMultiple()).isZero();
        // (100 x 0.3 + 50 x 0.1) / 0.4 = 87.5, / 50
        assertThat(withAssets.getImpliedMultiples().bookValueMultiple()).isCloseTo(1.75, within(1e-9));
    }

    @Test
    void perShareMetricsWhenSharesGiven() {
        ValuationSummary summary = aggregator.aggregate(
            List.of(revenue(100, 0.3, 7), dcf(200, 0.1, 5)),
            ValuationFixtures.saas().sharesOutstanding(10.0).build());

        assertThat(summary.getPerShareMetrics()).isNotNull();
        assertThat(summary.getPerShareMetrics().valuePerShare()).isCloseTo(12.5, within(1e-9));
        assertThat(summary.getPerShareMetrics().priceRange().high()).isCloseTo(24, within(1e-9));
    }

    @Test
    void noPerShareMetricsWithoutShares() {
        ValuationSummary summary = aggregator.aggregate(List.of(revenue(100, 0.3, 7)),
            ValuationFixtures.saas().build());

        assertThat(summary.getPerShareMetrics()).isNull();
    }

    @Test
    void noAvailableMethodGivesZeroSummary() {
        List<MethodOutcome> outcomes = List.of(
            MethodOutcome.unavailable(ValuationMethod.DISCOUNTED_CASH_FLOW, "WACC too low"),
            MethodOutcome.unavailable(ValuationMethod.ASSET_BASED, "negative book value"));

        ValuationSummary summary = aggregator.aggregate(outcomes, ValuationFixtures.saas().build());

        assertThat(summary.getWeightedValuation()).isZero();
        assertThat(summary.getValuationRange()).isEqualTo(ValueRange.ZERO);
        assertThat(summary.getDataQuality()).isEqualTo(DataQuality.LOW);
        assertThat(summary.getMethodCount()).isZero();
    }
}
