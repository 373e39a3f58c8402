package com.jay.valuation.layer2_methods;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.FinancialInputs;
import com.jay.valuation.model.MultipleStatistics;
import com.jay.valuation.model.ValuationAdjustment;
import com.jay.valuation.model.ValueRange;
import com.jay.valuation.model.enums.IndustryType;
import com.jay.valuation.model.methods.MarketMethodResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 2 — shared core of the market-based methods.
 *
 * Median revenue and EBITDA multiples of the sample (EBITDA multiples filtered to
 * positive values) are shifted by the method's premium or discount and applied to the
 * subject's revenue and EBITDA. The two point valuations ("legs") are bracketed:
 *   low = min(legs) × 0.8, median = mean(legs), high = max(legs) × 1.2
 * A leg without data (empty sample, a non-positive median revenue multiple, or
 * EBITDA ≤ 0) is left out of the range instead of pulling the low bound to zero. With no leg at all the method carries zero weight.
 */
@Slf4j
public abstract class MarketMultipleCalculator<T> implements MethodCalculator {

    private final MultipleStatisticsCalculator statistics;

    protected MarketMultipleCalculator(MultipleStatisticsCalculator statistics) {
        this.statistics = statistics;
    }

    protected abstract ValuationConfig.MarketMethod settings();

    protected abstract MarketSampleFetcher.Sample<T> fetchSample(IndustryType industry);

    protected abstract double revenueMultipleOf(T item);

    protected abstract double ebitdaMultipleOf(T item);

    protected abstract ValuationAdjustment adjustment(double pct);

    /** Builder pre-populated with the method-specific payload. */
    protected abstract MarketMethodResult.MarketMethodResultBuilder<?, ?> newBuilder(List<T> sample, double pct);

    @Override
    public MarketMethodResult calculate(FinancialInputs inputs) {
        MarketSampleFetcher.Sample<T> sample = fetchSample(inputs.getIndustryType());
        return calculate(inputs, sample.items(), sample.warning());
    }

    /** Values the inputs against an already fetched sample. */
    public MarketMethodResult calculate(FinancialInputs inputs, List<T> sample) {
        return calculate(inputs, sample, null);
    }

    private MarketMethodResult calculate(FinancialInputs inputs, List<T> sample, String fetchWarning) {
        ValuationConfig.MarketMethod cfg = settings();
        List<String> warnings = new ArrayList<>();
        if (fetchWarning != null) warnings.add(fetchWarning);

        MultipleStatistics revenueStats = statistics.calculate(
            sample.stream().map(this::revenueMultipleOf).toList());
        MultipleStatistics ebitdaStats = statistics.calculate(
            sample.stream().map(this::ebitdaMultipleOf).filter(m -> m > 0).toList());

        double factor = 1 + cfg.getAdjustmentPct() / 100;
        boolean revenueLeg = revenueStats.hasData() && revenueStats.median() > 0;
        boolean ebitdaLeg = ebitdaStats.hasData() && inputs.getEbitda() > 0;
        double revenueValuation = revenueLeg ? inputs.getRevenue() * revenueStats.median() * factor : 0;
        double ebitdaValuation = ebitdaLeg ? inputs.getEbitda() * ebitdaStats.median() * factor : 0;

        double lo = cfg.getRangeLowFactor();
        double hi = cfg.getRangeHighFactor();
        double confidence = cfg.getConfidence();
        double weight = cfg.getWeight();
        ValueRange range;

        if (revenueLeg && ebitdaLeg) {
            range = new ValueRange(
                Math.min(revenueValuation * lo, ebitdaValuation * lo),
                (revenueValuation + ebitdaValuation) / 2,
                Math.max(revenueValuation * hi, ebitdaValuation * hi));
        } else if (revenueLeg || ebitdaLeg) {
            range = ValueRange.around(revenueLeg ? revenueValuation : ebitdaValuation, lo, hi);
            confidence = Math.max(1, confidence - cfg.getSingleLegConfidencePenalty());
            warnings.add(String.format("%s: %s leg unavailable, range built from the %s leg only",
                method().label(), revenueLeg ? "EBITDA" : "revenue", revenueLeg ? "revenue" : "EBITDA"));
        } else {
            range = ValueRange.ZERO;
            confidence = cfg.getNoDataConfidence();
            weight = 0;
            warnings.add(method().label() + (sample.isEmpty()
                ? ": empty market sample, method carries no weight"
                : ": no usable market multiples, method carries no weight"));
        }

        log.debug("{}: n={} revMedian={} ebitdaMedian={} → {}", method().label(), sample.size(),
            revenueStats.median(), ebitdaStats.median(), range);

        return newBuilder(sample, cfg.getAdjustmentPct())
            .method(method())
            .revenueMultiples(revenueStats)
            .ebitdaMultiples(ebitdaStats)
            .adjustments(List.of(adjustment(cfg.getAdjustmentPct())))
            .revenueValuation(revenueValuation)
            .ebitdaValuation(ebitdaValuation)
            .valuationRange(range)
            .confidence(confidence)
            .weight(weight)
            .warnings(List.copyOf(warnings))
            .build();
    }
}
