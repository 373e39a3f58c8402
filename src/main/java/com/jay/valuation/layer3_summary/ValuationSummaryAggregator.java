package com.jay.valuation.layer3_summary;

import com.jay.valuation.model.FinancialInputs;
import com.jay.valuation.model.ImpliedMultiples;
import com.jay.valuation.model.PerShareMetrics;
import com.jay.valuation.model.ValuationSummary;
import com.jay.valuation.model.ValueRange;
import com.jay.valuation.model.enums.DataQuality;
import com.jay.valuation.model.enums.ValuationMethod;
import com.jay.valuation.model.methods.AssetBasedMethodResult;
import com.jay.valuation.model.methods.MethodOutcome;
import com.jay.valuation.model.methods.MethodResult;
import com.jay.valuation.model.methods.MultipleMethodResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Layer 3 — Valuation Summary.
 * Folds the successful method results into one weighted valuation:
 *   weighted   = Σ(median × weight) / Σ(weight)
 *   confidence = Σ(confidence × weight) / Σ(weight)
 *   range      = [min of lows, weighted, max of highs]
 * Only available methods with a positive weight take part, so the weights of the
 * survivors are renormalised automatically.
 */
@Slf4j
@Component
public class ValuationSummaryAggregator {

    public ValuationSummary aggregate(List<MethodOutcome> outcomes, FinancialInputs inputs) {
        List<MethodResult> available = outcomes.stream()
            .filter(MethodOutcome::available)
            .map(MethodOutcome::result)
            .toList();
        List<MethodResult> weighted = available.stream()
            .filter(r -> r.getWeight() > 0)
            .toList();

        if (weighted.isEmpty()) {
            log.warn("No weighted valuation method available ({} of {} methods succeeded)",
                available.size(), outcomes.size());
            return ValuationSummary.empty(available.size());
        }

        double totalWeight = weighted.stream().mapToDouble(MethodResult::getWeight).sum();
        double weightedValuation = weighted.stream()
            .mapToDouble(r -> r.getValuationRange().median() * r.getWeight())
            .sum() / totalWeight;
        double overallConfidence = weighted.stream()
            .mapToDouble(r -> r.getConfidence() * r.getWeight())
            .sum() / totalWeight;

        double low = weighted.stream().mapToDouble(r -> r.getValuationRange().low()).min().orElse(0);
        double high = weighted.stream().mapToDouble(r -> r.getValuationRange().high()).max().orElse(0);
        ValueRange range = new ValueRange(low, weightedValuation, high);

        return ValuationSummary.builder()
            .weightedValuation(weightedValuation)
            .valuationRange(range)
            .impliedMultiples(impliedMultiples(outcomes, weightedValuation))
            .perShareMetrics(perShare(inputs, weightedValuation, range))
            .overallConfidence(overallConfidence)
            .methodCount(available.size())
            .dataQuality(DataQuality.fromConfidence(overallConfidence))
            .build();
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    /**
     * Back-solves each multiple proportionally: weighted / method median × method multiple.
     * A multiple whose source method is missing or has a zero median is reported as 0.
     */
    private ImpliedMultiples impliedMultiples(List<MethodOutcome> outcomes, double weightedValuation) {
        double revenueMultiple = find(outcomes, ValuationMethod.REVENUE_MULTIPLE, MultipleMethodResult.class)
            .filter(r -> r.getValuationRange().median() > 0)
            .map(r -> weightedValuation / r.getValuationRange().median() * r.getAdjustedMultiples().median())
            .orElse(0.0);
        double ebitdaMultiple = find(outcomes, ValuationMethod.EBITDA_MULTIPLE, MultipleMethodResult.class)
            .filter(r -> r.getValuationRange().median() > 0)
            .map(r -> weightedValuation / r.getValuationRange().median() * r.getAdjustedMultiples().median())
            .orElse(0.0);
        double bookValueMultiple = find(outcomes, ValuationMethod.ASSET_BASED, AssetBasedMethodResult.class)
            .filter(r -> r.getAdjustedBookValue() > 0)
            .map(r -> weightedValuation / r.getAdjustedBookValue())
            .orElse(0.0);
        return new ImpliedMultiples(revenueMultiple, ebitdaMultiple, bookValueMultiple);
    }

    private PerShareMetrics perShare(FinancialInputs inputs, double weightedValuation, ValueRange range) {
        Double shares = inputs.getSharesOutstanding();
        if (shares == null || shares <= 0) return null;
        return new PerShareMetrics(shares, weightedValuation / shares, range.scale(1 / shares));
    }

    private static <R extends MethodResult> Optional<R> find(List<MethodOutcome> outcomes,
                                                             ValuationMethod method, Class<R> type) {
        return outcomes.stream()
            .filter(o -> o.method() == method && o.available())
            .map(MethodOutcome::result)
            .filter(type::isInstance)
            .map(type::cast)
            .findFirst();
    }
}
