package com.jay.valuation.layer2_methods;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.MultipleStatistics;
import com.jay.valuation.model.enums.QuantileMethod;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;

/**
 * min / quartiles / max / mean / population standard deviation over a multiple sample.
 * The input is copied and sorted, so the result does not depend on sample order.
 * Quartiles follow the configured QuantileMethod (nearest rank by default).
 */
@Component
@RequiredArgsConstructor
public class MultipleStatisticsCalculator {

    private final ValuationConfig config;

    public MultipleStatistics calculate(Collection<Double> sample) {
        if (sample == null || sample.isEmpty()) {
            return MultipleStatistics.empty();
        }
        double[] sorted = sample.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        int n = sorted.length;
        QuantileMethod quantiles = config.statistics().getQuantileMethod();

        double mean = Arrays.stream(sorted).sum() / n;
        double variance = Arrays.stream(sorted).map(v -> (v - mean) * (v - mean)).sum() / n;

        return new MultipleStatistics(
            n,
            sorted[0],
            quantiles.quantile(sorted, 0.25),
            quantiles.quantile(sorted, 0.5),
            quantiles.quantile(sorted, 0.75),
            sorted[n - 1],
            mean,
            Math.sqrt(variance)
        );
    }
}
