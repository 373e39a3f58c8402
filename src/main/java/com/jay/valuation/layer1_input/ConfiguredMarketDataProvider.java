package com.jay.valuation.layer1_input;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.PublicComparable;
import com.jay.valuation.model.TransactionComparable;
import com.jay.valuation.model.enums.IndustryType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Serves the market_data fixtures from valuation.yaml, keyed by industry label with a
 * "default" entry used for industries that have no sample of their own.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfiguredMarketDataProvider implements MarketDataProvider {

    static final String DEFAULT_KEY = "default";

    private final ValuationConfig config;

    @Override
    public List<PublicComparable> getComparables(IndustryType industry) {
        return sampleFor(config.marketData().getComparables(), industry, "comparables");
    }

    @Override
    public List<TransactionComparable> getTransactions(IndustryType industry) {
        return sampleFor(config.marketData().getTransactions(), industry, "transactions");
    }

    private <T> List<T> sampleFor(Map<String, List<T>> fixtures, IndustryType industry, String kind) {
        List<T> sample = fixtures.get(industry.label());
        if (sample == null) {
            sample = fixtures.getOrDefault(DEFAULT_KEY, List.of());
        }
        log.debug("Market data: {} {} for {}", sample.size(), kind, industry.label());
        return List.copyOf(sample);
    }
}
