package com.jay.valuation.layer2_methods;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.PublicComparable;
import com.jay.valuation.model.ValuationAdjustment;
import com.jay.valuation.model.enums.AdjustmentType;
import com.jay.valuation.model.enums.IndustryType;
import com.jay.valuation.model.enums.ValuationMethod;
import com.jay.valuation.model.methods.ComparableCompanyResult;
import com.jay.valuation.model.methods.MarketMethodResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Layer 2 — Comparable Company.
 * Public peer multiples with a private-company liquidity discount.
 */
@Component
public class ComparableCompanyCalculator extends MarketMultipleCalculator<PublicComparable> {

    private final ValuationConfig config;
    private final MarketSampleFetcher fetcher;

    public ComparableCompanyCalculator(ValuationConfig config, MultipleStatisticsCalculator statistics,
                                       MarketSampleFetcher fetcher) {
        super(statistics);
        this.config = config;
        this.fetcher = fetcher;
    }

    @Override
    public ValuationMethod method() {
        return ValuationMethod.COMPARABLE_COMPANY;
    }

    @Override
    protected ValuationConfig.MarketMethod settings() {
        return config.comparableCompany();
    }

    @Override
    protected MarketSampleFetcher.Sample<PublicComparable> fetchSample(IndustryType industry) {
        return fetcher.comparables(industry);
    }

    @Override
    protected double revenueMultipleOf(PublicComparable item) {
        return item.getRevenueMultiple();
    }

    @Override
    protected double ebitdaMultipleOf(PublicComparable item) {
        return item.getEbitdaMultiple();
    }

    @Override
    protected ValuationAdjustment adjustment(double pct) {
        return new ValuationAdjustment(AdjustmentType.LIQUIDITY_DISCOUNT,
            "Private company liquidity discount", pct,
            "Private companies trade at a discount to public comparables");
    }

    @Override
    protected MarketMethodResult.MarketMethodResultBuilder<?, ?> newBuilder(List<PublicComparable> sample, double pct) {
        return ComparableCompanyResult.builder().comparables(List.copyOf(sample));
    }
}
