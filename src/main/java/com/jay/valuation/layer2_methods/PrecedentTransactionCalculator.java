package com.jay.valuation.layer2_methods;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.TransactionComparable;
import com.jay.valuation.model.ValuationAdjustment;
import com.jay.valuation.model.enums.AdjustmentType;
import com.jay.valuation.model.enums.IndustryType;
import com.jay.valuation.model.enums.ValuationMethod;
import com.jay.valuation.model.methods.MarketMethodResult;
import com.jay.valuation.model.methods.PrecedentTransactionResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Layer 2 — Precedent Transaction.
 * Historical deal multiples with an acquisition control premium.
 */
@Component
public class PrecedentTransactionCalculator extends MarketMultipleCalculator<TransactionComparable> {

    private final ValuationConfig config;
    private final MarketSampleFetcher fetcher;

    public PrecedentTransactionCalculator(ValuationConfig config, MultipleStatisticsCalculator statistics,
                                          MarketSampleFetcher fetcher) {
        super(statistics);
        this.config = config;
        this.fetcher = fetcher;
    }

    @Override
    public ValuationMethod method() {
        return ValuationMethod.PRECEDENT_TRANSACTION;
    }

    @Override
    protected ValuationConfig.MarketMethod settings() {
        return config.precedentTransaction();
    }

    @Override
    protected MarketSampleFetcher.Sample<TransactionComparable> fetchSample(IndustryType industry) {
        return fetcher.transactions(industry);
    }

    @Override
    protected double revenueMultipleOf(TransactionComparable item) {
        return item.getRevenueMultiple();
    }

    @Override
    protected double ebitdaMultipleOf(TransactionComparable item) {
        return item.getEbitdaMultiple();
    }

    @Override
    protected ValuationAdjustment adjustment(double pct) {
        return new ValuationAdjustment(AdjustmentType.CONTROL_PREMIUM,
            "Acquisition control premium", pct,
            "Buyers pay a premium for a controlling stake");
    }

    @Override
    protected MarketMethodResult.MarketMethodResultBuilder<?, ?> newBuilder(List<TransactionComparable> sample,
                                                                           double pct) {
        return PrecedentTransactionResult.builder()
            .transactions(List.copyOf(sample))
            .controlPremium(pct);
    }
}
