package com.jay.valuation.layer2_methods;

import com.jay.valuation.ValuationFixtures;
import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.enums.AdjustmentType;
import com.jay.valuation.model.enums.IndustryType;
import com.jay.valuation.model.methods.MarketMethodResult;
import com.jay.valuation.model.methods.PrecedentTransactionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PrecedentTransactionCalculatorTest {

    @Mock
    private MarketSampleFetcher fetcher;

    private PrecedentTransactionCalculator calculator;

    @BeforeEach
    void setUp() {
        ValuationConfig config = new ValuationConfig();
        calculator = new PrecedentTransactionCalculator(config, new MultipleStatisticsCalculator(config), fetcher);
    }

    @Test
    void controlPremiumOnDealMultiples() {
        when(fetcher.transactions(IndustryType.SAAS))
            .thenReturn(new MarketSampleFetcher.Sample<>(ValuationFixtures.deals(), null));

        MarketMethodResult result = calculator.calculate(ValuationFixtures.saas().build());

        // revenue median 6.25, EBITDA median 31.25 (upper middle of two), both x 1.25
        assertThat(result.getRevenueValuation()).isCloseTo(78_125_000, within(1e-3));
        assertThat(result.getEbitdaValuation()).isCloseTo(78_125_000, within(1e-3));
        assertThat(result.getValuationRange().low()).isCloseTo(62_500_000, within(1e-3));
        assertThat(result.getValuationRange().high()).isCloseTo(93_750_000, within(1e-3));
        assertThat(result.getAdjustments()).extracting("type").containsExactly(AdjustmentType.CONTROL_PREMIUM);
        assertThat(result.getConfidence()).isEqualTo(6);
        assertThat(result.getWeight()).isEqualTo(0.1);
        assertThat(result.getWarnings()).isEmpty();

        PrecedentTransactionResult transactions = (PrecedentTransactionResult) result;
        assertThat(transactions.getControlPremium()).isEqualTo(25);
        assertThat(transactions.getTransactions()).hasSize(2);
    }
}
