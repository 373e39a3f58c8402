package com.jay.valuation.layer2_methods;

import com.jay.valuation.ValuationFixtures;
import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.methods.MultipleMethodResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EbitdaMultipleCalculatorTest {

    private final EbitdaMultipleCalculator calculator = new EbitdaMultipleCalculator(new ValuationConfig());

    @Test
    void appliesIndustryBandToEbitda() {
        MultipleMethodResult result = calculator.calculate(ValuationFixtures.saas().build());

        assertThat(result.getAdjustments()).isEmpty();
        assertThat(result.getValuationRange().low()).isCloseTo(30_000_000, within(1e-3));
        assertThat(result.getValuationRange().median()).isCloseTo(50_000_000, within(1e-3));
        assertThat(result.getValuationRange().high()).isCloseTo(80_000_000, within(1e-3));
        assertThat(result.getWeight()).isEqualTo(0.25);
        assertThat(result.getConfidence()).isEqualTo(8);
    }

    @Test
    void highMarginEarnsPremium() {
        MultipleMethodResult result = calculator.calculate(ValuationFixtures.saas()
            .ebitda(3_000_000)
            .ebitdaMargin(30)
            .build());

        assertThat(result.getAdjustments()).hasSize(1);
        assertThat(result.getAdjustedMultiples().median()).isCloseTo(27.5, within(1e-9));
        assertThat(result.getValuationRange().median()).isCloseTo(82_500_000, within(1e-3));
    }

    @Test
    void lossMakingCompanyIsDownWeightedNotNegative() {
        MultipleMethodResult result = calculator.calculate(ValuationFixtures.saas()
            .ebitda(-1_000_000)
            .ebitdaMargin(-10)
            .build());

        assertThat(result.getValuationRange().low()).isGreaterThanOrEqualTo(0);
        assertThat(result.getValuationRange().high()).isGreaterThanOrEqualTo(0);
        assertThat(result.getWeight()).isLessThanOrEqualTo(0.05);
        assertThat(result.getConfidence()).isLessThanOrEqualTo(3);
        assertThat(result.getWarnings()).hasSize(1);
    }

    @Test
    void zeroEbitdaCountsAsUnprofitable() {
        MultipleMethodResult result = calculator.calculate(ValuationFixtures.saas()
            .ebitda(0)
            .ebitdaMargin(0)
            .build());

        assertThat(result.getValuationRange().median()).isZero();
        assertThat(result.getWeight()).isEqualTo(0.05);
    }
}
