package com.jay.valuation.layer4_risk;

import com.jay.valuation.ValuationFixtures;
import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.FinancialInputs;
import com.jay.valuation.model.ValuationRiskFactor;
import com.jay.valuation.model.enums.RiskCategory;
import com.jay.valuation.model.enums.RiskImpact;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RiskFactorIdentifierTest {

    private final RiskFactorIdentifier identifier = new RiskFactorIdentifier(new ValuationConfig());

    @Test
    void healthyCompanyHasNoRiskFactors() {
        assertThat(identifier.identify(ValuationFixtures.saas().employeeCount(200).build())).isEmpty();
    }

    @Test
    void everyThresholdTripsInFixedOrder() {
        FinancialInputs inputs = ValuationFixtures.saas()
            .ebitdaMargin(5)
            .revenueGrowthRate(2)
            .employeeCount(12)
            .build();

        List<ValuationRiskFactor> factors = identifier.identify(inputs);

        assertThat(factors).extracting(ValuationRiskFactor::getFactor)
            .containsExactly("Low Profitability", "Slow Growth", "Key Person Risk");
        assertThat(factors).extracting(ValuationRiskFactor::getCategory)
            .containsExactly(RiskCategory.FINANCIAL, RiskCategory.MARKET, RiskCategory.OPERATIONAL);
        assertThat(factors).extracting(ValuationRiskFactor::getImpact)
            .containsExactly(RiskImpact.HIGH, RiskImpact.MEDIUM, RiskImpact.MEDIUM);
        assertThat(factors.get(0).getDiscountAdjustment()).isEqualTo(-15.0);
        assertThat(factors.get(1).getDiscountAdjustment()).isNull();
    }

    @Test
    void identicalInputsGiveIdenticalLists() {
        FinancialInputs inputs = ValuationFixtures.saas().ebitdaMargin(5).revenueGrowthRate(2).build();

        assertThat(identifier.identify(inputs)).isEqualTo(identifier.identify(inputs));
    }

    @Test
    void missingEmployeeCountIsNotKeyPersonRisk() {
        FinancialInputs inputs = ValuationFixtures.saas().employeeCount(null).build();

        assertThat(identifier.identify(inputs)).isEmpty();
    }

    @Test
    void thresholdsAreStrict() {
        FinancialInputs inputs = ValuationFixtures.saas()
            .ebitdaMargin(10)
            .revenueGrowthRate(5)
            .employeeCount(50)
            .build();

        assertThat(identifier.identify(inputs)).isEmpty();
    }
}
