package com.jay.valuation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jay.valuation.model.enums.RiskCategory;
import com.jay.valuation.model.enums.RiskImpact;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValuationRiskFactor {
    RiskCategory category;
    String factor;
    RiskImpact impact;
    String description;
    String mitigation;
    Double discountAdjustment;      // % adjustment to valuation, if suggested
}
