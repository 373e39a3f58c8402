package com.jay.valuation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jay.valuation.model.enums.BusinessModel;
import com.jay.valuation.model.enums.IndustryType;
import com.jay.valuation.model.enums.MarketPosition;
import lombok.Builder;
import lombok.Value;

/**
 * Fully populated financial snapshot of one company-period.
 * All monetary fields share the report currency; margins and growth are percentages.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FinancialInputs {

    // Revenue
    double revenue;
    double revenueGrowthRate;       // % year on year

    // Profitability
    double grossProfit;
    double grossMargin;             // %
    double ebitda;
    double ebitdaMargin;            // %
    double netIncome;

    // Balance sheet
    double totalAssets;
    double totalLiabilities;
    double shareholdersEquity;

    // Cash flow
    double operatingCashFlow;
    double freeCashFlow;

    // Business profile
    IndustryType industryType;
    BusinessModel businessModel;
    MarketPosition marketPosition;

    // Optional
    Integer employeeCount;
    Integer customersCount;
    Double sharesOutstanding;
}
