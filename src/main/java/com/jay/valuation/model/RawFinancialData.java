package com.jay.valuation.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Loosely typed financial record as supplied by callers. Any field may be absent (null);
 * an explicit zero is a value. FinancialInputsNormalizer turns this into FinancialInputs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawFinancialData {
    private Double revenue;
    private Double revenueGrowthRate;
    private Double grossProfit;
    private Double grossMargin;
    private Double ebitda;
    private Double ebitdaMargin;
    private Double netIncome;
    private Double totalAssets;
    private Double totalLiabilities;
    private Double shareholdersEquity;
    private Double operatingCashFlow;
    private Double freeCashFlow;
    private String industryType;
    private String businessModel;
    private String marketPosition;
    private Integer employeeCount;
    private Integer customersCount;
    private Double sharesOutstanding;
}
