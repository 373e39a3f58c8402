package com.jay.valuation.model;

import com.jay.valuation.model.methods.MethodOutcome;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Top-level valuation report. Built once per request and not modified afterwards.
 * methods holds one outcome per selected methodology, in ValuationMethod order.
 */
@Value
@Builder
public class CompanyValuation {
    String companyId;
    String companyName;
    String currency;
    LocalDate valuationDate;
    FinancialInputs financialInputs;
    List<MethodOutcome> methods;
    ValuationSummary valuationSummary;
    List<MarketComparable> comparables;
    SensitivityAnalysis sensitivityAnalysis;
    List<ValuationRiskFactor> riskFactors;
    List<String> warnings;
    LocalDateTime generatedAt;
}
