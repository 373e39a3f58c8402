package com.jay.valuation.model;

public record ProjectedCashFlow(
    int year,
    double revenue,
    double ebitda,
    double taxes,
    double capitalExpenditure,
    double workingCapitalChange,
    double freeCashFlow,
    double presentValue
) {}
