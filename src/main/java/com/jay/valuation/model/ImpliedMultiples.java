package com.jay.valuation.model;

public record ImpliedMultiples(double revenueMultiple, double ebitdaMultiple, double bookValueMultiple) {

    public static final ImpliedMultiples NONE = new ImpliedMultiples(0, 0, 0);
}
