package com.jay.valuation.model;

public record PerShareMetrics(double sharesOutstanding, double valuePerShare, ValueRange priceRange) {}
