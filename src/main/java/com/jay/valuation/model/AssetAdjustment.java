package com.jay.valuation.model;

public record AssetAdjustment(
    String asset,
    double bookValue,
    double marketValue,
    double adjustment,
    String reason
) {}
