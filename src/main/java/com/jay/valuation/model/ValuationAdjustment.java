package com.jay.valuation.model;

import com.jay.valuation.model.enums.AdjustmentType;

/** A percentage premium (positive) or discount (negative) applied to a multiple band. */
public record ValuationAdjustment(
    AdjustmentType type,
    String description,
    double adjustment,
    String rationale
) {}
