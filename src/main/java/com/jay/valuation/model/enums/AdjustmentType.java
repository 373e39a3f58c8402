package com.jay.valuation.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AdjustmentType {
    SIZE("Size Premium/Discount"),
    LIQUIDITY_DISCOUNT("Liquidity Discount"),
    CONTROL_PREMIUM("Control Premium"),
    KEY_PERSON_DISCOUNT("Key Person Discount"),
    TECHNOLOGY_PREMIUM("Technology Premium"),
    GROWTH_PREMIUM("Growth Premium"),
    OTHER("Other");

    private final String label;

    AdjustmentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
