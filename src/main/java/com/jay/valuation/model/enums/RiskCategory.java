package com.jay.valuation.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskCategory {
    MARKET("Market"),
    FINANCIAL("Financial"),
    OPERATIONAL("Operational"),
    REGULATORY("Regulatory"),
    TECHNOLOGY("Technology");

    private final String label;

    RiskCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
