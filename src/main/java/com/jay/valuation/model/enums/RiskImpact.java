package com.jay.valuation.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskImpact {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    RiskImpact(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
