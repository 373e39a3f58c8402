package com.jay.valuation.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScenarioType {
    OPTIMISTIC("Optimistic"),
    BASE_CASE("Base Case"),
    PESSIMISTIC("Pessimistic");

    private final String label;

    ScenarioType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
