package com.jay.valuation.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum BusinessModel {
    B2B_SAAS("B2B SaaS"),
    B2C_SAAS("B2C SaaS"),
    MARKETPLACE("Marketplace"),
    E_COMMERCE("E-commerce"),
    MANUFACTURING("Manufacturing"),
    SERVICES("Services"),
    HYBRID("Hybrid"),
    OTHER("Other");

    private final String label;

    BusinessModel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<BusinessModel> fromLabel(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values())
            .filter(m -> m.label.equalsIgnoreCase(v) || m.name().equalsIgnoreCase(v))
            .findFirst();
    }
}
