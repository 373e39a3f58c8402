package com.jay.valuation.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum IndustryType {
    SAAS("SaaS"),
    TECHNOLOGY("Technology"),
    MANUFACTURING("Manufacturing"),
    RETAIL("Retail"),
    HEALTHCARE("Healthcare"),
    FINANCIAL_SERVICES("Financial Services"),
    ENERGY("Energy"),
    REAL_ESTATE("Real Estate"),
    OTHER("Other");

    private final String label;

    IndustryType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Matches the display label or the enum name, ignoring case. */
    public static Optional<IndustryType> fromLabel(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values())
            .filter(t -> t.label.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v))
            .findFirst();
    }
}
