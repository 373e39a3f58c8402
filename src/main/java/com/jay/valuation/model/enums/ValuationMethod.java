package com.jay.valuation.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * The six valuation methodologies. The short key is what API callers use to
 * select a subset of methods ("revenue", "dcf", ...).
 */
public enum ValuationMethod {
    REVENUE_MULTIPLE("Revenue Multiple", "revenue"),
    EBITDA_MULTIPLE("EBITDA Multiple", "ebitda"),
    DISCOUNTED_CASH_FLOW("Discounted Cash Flow", "dcf"),
    ASSET_BASED("Asset-Based", "asset"),
    COMPARABLE_COMPANY("Comparable Company", "comparable"),
    PRECEDENT_TRANSACTION("Precedent Transaction", "transaction");

    private final String label;
    private final String key;

    ValuationMethod(String label, String key) {
        this.label = label;
        this.key = key;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String key() {
        return key;
    }

    public static Optional<ValuationMethod> fromKey(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values())
            .filter(m -> m.key.equalsIgnoreCase(v) || m.label.equalsIgnoreCase(v) || m.name().equalsIgnoreCase(v))
            .findFirst();
    }
}
