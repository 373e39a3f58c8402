package com.jay.valuation.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum MarketPosition {
    MARKET_LEADER("Market Leader"),
    STRONG_COMPETITOR("Strong Competitor"),
    NICHE_PLAYER("Niche Player"),
    EMERGING("Emerging"),
    DECLINING("Declining");

    private final String label;

    MarketPosition(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<MarketPosition> fromLabel(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values())
            .filter(p -> p.label.equalsIgnoreCase(v) || p.name().equalsIgnoreCase(v))
            .findFirst();
    }
}
