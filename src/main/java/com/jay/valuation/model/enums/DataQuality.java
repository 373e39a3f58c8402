package com.jay.valuation.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DataQuality {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    DataQuality(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Tier for an overall confidence on the 1-10 scale. */
    public static DataQuality fromConfidence(double confidence) {
        if (confidence >= 7) return HIGH;
        if (confidence >= 5) return MEDIUM;
        return LOW;
    }
}
