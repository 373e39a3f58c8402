package com.jay.valuation.model.methods;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.jay.valuation.model.enums.ValuationMethod;

/**
 * Either a successful MethodResult or the reason the method could not produce one.
 * The aggregator only folds over successes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MethodOutcome(ValuationMethod method, MethodResult result, String unavailableReason) {

    public static MethodOutcome success(MethodResult result) {
        return new MethodOutcome(result.getMethod(), result, null);
    }

    public static MethodOutcome unavailable(ValuationMethod method, String reason) {
        return new MethodOutcome(method, null, reason);
    }

    @JsonProperty("available")
    public boolean available() {
        return result != null;
    }
}
