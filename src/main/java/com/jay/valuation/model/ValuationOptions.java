package com.jay.valuation.model;

import com.jay.valuation.model.enums.ValuationMethod;
import lombok.Builder;
import lombok.Data;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-request switches. An empty method set means all six methods.
 */
@Data
@Builder
public class ValuationOptions {
    private boolean includeComparables;
    private boolean includeSensitivity;
    @Builder.Default
    private Set<ValuationMethod> methods = EnumSet.allOf(ValuationMethod.class);

    public boolean selects(ValuationMethod method) {
        return methods == null || methods.isEmpty() || methods.contains(method);
    }

    public static ValuationOptions defaults() {
        return ValuationOptions.builder().build();
    }
}
