package com.jay.valuation.controller;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.jay.valuation.exception.InvalidInputException;
import com.jay.valuation.model.RawFinancialData;
import com.jay.valuation.model.ValuationOptions;
import com.jay.valuation.model.enums.ValuationMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Request body for POST /api/valuations/{companyId}.
 * methods takes keys (revenue, ebitda, dcf, asset, comparable, transaction) or labels;
 * absent or empty means all six.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValuationRequest {

    private RawFinancialData financialData;
    private boolean includeComparables;
    private boolean includeSensitivity;
    private List<String> methods;

    public ValuationOptions toOptions() {
        Set<ValuationMethod> selected = EnumSet.noneOf(ValuationMethod.class);
        if (methods != null) {
            for (String name : methods) {
                selected.add(ValuationMethod.fromKey(name)
                    .orElseThrow(() -> new InvalidInputException("methods", "unknown valuation method '" + name + "'")));
            }
        }
        return ValuationOptions.builder()
            .includeComparables(includeComparables)
            .includeSensitivity(includeSensitivity)
            .methods(selected.isEmpty() ? EnumSet.allOf(ValuationMethod.class) : selected)
            .build();
    }
}
