package com.jay.valuation.model.methods;

import com.jay.valuation.model.ValuationAdjustment;
import com.jay.valuation.model.ValueRange;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.util.List;

/** Revenue-multiple and EBITDA-multiple results. */
@Getter
@SuperBuilder
public class MultipleMethodResult extends MethodResult {
    private final ValueRange industryMultiples;
    private final List<ValuationAdjustment> adjustments;
    private final ValueRange adjustedMultiples;
}
