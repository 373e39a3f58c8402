package com.jay.valuation.model.methods;

import com.jay.valuation.model.PublicComparable;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.util.List;

@Getter
@SuperBuilder
public class ComparableCompanyResult extends MarketMethodResult {
    private final List<PublicComparable> comparables;
}
