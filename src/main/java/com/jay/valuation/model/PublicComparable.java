package com.jay.valuation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** A listed peer used by the comparable-company method. */
@Value
@Builder
@Jacksonized
@AllArgsConstructor
public class PublicComparable {
    String companyName;
    String ticker;
    double marketCap;
    double revenue;
    double ebitda;
    double revenueMultiple;
    double ebitdaMultiple;
    double similarity;      // 0-100 %
}
