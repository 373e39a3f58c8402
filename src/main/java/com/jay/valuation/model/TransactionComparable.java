package com.jay.valuation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/** A historical M&A deal used by the precedent-transaction method. */
@Value
@Builder
@Jacksonized
@AllArgsConstructor
public class TransactionComparable {
    String targetCompany;
    String acquirer;
    LocalDate transactionDate;
    double transactionValue;
    double revenue;
    double ebitda;
    double revenueMultiple;
    double ebitdaMultiple;
    double similarity;      // 0-100 %
}
