package com.jay.valuation.model.methods;

import com.jay.valuation.model.TransactionComparable;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.util.List;

@Getter
@SuperBuilder
public class PrecedentTransactionResult extends MarketMethodResult {
    private final List<TransactionComparable> transactions;
    private final double controlPremium;    // %
}
