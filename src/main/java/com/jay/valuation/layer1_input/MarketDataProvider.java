package com.jay.valuation.layer1_input;

import com.jay.valuation.model.PublicComparable;
import com.jay.valuation.model.TransactionComparable;
import com.jay.valuation.model.enums.IndustryType;

import java.util.List;

/**
 * Source of market samples for the comparable-company and precedent-transaction methods.
 * Implementations may block. Callers stop waiting after their own timeout but cannot
 * interrupt the call, so remote implementations must bound their I/O themselves
 * (as HttpCompanyDirectory does through its OkHttp timeouts).
 */
public interface MarketDataProvider {

    List<PublicComparable> getComparables(IndustryType industry);

    List<TransactionComparable> getTransactions(IndustryType industry);
}
