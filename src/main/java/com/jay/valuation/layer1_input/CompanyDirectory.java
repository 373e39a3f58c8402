package com.jay.valuation.layer1_input;

import com.jay.valuation.exception.CompanyNotFoundException;
import com.jay.valuation.model.CompanyIdentity;

/**
 * Resolves a company id to its display name and reporting currency.
 * Owned by the records layer; the engine only reads from it.
 */
public interface CompanyDirectory {

    /**
     * @throws CompanyNotFoundException if the id is unknown
     */
    CompanyIdentity getCompany(String companyId);
}
