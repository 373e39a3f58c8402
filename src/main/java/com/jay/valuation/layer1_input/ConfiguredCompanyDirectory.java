package com.jay.valuation.layer1_input;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.exception.CompanyNotFoundException;
import com.jay.valuation.model.CompanyIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Company lookup backed by the company_directory.companies map in valuation.yaml.
 * Used when no directory base URL is configured.
 */
@Slf4j
@RequiredArgsConstructor
public class ConfiguredCompanyDirectory implements CompanyDirectory {

    private final ValuationConfig config;

    @Override
    public CompanyIdentity getCompany(String companyId) {
        ValuationConfig.CompanyDirectory cfg = config.companyDirectory();
        ValuationConfig.Company company = cfg.getCompanies().get(companyId);
        if (company != null) {
            String currency = company.getCurrency() != null ? company.getCurrency() : cfg.getDefaultCurrency();
            return new CompanyIdentity(companyId, company.getName(), currency);
        }
        if (!cfg.isAllowUnknown()) {
            throw new CompanyNotFoundException(companyId);
        }
        log.debug("Company {} not in directory — using generic identity", companyId);
        return new CompanyIdentity(companyId, "Company " + companyId, cfg.getDefaultCurrency());
    }
}
