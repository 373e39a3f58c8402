package com.jay.valuation.exception;

public class CompanyNotFoundException extends RuntimeException {

    public CompanyNotFoundException(String companyId) {
        super("Unknown company: " + companyId);
    }
}
