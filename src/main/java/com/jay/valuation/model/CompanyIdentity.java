package com.jay.valuation.model;

public record CompanyIdentity(String id, String name, String currency) {}
