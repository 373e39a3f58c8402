package com.jay.valuation.model;

/** Comparable peer as shown on the final report, tagged with the subject's industry. */
public record MarketComparable(
    String companyName,
    String industry,
    double marketCap,
    double revenue,
    double ebitda,
    double revenueMultiple,
    double ebitdaMultiple,
    double similarity
) {

    public static MarketComparable of(PublicComparable c, String industry) {
        return new MarketComparable(c.getCompanyName(), industry, c.getMarketCap(), c.getRevenue(),
            c.getEbitda(), c.getRevenueMultiple(), c.getEbitdaMultiple(), c.getSimilarity());
    }
}
