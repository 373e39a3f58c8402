package com.jay.valuation.layer1_input;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.exception.InvalidInputException;
import com.jay.valuation.model.FinancialInputs;
import com.jay.valuation.model.RawFinancialData;
import com.jay.valuation.model.enums.BusinessModel;
import com.jay.valuation.model.enums.IndustryType;
import com.jay.valuation.model.enums.MarketPosition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Layer 1 — Input boundary.
 * Validates a loosely typed RawFinancialData record and fills absent fields from the
 * configured defaults. Revenue is mandatory. Every fabricated field is reported back as
 * a warning so the caller can see which figures were not supplied.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FinancialInputsNormalizer {

    private final ValuationConfig config;

    public record NormalizationResult(FinancialInputs inputs, List<String> warnings) {}

    public NormalizationResult normalize(RawFinancialData raw) {
        if (raw == null) {
            throw new InvalidInputException("financialData", "financial data is required");
        }
        ValuationConfig.Defaults d = config.defaults();
        List<String> warnings = new ArrayList<>();

        // ── Revenue (mandatory) ───────────────────────────────────────────────
        Double revenueValue = raw.getRevenue();
        if (revenueValue == null) {
            throw new InvalidInputException("revenue", "revenue is required");
        }
        requireFinite("revenue", revenueValue);
        if (revenueValue <= 0) {
            throw new InvalidInputException("revenue", "revenue must be positive, was " + revenueValue);
        }
        double revenue = revenueValue;

        double growth = valueOrDefault("revenueGrowthRate", raw.getRevenueGrowthRate(),
            d.getRevenueGrowthRate(), "revenueGrowthRate defaulted to %s%%", warnings);

        // ── Profitability: absolute and margin kept consistent ────────────────
        double[] gross = pairWithMargin("grossProfit", raw.getGrossProfit(),
            "grossMargin", raw.getGrossMargin(), revenue, d.getGrossMargin(), warnings);
        double[] ebitda = pairWithMargin("ebitda", raw.getEbitda(),
            "ebitdaMargin", raw.getEbitdaMargin(), revenue, d.getEbitdaMargin(), warnings);

        double netIncome = ratioOrDefault("netIncome", raw.getNetIncome(), revenue,
            d.getNetIncomePctOfRevenue(), warnings);
        double totalAssets = ratioOrDefault("totalAssets", raw.getTotalAssets(), revenue,
            d.getTotalAssetsPctOfRevenue(), warnings);
        double totalLiabilities = ratioOrDefault("totalLiabilities", raw.getTotalLiabilities(), revenue,
            d.getTotalLiabilitiesPctOfRevenue(), warnings);
        double equity = ratioOrDefault("shareholdersEquity", raw.getShareholdersEquity(), revenue,
            d.getShareholdersEquityPctOfRevenue(), warnings);
        double ocf = ratioOrDefault("operatingCashFlow", raw.getOperatingCashFlow(), revenue,
            d.getOperatingCashFlowPctOfRevenue(), warnings);
        double fcf = ratioOrDefault("freeCashFlow", raw.getFreeCashFlow(), revenue,
            d.getFreeCashFlowPctOfRevenue(), warnings);

        // ── Business profile ──────────────────────────────────────────────────
        IndustryType industry = parseLabel("industryType", raw.getIndustryType(), d.getIndustryType(),
            IndustryType::fromLabel, IndustryType.OTHER, warnings);
        BusinessModel model = parseLabel("businessModel", raw.getBusinessModel(), d.getBusinessModel(),
            BusinessModel::fromLabel, BusinessModel.OTHER, warnings);
        MarketPosition position = parseLabel("marketPosition", raw.getMarketPosition(), d.getMarketPosition(),
            MarketPosition::fromLabel, MarketPosition.STRONG_COMPETITOR, warnings);

        // ── Optional counts ───────────────────────────────────────────────────
        requireNonNegative("employeeCount", raw.getEmployeeCount());
        requireNonNegative("customersCount", raw.getCustomersCount());
        Double shares = raw.getSharesOutstanding();
        if (shares != null) {
            requireFinite("sharesOutstanding", shares);
            if (shares <= 0) {
                throw new InvalidInputException("sharesOutstanding", "must be positive when given, was " + shares);
            }
        }

        FinancialInputs inputs = FinancialInputs.builder()
            .revenue(revenue)
            .revenueGrowthRate(growth)
            .grossProfit(gross[0])
            .grossMargin(gross[1])
            .ebitda(ebitda[0])
            .ebitdaMargin(ebitda[1])
            .netIncome(netIncome)
            .totalAssets(totalAssets)
            .totalLiabilities(totalLiabilities)
            .shareholdersEquity(equity)
            .operatingCashFlow(ocf)
            .freeCashFlow(fcf)
            .industryType(industry)
            .businessModel(model)
            .marketPosition(position)
            .employeeCount(raw.getEmployeeCount())
            .customersCount(raw.getCustomersCount())
            .sharesOutstanding(shares)
            .build();

        warnings.forEach(w -> log.warn("Input defaulted: {}", w));
        return new NormalizationResult(inputs, List.copyOf(warnings));
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    /**
     * Returns {absolute, marginPct}. Whichever side is given drives the other;
     * when neither is given the configured default margin drives both.
     */
    private double[] pairWithMargin(String absField, Double abs, String marginField, Double margin,
                                    double revenue, double defaultMargin, List<String> warnings) {
        if (abs != null) requireFinite(absField, abs);
        if (margin != null) requireFinite(marginField, margin);

        if (abs != null && margin != null) return new double[]{abs, margin};
        if (abs != null) return new double[]{abs, abs / revenue * 100};
        if (margin != null) return new double[]{revenue * margin / 100, margin};

        warnings.add(String.format("%s and %s defaulted to %s%% of revenue",
            absField, marginField, fmt(defaultMargin)));
        return new double[]{revenue * defaultMargin / 100, defaultMargin};
    }

    private double ratioOrDefault(String field, Double value, double revenue, double pctOfRevenue,
                                  List<String> warnings) {
        if (value != null) {
            requireFinite(field, value);
            return value;
        }
        warnings.add(String.format("%s defaulted to %s%% of revenue", field, fmt(pctOfRevenue)));
        return revenue * pctOfRevenue / 100;
    }

    private double valueOrDefault(String field, Double value, double fallback, String message,
                                  List<String> warnings) {
        if (value != null) {
            requireFinite(field, value);
            return value;
        }
        warnings.add(String.format(message, fmt(fallback)));
        return fallback;
    }

    private <E extends Enum<E>> E parseLabel(String field, String value, String fallbackLabel,
                                             Function<String, Optional<E>> parser, E unknown,
                                             List<String> warnings) {
        if (value == null || value.isBlank()) {
            warnings.add(String.format("%s defaulted to %s", field, fallbackLabel));
            return parser.apply(fallbackLabel).orElse(unknown);
        }
        Optional<E> parsed = parser.apply(value);
        if (parsed.isEmpty()) {
            warnings.add(String.format("%s '%s' not recognised; treated as %s", field, value, unknown));
            return unknown;
        }
        return parsed.get();
    }

    private void requireFinite(String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidInputException(field, "must be a finite number, was " + value);
        }
    }

    private void requireNonNegative(String field, Integer value) {
        if (value != null && value < 0) {
            throw new InvalidInputException(field, "must not be negative, was " + value);
        }
    }

    private static String fmt(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }
}
