package com.jay.valuation.layer2_methods;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.exception.MethodUnavailableException;
import com.jay.valuation.model.AssetAdjustment;
import com.jay.valuation.model.FinancialInputs;
import com.jay.valuation.model.ValueRange;
import com.jay.valuation.model.enums.ValuationMethod;
import com.jay.valuation.model.methods.AssetBasedMethodResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Layer 2 — Asset-Based.
 * Adjusted book value = equity + markup on the intangible share of total assets.
 */
@Component
@RequiredArgsConstructor
public class AssetBasedCalculator implements MethodCalculator {

    private final ValuationConfig config;

    @Override
    public ValuationMethod method() {
        return ValuationMethod.ASSET_BASED;
    }

    @Override
    public AssetBasedMethodResult calculate(FinancialInputs inputs) throws MethodUnavailableException {
        ValuationConfig.AssetBased cfg = config.assetBased();
        double tangible = inputs.getTotalAssets() * cfg.getTangibleShare();
        double intangible = inputs.getTotalAssets() - tangible;
        double markup = intangible * cfg.getIntangibleMarkupPct() / 100;

        List<AssetAdjustment> assetAdjustments = List.of(new AssetAdjustment(
            "Technology Assets", intangible, intangible + markup, markup,
            "Technology assets may be undervalued on balance sheet"));

        double adjustedBookValue = inputs.getShareholdersEquity()
            + assetAdjustments.stream().mapToDouble(AssetAdjustment::adjustment).sum();
        if (adjustedBookValue <= 0) {
            throw new MethodUnavailableException(method(), String.format(
                "adjusted book value %.0f is not positive", adjustedBookValue));
        }

        return AssetBasedMethodResult.builder()
            .method(method())
            .tangibleAssets(tangible)
            .intangibleAssets(intangible)
            .assetAdjustments(assetAdjustments)
            .adjustedBookValue(adjustedBookValue)
            .valuationRange(ValueRange.around(adjustedBookValue, cfg.getRangeLowFactor(), cfg.getRangeHighFactor()))
            .confidence(cfg.getConfidence())
            .weight(cfg.weightFor(inputs.getIndustryType()))
            .build();
    }
}
