package com.jay.valuation.model.methods;

import com.jay.valuation.model.AssetAdjustment;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.util.List;

@Getter
@SuperBuilder
public class AssetBasedMethodResult extends MethodResult {
    private final double tangibleAssets;
    private final double intangibleAssets;
    private final List<AssetAdjustment> assetAdjustments;
    private final double adjustedBookValue;
}
