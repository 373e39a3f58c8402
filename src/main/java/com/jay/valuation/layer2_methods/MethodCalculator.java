package com.jay.valuation.layer2_methods;

import com.jay.valuation.exception.MethodUnavailableException;
import com.jay.valuation.model.FinancialInputs;
import com.jay.valuation.model.ValuationAdjustment;
import com.jay.valuation.model.enums.ValuationMethod;
import com.jay.valuation.model.methods.MethodResult;

import java.util.List;

/**
 * One valuation methodology. Implementations hold no per-request state, so the
 * orchestrator may run all of them concurrently against the same inputs.
 */
public interface MethodCalculator {

    ValuationMethod method();

    /**
     * @throws MethodUnavailableException when the inputs put this method in a degenerate
     *         case it cannot value meaningfully
     */
    MethodResult calculate(FinancialInputs inputs) throws MethodUnavailableException;

    /** 1 + Σ(adjustment %) / 100 */
    static double adjustmentMultiplier(List<ValuationAdjustment> adjustments) {
        double total = adjustments.stream().mapToDouble(ValuationAdjustment::adjustment).sum();
        return 1 + total / 100;
    }
}
