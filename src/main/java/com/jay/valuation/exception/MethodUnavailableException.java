package com.jay.valuation.exception;

import com.jay.valuation.model.enums.ValuationMethod;
import lombok.Getter;

/**
 * A method detected a degenerate numeric case and cannot produce a meaningful range.
 * The orchestrator excludes the method and renormalises the remaining weights.
 */
@Getter
public class MethodUnavailableException extends Exception {

    private final ValuationMethod method;

    public MethodUnavailableException(ValuationMethod method, String reason) {
        super(reason);
        this.method = method;
    }
}
