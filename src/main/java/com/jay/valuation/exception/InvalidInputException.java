package com.jay.valuation.exception;

import lombok.Getter;

/** Raised at the input boundary when a financial record cannot be valued. */
@Getter
public class InvalidInputException extends RuntimeException {

    private final String field;

    public InvalidInputException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }
}
