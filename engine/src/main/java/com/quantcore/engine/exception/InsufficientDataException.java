package com.quantcore.engine.exception;

import lombok.Getter;

/**
 * Raised when a caller hands an indicator less history than it needs.
 * This is a contract violation and is never replaced by a neutral default.
 */
@Getter
public class InsufficientDataException extends TradingException {

    private final String indicator;
    private final int required;
    private final int actual;

    public InsufficientDataException(String indicator, int required, int actual) {
        super(String.format("Insufficient data for %s: required %d bars, got %d", indicator, required, actual));
        this.indicator = indicator;
        this.required = required;
        this.actual = actual;
    }
}
