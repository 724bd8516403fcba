package com.quantcore.engine.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class InvalidParameterException extends TradingException {

    private final List<String> violations;

    public InvalidParameterException(List<String> violations) {
        super("Invalid parameters: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public InvalidParameterException(String violation) {
        this(List.of(violation));
    }
}
