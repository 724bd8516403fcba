package com.quantcore.engine.exception;

public class PositionNotFoundException extends TradingException {
    public PositionNotFoundException(String positionId) {
        super("Position not found: " + positionId);
    }
}
