package com.quantcore.engine.exception;

public class InvalidMarketStateException extends TradingException {
    public InvalidMarketStateException(String message) {
        super(message);
    }
}
