package com.quantcore.engine.model;

public enum SignalAction {
    BUY,
    SELL,
    HOLD
}
