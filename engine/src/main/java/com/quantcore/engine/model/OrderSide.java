package com.quantcore.engine.model;

/**
 * BUY means a long position or a bid-side fill, SELL a short position or an ask-side fill.
 */
public enum OrderSide {
    BUY,
    SELL;

    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
