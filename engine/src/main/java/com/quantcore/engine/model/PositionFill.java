package com.quantcore.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Execution report that opens a position in the ledger.
 */
@Value
@Builder
public class PositionFill {
    String symbol;
    String exchange;
    OrderSide side;
    double quantity;
    double price;
    Instant timestamp;
    Double stopLoss;
    Double takeProfit;
    String strategyId;
    String orderId;
}
