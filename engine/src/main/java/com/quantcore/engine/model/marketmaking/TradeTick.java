package com.quantcore.engine.model.marketmaking;

import com.quantcore.engine.model.OrderSide;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A public trade print. {@code aggressor} is the side that crossed the spread.
 */
@Value
@Builder
public class TradeTick {
    String symbol;
    Instant timestamp;
    double price;
    double quantity;
    OrderSide aggressor;
}
