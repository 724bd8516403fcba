package com.quantcore.engine.model.marketmaking;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OrderBookLevel {
    double price;
    double quantity;
    Integer orderCount;

    public static OrderBookLevel of(double price, double quantity) {
        return new OrderBookLevel(price, quantity, null);
    }

    public double notional() {
        return price * quantity;
    }
}
