package com.quantcore.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Open position as tracked by the ledger. PnL and exit flags are derived on
 * every read from the current fields.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {
    private String positionId;
    private String symbol;
    private String exchange;
    private OrderSide side;
    private double quantity;
    private double entryPrice;
    private double currentPrice;
    private Double stopLoss;
    private Double takeProfit;
    private Instant openedAt;
    private Instant updatedAt;
    private String strategyId;
    private String openOrderId;

    public double getUnrealizedPnL() {
        if (side == OrderSide.BUY) {
            return (currentPrice - entryPrice) * quantity;
        }
        return (entryPrice - currentPrice) * quantity;
    }

    public double getUnrealizedPnLPercent() {
        double entryValue = getEntryValue();
        if (entryPrice == 0 || entryValue == 0) {
            return 0.0;
        }
        return getUnrealizedPnL() / entryValue * 100.0;
    }

    public double getEntryValue() {
        return quantity * entryPrice;
    }

    public double getCurrentValue() {
        return quantity * currentPrice;
    }

    public boolean isStopLossHit() {
        if (stopLoss == null) {
            return false;
        }
        return side == OrderSide.BUY ? currentPrice <= stopLoss : currentPrice >= stopLoss;
    }

    public boolean isTakeProfitHit() {
        if (takeProfit == null) {
            return false;
        }
        return side == OrderSide.BUY ? currentPrice >= takeProfit : currentPrice <= takeProfit;
    }

    public boolean isClosed() {
        return quantity <= 0;
    }

    public void markPrice(double price, Instant at) {
        this.currentPrice = price;
        this.updatedAt = at;
    }

    /**
     * Applies a partial fill. Same-side fills scale in at a volume-weighted entry,
     * opposite-side fills reduce the quantity. Returns the realized PnL of the
     * reduced part (zero when scaling in).
     */
    public double applyFill(OrderSide fillSide, double fillQuantity, double fillPrice, Instant at) {
        double realized = 0.0;
        if (fillSide == side) {
            double newQuantity = quantity + fillQuantity;
            entryPrice = ((entryPrice * quantity) + (fillPrice * fillQuantity)) / newQuantity;
            quantity = newQuantity;
        } else {
            double reduced = Math.min(quantity, fillQuantity);
            realized = side == OrderSide.BUY
                    ? (fillPrice - entryPrice) * reduced
                    : (entryPrice - fillPrice) * reduced;
            quantity = quantity - reduced;
        }
        currentPrice = fillPrice;
        updatedAt = at;
        return realized;
    }
}
