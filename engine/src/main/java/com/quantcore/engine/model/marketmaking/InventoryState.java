package com.quantcore.engine.model.marketmaking;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Market maker's holding in one symbol and the risk read-outs derived from it.
 */
@Value
@Builder(toBuilder = true)
public class InventoryState {
    String symbol;
    Instant timestamp;
    double currentInventory;
    @Builder.Default
    double targetInventory = 0.0;
    double maxInventory;
    Double currentPrice;
    Double averageEntryPrice;
    @Builder.Default
    double realizedPnL = 0.0;

    public double getInventoryPercent() {
        return maxInventory == 0 ? 0.0 : currentInventory / maxInventory;
    }

    public double getDistanceFromTarget() {
        return currentInventory - targetInventory;
    }

    public double getAbsoluteInventory() {
        return Math.abs(currentInventory);
    }

    public int getDirection() {
        return currentInventory > 0 ? 1 : (currentInventory < 0 ? -1 : 0);
    }

    public boolean isNearLimit() {
        return Math.abs(getInventoryPercent()) >= 0.9;
    }

    public boolean isAtLimit() {
        return Math.abs(currentInventory) >= maxInventory;
    }

    public boolean isNeutral() {
        return Math.abs(getInventoryPercent()) <= 0.05;
    }

    public double getAvailableCapacity() {
        return maxInventory - getAbsoluteInventory();
    }

    public Double getUnrealizedPnL() {
        if (currentPrice == null || averageEntryPrice == null) {
            return null;
        }
        return currentInventory * (currentPrice - averageEntryPrice);
    }

    public Double getTotalPnL() {
        Double unrealized = getUnrealizedPnL();
        return unrealized == null ? null : realizedPnL + unrealized;
    }

    /**
     * 0-100 score mixing limit utilisation (70%) with distance from target (30%).
     */
    public int getRiskLevel() {
        if (maxInventory == 0) {
            return 0;
        }
        double utilization = Math.abs(getInventoryPercent());
        double distancePct = Math.abs(getDistanceFromTarget() / maxInventory);
        double risk = (utilization * 0.7 + distancePct * 0.3) * 100.0;
        return (int) Math.min(100, Math.max(0, risk));
    }

    public String getRiskCategory() {
        int level = getRiskLevel();
        if (level < 30) {
            return "Low";
        }
        if (level < 60) {
            return "Medium";
        }
        if (level < 85) {
            return "High";
        }
        return "Critical";
    }

    public boolean canIncreaseLong(double quantity) {
        if (quantity <= 0) {
            return false;
        }
        return currentInventory + quantity <= maxInventory;
    }

    public boolean canIncreaseShort(double quantity) {
        if (quantity <= 0) {
            return false;
        }
        return Math.abs(currentInventory - quantity) <= maxInventory;
    }

    public boolean shouldReducePosition() {
        if (maxInventory == 0) {
            return false;
        }
        double utilization = Math.abs(getInventoryPercent());
        double targetDistance = Math.abs(getDistanceFromTarget() / maxInventory);
        return utilization > 0.7 || targetDistance > 0.5;
    }
}
