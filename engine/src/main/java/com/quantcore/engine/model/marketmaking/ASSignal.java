package com.quantcore.engine.model.marketmaking;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A two-sided quote produced by the market-making engine. Invalid quotes carry
 * zeroed prices and sizes, confidence 0 and the reason they were rejected.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ASSignal {

    /** Rounding slack when comparing a quote's spread with its band. */
    private static final double SPREAD_TOLERANCE_BPS = 1e-6;

    String symbol;
    Instant timestamp;
    double bidPrice;
    double askPrice;
    double bidQuantity;
    double askQuantity;
    Double reservationPrice;
    Double optimalSpread;
    Double currentInventory;
    @Builder.Default
    double confidence = 1.0;
    @Builder.Default
    @JsonProperty("valid")
    boolean valid = true;
    String invalidReason;

    /**
     * Invalid quote stamped with the wall clock, for rejections that have no
     * market timestamp to carry.
     */
    public static ASSignal invalid(String symbol, String reason) {
        return invalid(symbol, Instant.now(), reason);
    }

    public static ASSignal invalid(String symbol, Instant timestamp, String reason) {
        return ASSignal.builder()
                .symbol(symbol)
                .timestamp(timestamp)
                .bidPrice(0)
                .askPrice(0)
                .bidQuantity(0)
                .askQuantity(0)
                .confidence(0.0)
                .valid(false)
                .invalidReason(reason)
                .build();
    }

    public double getSpread() {
        return askPrice - bidPrice;
    }

    public double getMidPrice() {
        return (bidPrice + askPrice) / 2.0;
    }

    public double getSpreadPercent() {
        double mid = getMidPrice();
        return mid == 0 ? 0.0 : getSpread() / mid;
    }

    public double getSpreadBps() {
        return getSpreadPercent() * 10_000.0;
    }

    public double getTotalNotional() {
        return bidQuantity * bidPrice + askQuantity * askPrice;
    }

    /**
     * True only for a valid, uncrossed, fully sized quote whose spread lies in
     * [minSpreadBps, maxSpreadBps].
     */
    public boolean validateForExecution(double minSpreadBps, double maxSpreadBps) {
        if (!valid) {
            return false;
        }
        if (bidPrice <= 0 || askPrice <= 0) {
            return false;
        }
        if (bidQuantity <= 0 || askQuantity <= 0) {
            return false;
        }
        if (bidPrice >= askPrice) {
            return false;
        }
        double spreadBps = getSpreadBps();
        return spreadBps >= minSpreadBps - SPREAD_TOLERANCE_BPS && spreadBps <= maxSpreadBps + SPREAD_TOLERANCE_BPS;
    }

    public boolean validateForExecution() {
        return validateForExecution(1.0, 1000.0);
    }

    @Override
    public String toString() {
        if (!valid) {
            return "ASSignal[" + symbol + "]: INVALID - " + invalidReason;
        }
        return String.format("ASSignal[%s]: Bid=%.2f@%.4f, Ask=%.2f@%.4f, Spread=%.1fbps, Conf=%.0f%%",
                symbol, bidPrice, bidQuantity, askPrice, askQuantity, getSpreadBps(), confidence * 100.0);
    }
}
