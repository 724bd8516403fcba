package com.quantcore.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One OHLCV bar for a symbol. Produced by ingestion and never mutated afterwards.
 */
@Value
@Builder(toBuilder = true)
public class Candle {
    String symbol;
    Instant timestamp;
    double open;
    double high;
    double low;
    double close;
    double volume;

    /**
     * Percent move from open to close, in percent units (2.0 means +2%).
     */
    public double changePercent() {
        if (open == 0) {
            return 0.0;
        }
        return (close - open) / open * 100.0;
    }

    public double typicalPrice() {
        return (high + low + close) / 3.0;
    }

    /**
     * Returns every broken OHLCV invariant, empty when the bar is well formed.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (symbol == null || symbol.isBlank()) {
            errors.add("symbol is required");
        }
        if (timestamp == null) {
            errors.add("timestamp is required");
        }
        if (high < Math.max(open, close)) {
            errors.add(String.format("high %.8f is below max(open, close)", high));
        }
        if (low > Math.min(open, close)) {
            errors.add(String.format("low %.8f is above min(open, close)", low));
        }
        if (volume < 0) {
            errors.add(String.format("volume must be non-negative (got %.4f)", volume));
        }
        return errors;
    }

    public boolean isValid() {
        return validate().isEmpty();
    }
}
