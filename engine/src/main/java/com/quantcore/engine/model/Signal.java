package com.quantcore.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Decision produced by one strategy evaluation. Never persisted by the engine.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Signal {
    String symbol;
    String strategy;
    Instant timestamp;
    SignalAction action;
    double confidence;
    String reason;
    double entryPrice;
    Double stopLoss;
    Double takeProfit;

    /**
     * Degraded result for a strategy whose analysis failed: Hold with zero confidence.
     */
    public static Signal error(String symbol, String strategy, Instant timestamp, Throwable cause) {
        return Signal.builder()
                .symbol(symbol)
                .strategy(strategy)
                .timestamp(timestamp == null ? Instant.now() : timestamp)
                .action(SignalAction.HOLD)
                .confidence(0.0)
                .reason("Error: " + cause.getMessage())
                .build();
    }

    @JsonIgnore
    public boolean isActionable() {
        return action != SignalAction.HOLD;
    }
}
