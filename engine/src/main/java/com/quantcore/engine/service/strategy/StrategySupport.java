package com.quantcore.engine.service.strategy;

import com.quantcore.engine.model.Candle;
import com.quantcore.engine.model.Signal;
import com.quantcore.engine.model.SignalAction;

import java.time.Instant;

final class StrategySupport {

    private StrategySupport() {}

    /**
     * Price multiplier for the given side, null for Hold.
     */
    static Double level(SignalAction action, double price, double longMultiplier, double shortMultiplier) {
        return switch (action) {
            case BUY -> price * longMultiplier;
            case SELL -> price * shortMultiplier;
            case HOLD -> null;
        };
    }

    static String lowVolumeNote(double volume) {
        return String.format(" [Low Volume: %,.0f]", volume);
    }

    static Signal failed(String strategy, Candle current, Exception e) {
        String symbol = current == null ? null : current.getSymbol();
        Instant timestamp = current == null ? null : current.getTimestamp();
        return Signal.error(symbol, strategy, timestamp, e);
    }
}
