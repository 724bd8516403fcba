package com.quantcore.engine.service.strategy;

import com.quantcore.engine.model.Candle;
import com.quantcore.engine.model.Signal;

import java.util.List;
import java.util.Map;

/**
 * A signal generator evaluated once per bar. Implementations keep no state
 * between calls and never throw: any failure comes back as a zero-confidence
 * Hold whose reason starts with "Error".
 */
public interface TradingStrategy {

    String name();

    /**
     * Effective configuration, keyed by option name.
     */
    Map<String, Object> config();

    /**
     * @param current    the bar being decided on
     * @param historical earlier bars, oldest first, not including {@code current}
     */
    Signal analyze(Candle current, List<Candle> historical);
}
