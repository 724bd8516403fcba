package com.quantcore.engine.service.indicator;

import java.util.Map;

/**
 * Indicators the engine can compute, with the parameters each one accepts and their defaults.
 */
public enum IndicatorType {
    RSI("rsi", Map.of(IndicatorParams.PERIOD, 14.0)),
    MACD("macd", Map.of(IndicatorParams.FAST_PERIOD, 12.0, IndicatorParams.SLOW_PERIOD, 26.0,
            IndicatorParams.SIGNAL_PERIOD, 9.0)),
    EMA("ema", Map.of(IndicatorParams.PERIOD, 20.0)),
    SMA("sma", Map.of(IndicatorParams.PERIOD, 20.0)),
    VOLATILITY("volatility", Map.of(IndicatorParams.PERIOD, 20.0)),
    MFI("mfi", Map.of(IndicatorParams.PERIOD, 14.0)),
    VWAP("vwap", Map.of(IndicatorParams.PERIOD, 20.0)),
    STOCHASTIC("stochastic", Map.of(IndicatorParams.PERIOD, 14.0, IndicatorParams.SMOOTH_K, 3.0,
            IndicatorParams.SMOOTH_D, 3.0)),
    ADX("adx", Map.of(IndicatorParams.PERIOD, 14.0)),
    ATR("atr", Map.of(IndicatorParams.PERIOD, 14.0)),
    BOLLINGER_BANDS("bollinger", Map.of(IndicatorParams.PERIOD, 20.0, IndicatorParams.STD_DEV_MULTIPLIER, 2.0)),
    WILLIAMS_R("williams_r", Map.of(IndicatorParams.PERIOD, 14.0)),
    CCI("cci", Map.of(IndicatorParams.PERIOD, 20.0)),
    OBV("obv", Map.of());

    private final String key;
    private final Map<String, Double> defaults;

    IndicatorType(String key, Map<String, Double> defaults) {
        this.key = key;
        this.defaults = defaults;
    }

    public String key() {
        return key;
    }

    public IndicatorParams defaultParams() {
        return new IndicatorParams(defaults);
    }
}
