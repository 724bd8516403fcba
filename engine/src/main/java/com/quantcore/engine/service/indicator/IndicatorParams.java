package com.quantcore.engine.service.indicator;

import com.quantcore.engine.exception.InvalidParameterException;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Named numeric indicator parameters. Stored sorted so that two parameter
 * sets with the same entries produce the same cache key.
 */
public record IndicatorParams(Map<String, Double> values) {

    public static final String PERIOD = "period";
    public static final String FAST_PERIOD = "fastPeriod";
    public static final String SLOW_PERIOD = "slowPeriod";
    public static final String SIGNAL_PERIOD = "signalPeriod";
    public static final String SMOOTH_K = "smoothK";
    public static final String SMOOTH_D = "smoothD";
    public static final String STD_DEV_MULTIPLIER = "stdDevMultiplier";

    public IndicatorParams {
        values = Collections.unmodifiableMap(new TreeMap<>(values == null ? Map.of() : values));
    }

    public static IndicatorParams period(int period) {
        return new IndicatorParams(Map.of(PERIOD, (double) period));
    }

    public static IndicatorParams of(String name, double value) {
        return new IndicatorParams(Map.of(name, value));
    }

    public IndicatorParams with(String name, double value) {
        Map<String, Double> copy = new TreeMap<>(values);
        copy.put(name, value);
        return new IndicatorParams(copy);
    }

    /**
     * Missing entries are taken from the indicator's defaults.
     */
    public IndicatorParams withDefaults(IndicatorType type) {
        Map<String, Double> merged = new TreeMap<>(type.defaultParams().values());
        merged.putAll(values);
        return new IndicatorParams(merged);
    }

    public int getInt(String name) {
        Double value = values.get(name);
        if (value == null) {
            throw new InvalidParameterException("Missing indicator parameter: " + name);
        }
        if (value != Math.rint(value)) {
            throw new InvalidParameterException("Parameter " + name + " must be a whole number (got " + value + ")");
        }
        return value.intValue();
    }

    public double getDouble(String name) {
        Double value = values.get(name);
        if (value == null) {
            throw new InvalidParameterException("Missing indicator parameter: " + name);
        }
        return value;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
