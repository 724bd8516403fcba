package com.quantcore.engine.model;

import com.quantcore.engine.exception.InvalidParameterException;

import java.util.ArrayList;
import java.util.List;

public final class CandleSeries {

    private CandleSeries() {}

    /**
     * Checks that every bar is well formed, belongs to one symbol and that
     * timestamps strictly increase.
     */
    public static void requireStrictlyIncreasing(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return;
        }
        List<String> errors = new ArrayList<>();
        String symbol = candles.get(0).getSymbol();
        for (int i = 0; i < candles.size(); i++) {
            Candle candle = candles.get(i);
            for (String error : candle.validate()) {
                errors.add("bar " + i + ": " + error);
            }
            if (symbol != null && !symbol.equals(candle.getSymbol())) {
                errors.add("bar " + i + ": symbol " + candle.getSymbol() + " differs from " + symbol);
            }
            if (i > 0) {
                Candle prev = candles.get(i - 1);
                if (prev.getTimestamp() != null && candle.getTimestamp() != null
                        && !candle.getTimestamp().isAfter(prev.getTimestamp())) {
                    errors.add("bar " + i + ": timestamp " + candle.getTimestamp() + " is not after " + prev.getTimestamp());
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new InvalidParameterException(errors);
        }
    }

    /**
     * History followed by the current bar, the shape every indicator expects.
     */
    public static List<Candle> append(List<Candle> history, Candle current) {
        List<Candle> all = new ArrayList<>(history == null ? 0 : history.size() + 1);
        if (history != null) {
            all.addAll(history);
        }
        all.add(current);
        return all;
    }
}
