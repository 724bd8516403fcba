package com.quantcore.engine.service.indicator;

public record MacdResult(double macd, double signal, double histogram) implements IndicatorResult {

    public boolean isBullish() {
        return histogram > 0;
    }
}
