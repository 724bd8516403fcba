package com.quantcore.engine.service.indicator;

public record BollingerBandsResult(double upper, double middle, double lower) implements IndicatorResult {

    public double bandwidth() {
        return upper - lower;
    }
}
