package com.quantcore.engine.service.indicator;

public record AdxResult(double adx, double plusDI, double minusDI) implements IndicatorResult {

    public boolean isStrongTrend(double threshold) {
        return adx >= threshold;
    }
}
