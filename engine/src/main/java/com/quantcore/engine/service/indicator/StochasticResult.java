package com.quantcore.engine.service.indicator;

public record StochasticResult(double percentK, double percentD) implements IndicatorResult {}
