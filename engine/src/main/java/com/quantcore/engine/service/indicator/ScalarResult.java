package com.quantcore.engine.service.indicator;

public record ScalarResult(double value) implements IndicatorResult {}
