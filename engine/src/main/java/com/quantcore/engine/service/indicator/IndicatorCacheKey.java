package com.quantcore.engine.service.indicator;

import java.time.Instant;

public record IndicatorCacheKey(IndicatorType type, String symbol, IndicatorParams params, Instant bucket) {}
