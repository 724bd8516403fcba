package com.quantcore.engine.service.indicator;

/**
 * Marker for everything {@link IndicatorService#compute} can return.
 */
public interface IndicatorResult {
}
