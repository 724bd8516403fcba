package com.quantcore.engine.service.strategy;

import com.quantcore.engine.config.StrategyProperties;
import com.quantcore.engine.model.Candle;
import com.quantcore.engine.model.CandleSeries;
import com.quantcore.engine.model.Signal;
import com.quantcore.engine.model.SignalAction;
import com.quantcore.engine.service.indicator.IndicatorService;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Mean reversion toward VWAP: buys at a discount, sells at a premium and
 * targets the VWAP itself for the exit.
 */
@Slf4j
public class VwapStrategy implements TradingStrategy {

    public static final String NAME = "VWAP";

    private final StrategyProperties.Vwap config;
    private final IndicatorService indicatorService;

    public VwapStrategy(StrategyProperties.Vwap config, IndicatorService indicatorService) {
        this.config = config;
        this.indicatorService = indicatorService;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> config() {
        return Map.of(
                "period", config.getPeriod(),
                "buyDeviationThreshold", config.getBuyDeviationThreshold(),
                "sellDeviationThreshold", config.getSellDeviationThreshold(),
                "useVolumeConfirmation", config.isUseVolumeConfirmation());
    }

    @Override
    public Signal analyze(Candle current, List<Candle> historical) {
        try {
            log.debug("Analyzing {} with VWAP strategy", current.getSymbol());
            List<Candle> allData = CandleSeries.append(historical, current);
            double vwap = indicatorService.vwap(current.getSymbol(), allData, config.getPeriod());
            double price = current.getClose();
            double deviationPercent = vwap == 0 ? 0.0 : (price - vwap) / vwap * 100.0;

            SignalAction action = SignalAction.HOLD;
            double confidence = 0.4;
            String reason;

            if (deviationPercent < config.getBuyDeviationThreshold()) {
                action = SignalAction.BUY;
                confidence = strength(deviationPercent, config.getBuyDeviationThreshold());
                reason = String.format("Price: %.2f < VWAP: %.2f (Deviation: %+.2f%%, DISCOUNT)", price, vwap, deviationPercent);
                log.info("BUY signal generated for {}: {}", current.getSymbol(), reason);
            } else if (deviationPercent > config.getSellDeviationThreshold()) {
                action = SignalAction.SELL;
                confidence = strength(deviationPercent, config.getSellDeviationThreshold());
                reason = String.format("Price: %.2f > VWAP: %.2f (Deviation: %+.2f%%, PREMIUM)", price, vwap, deviationPercent);
                log.info("SELL signal generated for {}: {}", current.getSymbol(), reason);
            } else {
                reason = String.format("Price: %.2f near VWAP: %.2f (Deviation: %+.2f%%, FAIR VALUE)", price, vwap, deviationPercent);
                log.debug("HOLD signal for {}: Price near VWAP", current.getSymbol());
            }

            if (config.isUseVolumeConfirmation()) {
                int window = Math.min(config.getPeriod(), allData.size());
                double avgVolume = allData.subList(allData.size() - window, allData.size()).stream()
                        .mapToDouble(Candle::getVolume)
                        .average()
                        .orElse(0.0);
                if (current.getVolume() > avgVolume * 1.2) {
                    confidence = Math.min(confidence * 1.1, 0.95);
                    reason += " [High Volume Confirmation]";
                } else if (current.getVolume() < avgVolume * 0.5) {
                    confidence *= 0.8;
                    reason += StrategySupport.lowVolumeNote(current.getVolume());
                }
            }

            Double stopLoss = StrategySupport.level(action, price, 0.97, 1.03);
            Double takeProfit = StrategySupport.level(action, vwap, 1.005, 0.995);
            return Signal.builder()
                    .symbol(current.getSymbol())
                    .strategy(NAME)
                    .timestamp(current.getTimestamp())
                    .action(action)
                    .confidence(confidence)
                    .reason(reason)
                    .entryPrice(price)
                    .stopLoss(stopLoss)
                    .takeProfit(takeProfit)
                    .build();
        } catch (Exception e) {
            log.error("Error analyzing {} with VWAP strategy", current == null ? null : current.getSymbol(), e);
            return StrategySupport.failed(NAME, current, e);
        }
    }

    private static double strength(double deviationPercent, double threshold) {
        double confidence = Math.min(Math.abs(deviationPercent) / Math.abs(threshold) * 0.6, 0.9);
        return Math.max(confidence, 0.5);
    }
}
