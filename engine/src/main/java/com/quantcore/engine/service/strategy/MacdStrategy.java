package com.quantcore.engine.service.strategy;

import com.quantcore.engine.config.StrategyProperties;
import com.quantcore.engine.model.Candle;
import com.quantcore.engine.model.CandleSeries;
import com.quantcore.engine.model.Signal;
import com.quantcore.engine.model.SignalAction;
import com.quantcore.engine.service.indicator.IndicatorService;
import com.quantcore.engine.service.indicator.MacdResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Trades the sign of the MACD histogram. Confidence is the histogram size
 * relative to 1% of price, kept in [0.5, 0.95] for actionable signals.
 */
@Slf4j
public class MacdStrategy implements TradingStrategy {

    public static final String NAME = "MACD";

    private final StrategyProperties.Macd config;
    private final IndicatorService indicatorService;

    public MacdStrategy(StrategyProperties.Macd config, IndicatorService indicatorService) {
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
                "fastPeriod", config.getFastPeriod(),
                "slowPeriod", config.getSlowPeriod(),
                "signalPeriod", config.getSignalPeriod(),
                "buyThreshold", config.getBuyThreshold(),
                "sellThreshold", config.getSellThreshold(),
                "minVolumeThreshold", config.getMinVolumeThreshold());
    }

    @Override
    public Signal analyze(Candle current, List<Candle> historical) {
        try {
            log.debug("Analyzing {} with MACD strategy", current.getSymbol());
            List<Candle> allData = CandleSeries.append(historical, current);
            MacdResult result = indicatorService.macd(current.getSymbol(), allData,
                    config.getFastPeriod(), config.getSlowPeriod(), config.getSignalPeriod());

            double price = current.getClose();
            double macd = result.macd();
            double signal = result.signal();
            double histogram = result.histogram();

            SignalAction action = SignalAction.HOLD;
            double confidence = 0.4;
            String reason;

            if (histogram > config.getBuyThreshold()) {
                action = SignalAction.BUY;
                confidence = strength(histogram, price);
                reason = String.format("MACD: %.4f > Signal: %.4f, Histogram: %.4f (BULLISH CROSSOVER)", macd, signal, histogram);
                log.info("BUY signal generated for {}: {}", current.getSymbol(), reason);
            } else if (histogram < config.getSellThreshold()) {
                action = SignalAction.SELL;
                confidence = strength(histogram, price);
                reason = String.format("MACD: %.4f < Signal: %.4f, Histogram: %.4f (BEARISH CROSSOVER)", macd, signal, histogram);
                log.info("SELL signal generated for {}: {}", current.getSymbol(), reason);
            } else {
                reason = String.format("MACD: %.4f, Signal: %.4f, Histogram: %.4f (NEUTRAL)", macd, signal, histogram);
                log.debug("HOLD signal for {}: No clear crossover", current.getSymbol());
            }

            if (current.getVolume() < config.getMinVolumeThreshold()) {
                confidence *= 0.7;
                reason += StrategySupport.lowVolumeNote(current.getVolume());
                log.debug("Confidence reduced due to low volume for {}", current.getSymbol());
            }

            return Signal.builder()
                    .symbol(current.getSymbol())
                    .strategy(NAME)
                    .timestamp(current.getTimestamp())
                    .action(action)
                    .confidence(confidence)
                    .reason(reason)
                    .entryPrice(price)
                    .stopLoss(StrategySupport.level(action, price, 0.97, 1.03))
                    .takeProfit(StrategySupport.level(action, price, 1.06, 0.94))
                    .build();
        } catch (Exception e) {
            log.error("Error analyzing {} with MACD strategy", current == null ? null : current.getSymbol(), e);
            return StrategySupport.failed(NAME, current, e);
        }
    }

    private double strength(double histogram, double price) {
        if (price <= 0) {
            return 0.5;
        }
        double confidence = Math.min(Math.abs(histogram) / (price * 0.01), 0.95);
        return Math.max(confidence, 0.5);
    }
}
