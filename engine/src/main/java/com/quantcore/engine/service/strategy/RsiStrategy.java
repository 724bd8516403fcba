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
 * Mean reversion on RSI: buy below the oversold line, sell above the
 * overbought line, confidence growing with the distance past the line.
 */
@Slf4j
public class RsiStrategy implements TradingStrategy {

    public static final String NAME = "RSI";

    private final StrategyProperties.Rsi config;
    private final IndicatorService indicatorService;

    public RsiStrategy(StrategyProperties.Rsi config, IndicatorService indicatorService) {
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
                "oversoldThreshold", config.getOversoldThreshold(),
                "overboughtThreshold", config.getOverboughtThreshold());
    }

    @Override
    public Signal analyze(Candle current, List<Candle> historical) {
        try {
            log.debug("Analyzing {} with RSI strategy", current.getSymbol());
            List<Candle> allData = CandleSeries.append(historical, current);
            double rsi = indicatorService.rsi(current.getSymbol(), allData, config.getPeriod());
            double price = current.getClose();

            SignalAction action = SignalAction.HOLD;
            double confidence = 0.4;
            String reason;

            if (rsi < config.getOversoldThreshold()) {
                action = SignalAction.BUY;
                confidence = Math.min((config.getOversoldThreshold() - rsi) / config.getOversoldThreshold(), 0.9);
                reason = String.format("RSI: %.1f (OVERSOLD)", rsi);
                log.info("BUY signal generated for {}: {}", current.getSymbol(), reason);
            } else if (rsi > config.getOverboughtThreshold()) {
                action = SignalAction.SELL;
                confidence = Math.min((rsi - config.getOverboughtThreshold()) / (100.0 - config.getOverboughtThreshold()), 0.9);
                reason = String.format("RSI: %.1f (OVERBOUGHT)", rsi);
                log.info("SELL signal generated for {}: {}", current.getSymbol(), reason);
            } else {
                reason = String.format("RSI: %.1f (NEUTRAL)", rsi);
                log.debug("HOLD signal for {}: RSI in neutral zone", current.getSymbol());
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
            log.error("Error analyzing {} with RSI strategy", current == null ? null : current.getSymbol(), e);
            return StrategySupport.failed(NAME, current, e);
        }
    }
}
