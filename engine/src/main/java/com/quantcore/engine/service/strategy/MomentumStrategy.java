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
 * Follows strong single-bar moves unless the market is too volatile, in
 * which case it always holds.
 */
@Slf4j
public class MomentumStrategy implements TradingStrategy {

    public static final String NAME = "Momentum";

    private final StrategyProperties.Momentum config;
    private final IndicatorService indicatorService;

    public MomentumStrategy(StrategyProperties.Momentum config, IndicatorService indicatorService) {
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
                "buyThreshold", config.getBuyThreshold(),
                "sellThreshold", config.getSellThreshold(),
                "volatilityFilter", config.getVolatilityFilter(),
                "volatilityPeriod", config.getVolatilityPeriod(),
                "minVolumeThreshold", config.getMinVolumeThreshold());
    }

    @Override
    public Signal analyze(Candle current, List<Candle> historical) {
        try {
            log.debug("Analyzing {} with Momentum strategy", current.getSymbol());
            double priceChange = current.changePercent();
            double price = current.getClose();
            double volume = current.getVolume();

            List<Candle> allData = CandleSeries.append(historical, current);
            double volatility = indicatorService.volatility(current.getSymbol(), allData, config.getVolatilityPeriod());

            SignalAction action = SignalAction.HOLD;
            double confidence = 0.3;
            String reason;

            if (volatility >= config.getVolatilityFilter()) {
                reason = String.format("Momentum: %+.2f%% change, High Volatility: %.4f (FILTERED)", priceChange, volatility);
                log.debug("Signal filtered due to high volatility for {}", current.getSymbol());
            } else if (priceChange > config.getBuyThreshold()) {
                action = SignalAction.BUY;
                confidence = Math.min(Math.abs(priceChange) / 5.0, 0.95);
                reason = String.format("Momentum: %+.2f%% change (STRONG UPWARD), Volatility: %.4f", priceChange, volatility);
                log.info("BUY signal generated for {}: {}", current.getSymbol(), reason);
            } else if (priceChange < config.getSellThreshold()) {
                action = SignalAction.SELL;
                confidence = Math.min(Math.abs(priceChange) / 5.0, 0.95);
                reason = String.format("Momentum: %+.2f%% change (STRONG DOWNWARD), Volatility: %.4f", priceChange, volatility);
                log.info("SELL signal generated for {}: {}", current.getSymbol(), reason);
            } else {
                reason = String.format("Momentum: %+.2f%% change", priceChange);
            }

            if (volume < config.getMinVolumeThreshold()) {
                confidence *= 0.7;
                reason += StrategySupport.lowVolumeNote(volume);
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
                    .stopLoss(StrategySupport.level(action, price, 0.98, 1.02))
                    .takeProfit(StrategySupport.level(action, price, 1.05, 0.95))
                    .build();
        } catch (Exception e) {
            log.error("Error analyzing {} with Momentum strategy", current == null ? null : current.getSymbol(), e);
            return StrategySupport.failed(NAME, current, e);
        }
    }
}
