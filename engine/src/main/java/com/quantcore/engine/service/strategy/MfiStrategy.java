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

@Slf4j
public class MfiStrategy implements TradingStrategy {

    public static final String NAME = "MFI";

    private final StrategyProperties.Mfi config;
    private final IndicatorService indicatorService;

    public MfiStrategy(StrategyProperties.Mfi config, IndicatorService indicatorService) {
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
                "overboughtThreshold", config.getOverboughtThreshold(),
                "minVolumeThreshold", config.getMinVolumeThreshold());
    }

    @Override
    public Signal analyze(Candle current, List<Candle> historical) {
        try {
            log.debug("Analyzing {} with MFI strategy", current.getSymbol());
            List<Candle> allData = CandleSeries.append(historical, current);
            double mfi = indicatorService.mfi(current.getSymbol(), allData, config.getPeriod());
            double price = current.getClose();

            SignalAction action = SignalAction.HOLD;
            double confidence = 0.4;
            String reason;

            if (mfi < config.getOversoldThreshold()) {
                action = SignalAction.BUY;
                confidence = bounded((config.getOversoldThreshold() - mfi) / config.getOversoldThreshold());
                reason = String.format("MFI: %.1f (OVERSOLD - Money flowing out, potential reversal)", mfi);
                log.info("BUY signal generated for {}: {}", current.getSymbol(), reason);
            } else if (mfi > config.getOverboughtThreshold()) {
                action = SignalAction.SELL;
                confidence = bounded((mfi - config.getOverboughtThreshold()) / (100.0 - config.getOverboughtThreshold()));
                reason = String.format("MFI: %.1f (OVERBOUGHT - Heavy buying, potential reversal)", mfi);
                log.info("SELL signal generated for {}: {}", current.getSymbol(), reason);
            } else {
                reason = String.format("MFI: %.1f (NEUTRAL - Balanced money flow)", mfi);
                log.debug("HOLD signal for {}: MFI in neutral zone", current.getSymbol());
            }

            // MFI already weighs volume, so the absolute-volume penalty is lighter
            if (current.getVolume() < config.getMinVolumeThreshold()) {
                confidence *= 0.8;
                reason += StrategySupport.lowVolumeNote(current.getVolume());
                log.debug("Confidence slightly reduced due to low absolute volume for {}", current.getSymbol());
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
            log.error("Error analyzing {} with MFI strategy", current == null ? null : current.getSymbol(), e);
            return StrategySupport.failed(NAME, current, e);
        }
    }

    private static double bounded(double confidence) {
        return Math.max(Math.min(confidence, 0.9), 0.5);
    }
}
