package com.quantcore.engine.service.strategy;

import com.quantcore.engine.config.IndicatorProperties;
import com.quantcore.engine.config.StrategyProperties;
import com.quantcore.engine.exception.InsufficientDataException;
import com.quantcore.engine.model.Candle;
import com.quantcore.engine.model.Signal;
import com.quantcore.engine.model.SignalAction;
import com.quantcore.engine.service.indicator.IndicatorCache;
import com.quantcore.engine.service.indicator.IndicatorEngine;
import com.quantcore.engine.service.indicator.IndicatorService;
import com.quantcore.engine.util.TestCandleFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RsiStrategyTest {

    private final IndicatorService indicatorService = mock(IndicatorService.class);
    private final RsiStrategy strategy = new RsiStrategy(new StrategyProperties.Rsi(), indicatorService);
    private final List<Candle> history = TestCandleFactory.flatCandles(30, 100, 1000);
    private final Candle current = TestCandleFactory.candle(30, 100, 101, 99, 100, 1000);

    @Test
    void oversoldBuys() {
        when(indicatorService.rsi(anyString(), anyList(), anyInt())).thenReturn(20.0);

        Signal signal = strategy.analyze(current, history);

        assertThat(signal.getAction()).isEqualTo(SignalAction.BUY);
        assertThat(signal.getConfidence()).isCloseTo(10.0 / 30.0, within(1e-9));
        assertThat(signal.getReason()).contains("OVERSOLD");
        assertThat(signal.getStopLoss()).isEqualTo(100 * 0.97);
        assertThat(signal.getTakeProfit()).isEqualTo(100 * 1.06);
        assertThat(signal.getTimestamp()).isEqualTo(current.getTimestamp());
        assertThat(signal.getStrategy()).isEqualTo("RSI");
    }

    @Test
    void deeplyOversoldConfidenceIsCapped() {
        when(indicatorService.rsi(anyString(), anyList(), anyInt())).thenReturn(0.0);

        assertThat(strategy.analyze(current, history).getConfidence()).isEqualTo(0.9);
    }

    @Test
    void overboughtSells() {
        when(indicatorService.rsi(anyString(), anyList(), anyInt())).thenReturn(85.0);

        Signal signal = strategy.analyze(current, history);

        assertThat(signal.getAction()).isEqualTo(SignalAction.SELL);
        assertThat(signal.getConfidence()).isCloseTo(0.5, within(1e-9));
        assertThat(signal.getReason()).contains("OVERBOUGHT");
        assertThat(signal.getStopLoss()).isEqualTo(100 * 1.03);
        assertThat(signal.getTakeProfit()).isEqualTo(100 * 0.94);
    }

    @Test
    void neutralHolds() {
        when(indicatorService.rsi(anyString(), anyList(), anyInt())).thenReturn(50.0);

        Signal signal = strategy.analyze(current, history);

        assertThat(signal.getAction()).isEqualTo(SignalAction.HOLD);
        assertThat(signal.getConfidence()).isEqualTo(0.4);
        assertThat(signal.getReason()).contains("NEUTRAL");
        assertThat(signal.getStopLoss()).isNull();
        assertThat(signal.getTakeProfit()).isNull();
    }

    @Test
    void shortHistoryDegradesToErrorHold() {
        when(indicatorService.rsi(anyString(), anyList(), anyInt()))
                .thenThrow(new InsufficientDataException("RSI", 15, 3));

        Signal signal = strategy.analyze(current, history.subList(0, 2));

        assertThat(signal.getAction()).isEqualTo(SignalAction.HOLD);
        assertThat(signal.getConfidence()).isZero();
        assertThat(signal.getReason()).startsWith("Error");
    }

    @Test
    void nullBarDegradesToErrorHold() {
        Signal signal = strategy.analyze(null, history);

        assertThat(signal.getAction()).isEqualTo(SignalAction.HOLD);
        assertThat(signal.getReason()).startsWith("Error");
    }

    @Test
    void identicalInputsGiveIdenticalSignals() {
        IndicatorService real = new IndicatorService(new IndicatorEngine(),
                new IndicatorCache(Duration.ofSeconds(60), new SimpleMeterRegistry(), Clock.systemUTC()),
                new IndicatorProperties());
        RsiStrategy rsi = new RsiStrategy(new StrategyProperties.Rsi(), real);
        List<Candle> candles = TestCandleFactory.oscillatingCandles(40, 100, 5);
        Candle last = candles.get(39);

        Signal first = rsi.analyze(last, candles.subList(0, 39));
        Signal second = rsi.analyze(last, candles.subList(0, 39));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void exposesConfiguration() {
        assertThat(strategy.config())
                .containsEntry("period", 14)
                .containsEntry("oversoldThreshold", 30.0)
                .containsEntry("overboughtThreshold", 70.0);
    }
}
