package com.quantcore.engine.service.indicator;

import com.quantcore.engine.exception.InsufficientDataException;
import com.quantcore.engine.exception.InvalidParameterException;
import com.quantcore.engine.model.Candle;
import com.quantcore.engine.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IndicatorEngineTest {

    private final IndicatorEngine engine = new IndicatorEngine();

    @Test
    void calculatesEmaWithSmaSeed() {
        List<Candle> candles = TestCandleFactory.fromCloses(10, 11, 12, 13, 14);

        assertThat(engine.calculateEMA(candles, 3)).isCloseTo(13.0, within(1e-9));
        assertThat(engine.calculateSMA(candles, 3)).isCloseTo(13.0, within(1e-9));
    }

    @Test
    void rsiIsHundredWithoutLosses() {
        List<Candle> candles = TestCandleFactory.fromCloses(10, 11, 12, 13, 14, 15, 16);

        assertThat(engine.calculateRSI(candles, 5)).isEqualTo(100.0);
    }

    @Test
    void rsiCrossesBelowThirtyOnDeclineAndRecoversAbove() {
        List<Double> closes = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            closes.add(100.0 - i);
        }
        for (int i = 1; i <= 20; i++) {
            closes.add(81.0 + 2.0 * i);
        }
        List<Candle> candles = TestCandleFactory.fromCloses(closes.stream().mapToDouble(Double::doubleValue).toArray());

        boolean wentBelow = false;
        boolean recovered = false;
        for (int end = 15; end <= candles.size(); end++) {
            double rsi = engine.calculateRSI(candles.subList(0, end), 14);
            assertThat(rsi).isBetween(0.0, 100.0);
            if (rsi < 30) {
                wentBelow = true;
            } else if (wentBelow && rsi > 30) {
                recovered = true;
            }
        }

        assertThat(wentBelow).isTrue();
        assertThat(recovered).isTrue();
    }

    @Test
    void oscillatorsStayWithinBounds() {
        List<Candle> candles = TestCandleFactory.oscillatingCandles(60, 100, 5);

        for (int end = 30; end <= candles.size(); end += 5) {
            List<Candle> window = candles.subList(0, end);
            assertThat(engine.calculateRSI(window, 14)).isBetween(0.0, 100.0);
            assertThat(engine.calculateMFI(window, 14)).isBetween(0.0, 100.0);
            StochasticResult stochastic = engine.calculateStochastic(window, 14, 3, 3);
            assertThat(stochastic.percentK()).isBetween(0.0, 100.0);
            assertThat(stochastic.percentD()).isBetween(0.0, 100.0);
            assertThat(engine.calculateWilliamsR(window, 14)).isBetween(-100.0, 0.0);
        }
    }

    @Test
    void macdHistogramIsMacdMinusSignal() {
        List<Candle> candles = TestCandleFactory.trendingCandles(40, 100, 1);

        MacdResult result = engine.calculateMACD(candles, 12, 26, 9);

        assertThat(result.macd()).isPositive();
        assertThat(result.histogram()).isCloseTo(result.macd() - result.signal(), within(1e-12));
    }

    @Test
    void macdRejectsFastNotShorterThanSlow() {
        List<Candle> candles = TestCandleFactory.trendingCandles(40, 100, 1);

        assertThatThrownBy(() -> engine.calculateMACD(candles, 26, 12, 9))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void reportsRequiredAndActualBars() {
        List<Candle> candles = TestCandleFactory.trendingCandles(14, 100, 1);

        InsufficientDataException error = catchThrowableOfType(() -> engine.calculateRSI(candles, 14),
                InsufficientDataException.class);

        assertThat(error.getRequired()).isEqualTo(15);
        assertThat(error.getActual()).isEqualTo(14);
        assertThat(error.getIndicator()).isEqualTo("RSI");
    }

    @Test
    void minimumHistoryPerIndicator() {
        List<Candle> candles = TestCandleFactory.trendingCandles(60, 100, 1);

        assertThatThrownBy(() -> engine.calculateMACD(candles.subList(0, 34), 12, 26, 9))
                .isInstanceOf(InsufficientDataException.class);
        engine.calculateMACD(candles.subList(0, 35), 12, 26, 9);

        assertThatThrownBy(() -> engine.calculateADX(candles.subList(0, 27), 14))
                .isInstanceOf(InsufficientDataException.class);
        engine.calculateADX(candles.subList(0, 28), 14);

        assertThatThrownBy(() -> engine.calculateStochastic(candles.subList(0, 17), 14, 3, 3))
                .isInstanceOf(InsufficientDataException.class);
        engine.calculateStochastic(candles.subList(0, 18), 14, 3, 3);

        assertThatThrownBy(() -> engine.calculateOBV(candles.subList(0, 1)))
                .isInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> engine.calculateSMA(candles, 0))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void flatMarketUsesNeutralGuards() {
        List<Candle> candles = TestCandleFactory.flatCandles(30, 100, 1000);

        assertThat(engine.calculateWilliamsR(candles, 14)).isEqualTo(-50.0);
        assertThat(engine.calculateStochastic(candles, 14, 3, 3).percentK()).isEqualTo(50.0);
        assertThat(engine.calculateCCI(candles, 20)).isZero();
        assertThat(engine.calculateMFI(candles, 14)).isEqualTo(50.0);
        assertThat(engine.calculateVolatility(candles, 20)).isZero();
        assertThat(engine.calculateATR(candles, 14)).isZero();
        assertThat(engine.calculateADX(candles, 14).adx()).isZero();
        assertThat(engine.calculateBollingerBands(candles, 20, 2.0).bandwidth()).isZero();
    }

    @Test
    void adxFavoursTrendDirection() {
        List<Candle> candles = TestCandleFactory.trendingCandles(40, 100, 1);

        AdxResult result = engine.calculateADX(candles, 14);

        assertThat(result.adx()).isBetween(0.0, 100.0);
        assertThat(result.plusDI()).isGreaterThan(result.minusDI());
        assertThat(result.isStrongTrend(25)).isTrue();
    }

    @Test
    void atrOfConstantRangeBars() {
        List<Candle> candles = TestCandleFactory.trendingCandles(20, 100, 1);

        assertThat(engine.calculateATR(candles, 14)).isCloseTo(1.5, within(1e-9));
    }

    @Test
    void bollingerUsesPopulationStdDev() {
        List<Candle> candles = TestCandleFactory.fromCloses(100, 2, 4, 4, 4, 5, 5, 7, 9);

        BollingerBandsResult bands = engine.calculateBollingerBands(candles, 8, 2.0);

        assertThat(bands.middle()).isCloseTo(5.0, within(1e-9));
        assertThat(bands.upper()).isCloseTo(9.0, within(1e-9));
        assertThat(bands.lower()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void volatilityOfReturns() {
        List<Candle> candles = TestCandleFactory.fromCloses(100, 110, 99);

        assertThat(engine.calculateVolatility(candles, 2)).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void vwapWeightsTypicalPriceByVolume() {
        List<Candle> candles = List.of(
                TestCandleFactory.candle(0, 10, 10, 10, 10, 1),
                TestCandleFactory.candle(1, 20, 20, 20, 20, 1),
                TestCandleFactory.candle(2, 30, 30, 30, 30, 3));

        assertThat(engine.calculateVWAP(candles, 2)).isCloseTo(27.5, within(1e-9));
    }

    @Test
    void obvAccumulatesSignedVolume() {
        List<Candle> candles = List.of(
                TestCandleFactory.candle(0, 10, 10, 10, 10, 100),
                TestCandleFactory.candle(1, 11, 11, 11, 11, 200),
                TestCandleFactory.candle(2, 12, 12, 12, 12, 300),
                TestCandleFactory.candle(3, 11, 11, 11, 11, 400),
                TestCandleFactory.candle(4, 11, 11, 11, 11, 500));

        assertThat(engine.calculateOBV(candles)).isEqualTo(100.0);
    }
}
