package com.quantcore.engine.service.indicator;

import com.quantcore.engine.config.IndicatorProperties;
import com.quantcore.engine.exception.InsufficientDataException;
import com.quantcore.engine.model.Candle;
import com.quantcore.engine.model.CandleSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Cached entry point for indicator evaluation. Results are keyed by
 * indicator, symbol, parameters and the time bucket of the latest bar.
 * Caller errors propagate unchanged: short history as
 * {@link InsufficientDataException}, malformed or out-of-order bars as
 * {@link com.quantcore.engine.exception.InvalidParameterException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IndicatorService {

    private final IndicatorEngine engine;
    private final IndicatorCache cache;
    private final IndicatorProperties properties;

    public IndicatorResult compute(IndicatorType type, String symbol, List<Candle> history, IndicatorParams params) {
        IndicatorParams resolved = (params == null ? new IndicatorParams(Map.of()) : params).withDefaults(type);
        if (history == null || history.isEmpty()) {
            throw new InsufficientDataException(type.key(), 1, 0);
        }
        CandleSeries.requireStrictlyIncreasing(history);
        IndicatorCacheKey key = new IndicatorCacheKey(type, symbol, resolved, bucketOf(history));
        return cache.getOrCompute(key, () -> {
            log.debug("Calculating {} for {} with {}", type.key(), symbol, resolved);
            IndicatorResult result = calculate(type, history, resolved);
            log.debug("{} calculated for {}: {}", type.key(), symbol, result);
            return result;
        });
    }

    public double rsi(String symbol, List<Candle> history, int period) {
        return scalar(IndicatorType.RSI, symbol, history, IndicatorParams.period(period));
    }

    public MacdResult macd(String symbol, List<Candle> history, int fastPeriod, int slowPeriod, int signalPeriod) {
        IndicatorParams params = IndicatorParams.of(IndicatorParams.FAST_PERIOD, fastPeriod)
                .with(IndicatorParams.SLOW_PERIOD, slowPeriod)
                .with(IndicatorParams.SIGNAL_PERIOD, signalPeriod);
        return (MacdResult) compute(IndicatorType.MACD, symbol, history, params);
    }

    public double ema(String symbol, List<Candle> history, int period) {
        return scalar(IndicatorType.EMA, symbol, history, IndicatorParams.period(period));
    }

    public double sma(String symbol, List<Candle> history, int period) {
        return scalar(IndicatorType.SMA, symbol, history, IndicatorParams.period(period));
    }

    public double volatility(String symbol, List<Candle> history, int period) {
        return scalar(IndicatorType.VOLATILITY, symbol, history, IndicatorParams.period(period));
    }

    public double mfi(String symbol, List<Candle> history, int period) {
        return scalar(IndicatorType.MFI, symbol, history, IndicatorParams.period(period));
    }

    public double vwap(String symbol, List<Candle> history, int period) {
        return scalar(IndicatorType.VWAP, symbol, history, IndicatorParams.period(period));
    }

    public StochasticResult stochastic(String symbol, List<Candle> history, int period, int smoothK, int smoothD) {
        IndicatorParams params = IndicatorParams.period(period)
                .with(IndicatorParams.SMOOTH_K, smoothK)
                .with(IndicatorParams.SMOOTH_D, smoothD);
        return (StochasticResult) compute(IndicatorType.STOCHASTIC, symbol, history, params);
    }

    public AdxResult adx(String symbol, List<Candle> history, int period) {
        return (AdxResult) compute(IndicatorType.ADX, symbol, history, IndicatorParams.period(period));
    }

    public double atr(String symbol, List<Candle> history, int period) {
        return scalar(IndicatorType.ATR, symbol, history, IndicatorParams.period(period));
    }

    public BollingerBandsResult bollingerBands(String symbol, List<Candle> history, int period, double stdDevMultiplier) {
        IndicatorParams params = IndicatorParams.period(period)
                .with(IndicatorParams.STD_DEV_MULTIPLIER, stdDevMultiplier);
        return (BollingerBandsResult) compute(IndicatorType.BOLLINGER_BANDS, symbol, history, params);
    }

    public double williamsR(String symbol, List<Candle> history, int period) {
        return scalar(IndicatorType.WILLIAMS_R, symbol, history, IndicatorParams.period(period));
    }

    public double cci(String symbol, List<Candle> history, int period) {
        return scalar(IndicatorType.CCI, symbol, history, IndicatorParams.period(period));
    }

    public double obv(String symbol, List<Candle> history) {
        return scalar(IndicatorType.OBV, symbol, history, null);
    }

    public void clearCache() {
        cache.clear();
    }

    private double scalar(IndicatorType type, String symbol, List<Candle> history, IndicatorParams params) {
        return ((ScalarResult) compute(type, symbol, history, params)).value();
    }

    private IndicatorResult calculate(IndicatorType type, List<Candle> history, IndicatorParams p) {
        return switch (type) {
            case RSI -> new ScalarResult(engine.calculateRSI(history, p.getInt(IndicatorParams.PERIOD)));
            case MACD -> engine.calculateMACD(history, p.getInt(IndicatorParams.FAST_PERIOD),
                    p.getInt(IndicatorParams.SLOW_PERIOD), p.getInt(IndicatorParams.SIGNAL_PERIOD));
            case EMA -> new ScalarResult(engine.calculateEMA(history, p.getInt(IndicatorParams.PERIOD)));
            case SMA -> new ScalarResult(engine.calculateSMA(history, p.getInt(IndicatorParams.PERIOD)));
            case VOLATILITY -> new ScalarResult(engine.calculateVolatility(history, p.getInt(IndicatorParams.PERIOD)));
            case MFI -> new ScalarResult(engine.calculateMFI(history, p.getInt(IndicatorParams.PERIOD)));
            case VWAP -> new ScalarResult(engine.calculateVWAP(history, p.getInt(IndicatorParams.PERIOD)));
            case STOCHASTIC -> engine.calculateStochastic(history, p.getInt(IndicatorParams.PERIOD),
                    p.getInt(IndicatorParams.SMOOTH_K), p.getInt(IndicatorParams.SMOOTH_D));
            case ADX -> engine.calculateADX(history, p.getInt(IndicatorParams.PERIOD));
            case ATR -> new ScalarResult(engine.calculateATR(history, p.getInt(IndicatorParams.PERIOD)));
            case BOLLINGER_BANDS -> engine.calculateBollingerBands(history, p.getInt(IndicatorParams.PERIOD),
                    p.getDouble(IndicatorParams.STD_DEV_MULTIPLIER));
            case WILLIAMS_R -> new ScalarResult(engine.calculateWilliamsR(history, p.getInt(IndicatorParams.PERIOD)));
            case CCI -> new ScalarResult(engine.calculateCCI(history, p.getInt(IndicatorParams.PERIOD)));
            case OBV -> new ScalarResult(engine.calculateOBV(history));
        };
    }

    private Instant bucketOf(List<Candle> history) {
        Instant latest = history.get(history.size() - 1).getTimestamp();
        long bucketMillis = Math.max(1L, properties.getCache().getBucket().toMillis());
        long epochMillis = latest.toEpochMilli();
        return Instant.ofEpochMilli(epochMillis - Math.floorMod(epochMillis, bucketMillis));
    }
}
