package com.quantcore.engine.service.indicator;

import com.quantcore.engine.exception.InsufficientDataException;
import com.quantcore.engine.exception.InvalidParameterException;
import com.quantcore.engine.model.Candle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateless technical indicator math over an ordered bar history (oldest
 * first). Each function checks its minimum history and fails with
 * {@link InsufficientDataException} rather than guessing a value.
 */
@Component
@Slf4j
public class IndicatorEngine {

    // --- Momentum oscillators ---

    /**
     * Wilder RSI: seed with the simple average gain/loss of the first
     * {@code period} changes, then smooth with factor 1/period.
     */
    public double calculateRSI(List<Candle> candles, int period) {
        requirePeriod("RSI", period);
        requireBars("RSI", candles, period + 1);

        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = candles.get(i).getClose() - candles.get(i - 1).getClose();
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss += Math.abs(change);
            }
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < candles.size(); i++) {
            double change = candles.get(i).getClose() - candles.get(i - 1).getClose();
            double gain = Math.max(change, 0.0);
            double loss = Math.max(-change, 0.0);
            avgGain = ((avgGain * (period - 1)) + gain) / period;
            avgLoss = ((avgLoss * (period - 1)) + loss) / period;
        }

        if (avgLoss == 0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    public MacdResult calculateMACD(List<Candle> candles, int fastPeriod, int slowPeriod, int signalPeriod) {
        requirePeriod("MACD", fastPeriod);
        requirePeriod("MACD", slowPeriod);
        requirePeriod("MACD", signalPeriod);
        if (fastPeriod >= slowPeriod) {
            throw new InvalidParameterException("MACD fast period (" + fastPeriod
                    + ") must be shorter than slow period (" + slowPeriod + ")");
        }
        requireBars("MACD", candles, Math.max(slowPeriod + signalPeriod, slowPeriod + 1));

        List<Double> closes = closes(candles);
        List<Double> fastSeries = emaSeries(closes, fastPeriod);
        List<Double> slowSeries = emaSeries(closes, slowPeriod);

        List<Double> macdSeries = new ArrayList<>();
        for (int i = 0; i < closes.size(); i++) {
            Double fast = fastSeries.get(i);
            Double slow = slowSeries.get(i);
            if (fast != null && slow != null) {
                macdSeries.add(fast - slow);
            }
        }

        List<Double> signalSeries = emaSeries(macdSeries, signalPeriod);
        double macd = macdSeries.get(macdSeries.size() - 1);
        double signal = signalSeries.get(signalSeries.size() - 1);
        return new MacdResult(macd, signal, macd - signal);
    }

    /**
     * Stochastic oscillator: raw %K from the close's position in the period
     * range, %K smoothed by an SMA of {@code smoothK}, %D an SMA of the
     * smoothed %K over {@code smoothD}. A flat range counts as the midpoint.
     */
    public StochasticResult calculateStochastic(List<Candle> candles, int period, int smoothK, int smoothD) {
        requirePeriod("Stochastic", period);
        requirePeriod("Stochastic", smoothK);
        requirePeriod("Stochastic", smoothD);
        requireBars("Stochastic", candles, Math.max(period + smoothK + smoothD - 2, period + 1));

        List<Double> rawK = new ArrayList<>();
        for (int end = period - 1; end < candles.size(); end++) {
            List<Candle> window = candles.subList(end - period + 1, end + 1);
            double highest = highestHigh(window);
            double lowest = lowestLow(window);
            double range = highest - lowest;
            double close = candles.get(end).getClose();
            rawK.add(range == 0 ? 50.0 : (close - lowest) / range * 100.0);
        }

        List<Double> smoothedK = smaSeries(rawK, smoothK);
        List<Double> percentD = smaSeries(smoothedK, smoothD);
        return new StochasticResult(
                clamp(smoothedK.get(smoothedK.size() - 1), 0.0, 100.0),
                clamp(percentD.get(percentD.size() - 1), 0.0, 100.0));
    }

    /**
     * Williams %R in [-100, 0]; a flat range returns -50.
     */
    public double calculateWilliamsR(List<Candle> candles, int period) {
        requirePeriod("Williams %R", period);
        requireBars("Williams %R", candles, period + 1);

        List<Candle> window = lastN(candles, period);
        double highest = highestHigh(window);
        double lowest = lowestLow(window);
        double range = highest - lowest;
        if (range == 0) {
            return -50.0;
        }
        double close = candles.get(candles.size() - 1).getClose();
        return clamp((highest - close) / range * -100.0, -100.0, 0.0);
    }

    public double calculateCCI(List<Candle> candles, int period) {
        requirePeriod("CCI", period);
        requireBars("CCI", candles, period + 1);

        List<Double> typical = lastN(candles, period).stream().map(Candle::typicalPrice).toList();
        double sma = average(typical);
        double meanDeviation = typical.stream().mapToDouble(tp -> Math.abs(tp - sma)).average().orElse(0.0);
        if (meanDeviation == 0) {
            return 0.0;
        }
        double current = typical.get(typical.size() - 1);
        return (current - sma) / (0.015 * meanDeviation);
    }

    // --- Volume based ---

    /**
     * Money Flow Index: share of volume-weighted typical price flowing on up
     * moves over the last {@code period} bars. No flow at all is neutral (50).
     */
    public double calculateMFI(List<Candle> candles, int period) {
        requirePeriod("MFI", period);
        requireBars("MFI", candles, period + 1);

        double positiveFlow = 0.0;
        double negativeFlow = 0.0;
        for (int i = candles.size() - period; i < candles.size(); i++) {
            double typical = candles.get(i).typicalPrice();
            double previous = candles.get(i - 1).typicalPrice();
            double rawFlow = typical * candles.get(i).getVolume();
            if (typical > previous) {
                positiveFlow += rawFlow;
            } else if (typical < previous) {
                negativeFlow += rawFlow;
            }
        }

        double total = positiveFlow + negativeFlow;
        if (total == 0) {
            return 50.0;
        }
        return clamp(100.0 * positiveFlow / total, 0.0, 100.0);
    }

    /**
     * Volume-weighted typical price over the last {@code period} bars; falls
     * back to the plain average typical price when nothing traded.
     */
    public double calculateVWAP(List<Candle> candles, int period) {
        requirePeriod("VWAP", period);
        requireBars("VWAP", candles, period + 1);

        List<Candle> window = lastN(candles, period);
        double priceVolume = 0.0;
        double volume = 0.0;
        for (Candle candle : window) {
            priceVolume += candle.typicalPrice() * candle.getVolume();
            volume += candle.getVolume();
        }
        if (volume == 0) {
            return window.stream().mapToDouble(Candle::typicalPrice).average().orElse(0.0);
        }
        return priceVolume / volume;
    }

    /**
     * On-balance volume over the whole history, starting from zero.
     */
    public double calculateOBV(List<Candle> candles) {
        requireBars("OBV", candles, 2);

        double obv = 0.0;
        for (int i = 1; i < candles.size(); i++) {
            double close = candles.get(i).getClose();
            double prevClose = candles.get(i - 1).getClose();
            if (close > prevClose) {
                obv += candles.get(i).getVolume();
            } else if (close < prevClose) {
                obv -= candles.get(i).getVolume();
            }
        }
        return obv;
    }

    // --- Trend and volatility ---

    public AdxResult calculateADX(List<Candle> candles, int period) {
        requirePeriod("ADX", period);
        requireBars("ADX", candles, Math.max(2 * period, period + 1));

        List<Double> tr = new ArrayList<>();
        List<Double> dmPlus = new ArrayList<>();
        List<Double> dmMinus = new ArrayList<>();
        for (int i = 1; i < candles.size(); i++) {
            Candle curr = candles.get(i);
            Candle prev = candles.get(i - 1);
            double highDiff = curr.getHigh() - prev.getHigh();
            double lowDiff = prev.getLow() - curr.getLow();
            tr.add(trueRange(curr, prev));
            dmPlus.add((highDiff > lowDiff && highDiff > 0) ? highDiff : 0.0);
            dmMinus.add((lowDiff > highDiff && lowDiff > 0) ? lowDiff : 0.0);
        }

        double smoothTR = sum(tr.subList(0, period));
        double smoothPlus = sum(dmPlus.subList(0, period));
        double smoothMinus = sum(dmMinus.subList(0, period));

        List<Double> dxValues = new ArrayList<>();
        double plusDI = 0.0;
        double minusDI = 0.0;
        for (int i = period - 1; i < tr.size(); i++) {
            if (i > period - 1) {
                smoothTR = smoothTR - (smoothTR / period) + tr.get(i);
                smoothPlus = smoothPlus - (smoothPlus / period) + dmPlus.get(i);
                smoothMinus = smoothMinus - (smoothMinus / period) + dmMinus.get(i);
            }
            if (smoothTR == 0) {
                plusDI = 0.0;
                minusDI = 0.0;
                dxValues.add(0.0);
                continue;
            }
            plusDI = 100.0 * (smoothPlus / smoothTR);
            minusDI = 100.0 * (smoothMinus / smoothTR);
            double diSum = plusDI + minusDI;
            dxValues.add(diSum == 0 ? 0.0 : (Math.abs(plusDI - minusDI) / diSum) * 100.0);
        }

        double adx = average(dxValues.subList(0, period));
        for (int i = period; i < dxValues.size(); i++) {
            adx = ((adx * (period - 1)) + dxValues.get(i)) / period;
        }
        return new AdxResult(adx, plusDI, minusDI);
    }

    public double calculateATR(List<Candle> candles, int period) {
        requirePeriod("ATR", period);
        requireBars("ATR", candles, period + 1);

        List<Double> trValues = new ArrayList<>();
        for (int i = 1; i < candles.size(); i++) {
            trValues.add(trueRange(candles.get(i), candles.get(i - 1)));
        }
        return wildersSmoothing(trValues, period);
    }

    /**
     * SMA(period) plus/minus {@code stdDevMultiplier} population standard deviations.
     */
    public BollingerBandsResult calculateBollingerBands(List<Candle> candles, int period, double stdDevMultiplier) {
        requirePeriod("Bollinger Bands", period);
        if (stdDevMultiplier <= 0) {
            throw new InvalidParameterException("Bollinger stdDevMultiplier must be positive (got " + stdDevMultiplier + ")");
        }
        requireBars("Bollinger Bands", candles, period + 1);

        List<Double> subset = lastN(closes(candles), period);
        double sma = average(subset);
        double stdDev = populationStdDev(subset, sma);
        return new BollingerBandsResult(sma + stdDevMultiplier * stdDev, sma, sma - stdDevMultiplier * stdDev);
    }

    /**
     * Population standard deviation of the last {@code period} close-to-close returns.
     */
    public double calculateVolatility(List<Candle> candles, int period) {
        requirePeriod("Volatility", period);
        requireBars("Volatility", candles, period + 1);

        List<Candle> recent = lastN(candles, period + 1);
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < recent.size(); i++) {
            double prev = recent.get(i - 1).getClose();
            returns.add(prev == 0 ? 0.0 : (recent.get(i).getClose() - prev) / prev);
        }
        return populationStdDev(returns, average(returns));
    }

    // --- Moving averages ---

    /**
     * EMA seeded with the SMA of the first {@code period} closes, smoothing 2/(period+1).
     */
    public double calculateEMA(List<Candle> candles, int period) {
        requirePeriod("EMA", period);
        requireBars("EMA", candles, period + 1);
        List<Double> series = emaSeries(closes(candles), period);
        return series.get(series.size() - 1);
    }

    public double calculateSMA(List<Candle> candles, int period) {
        requirePeriod("SMA", period);
        requireBars("SMA", candles, period + 1);
        return average(lastN(closes(candles), period));
    }

    // --- Helpers ---

    private void requirePeriod(String indicator, int period) {
        if (period <= 0) {
            throw new InvalidParameterException(indicator + " period must be positive (got " + period + ")");
        }
    }

    private void requireBars(String indicator, List<Candle> candles, int required) {
        int actual = candles == null ? 0 : candles.size();
        if (actual < required) {
            log.debug("Insufficient data for {}. Need {}, got {}", indicator, required, actual);
            throw new InsufficientDataException(indicator, required, actual);
        }
    }

    private double trueRange(Candle curr, Candle prev) {
        return Math.max(curr.getHigh() - curr.getLow(),
                Math.max(Math.abs(curr.getHigh() - prev.getClose()), Math.abs(curr.getLow() - prev.getClose())));
    }

    private double wildersSmoothing(List<Double> values, int period) {
        double smooth = average(values.subList(0, period));
        for (int i = period; i < values.size(); i++) {
            smooth = ((smooth * (period - 1)) + values.get(i)) / period;
        }
        return smooth;
    }

    /**
     * Same length as {@code values}; entries before the SMA seed are null.
     */
    private List<Double> emaSeries(List<Double> values, int period) {
        List<Double> emaSeries = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            emaSeries.add(null);
        }
        if (values.size() < period) {
            return emaSeries;
        }
        double ema = average(values.subList(0, period));
        emaSeries.set(period - 1, ema);
        double k = 2.0 / (period + 1);
        for (int i = period; i < values.size(); i++) {
            ema = (values.get(i) * k) + (ema * (1 - k));
            emaSeries.set(i, ema);
        }
        return emaSeries;
    }

    /**
     * Rolling simple averages, one per complete window.
     */
    private List<Double> smaSeries(List<Double> values, int period) {
        List<Double> series = new ArrayList<>();
        for (int end = period; end <= values.size(); end++) {
            series.add(average(values.subList(end - period, end)));
        }
        return series;
    }

    private static List<Double> closes(List<Candle> candles) {
        return candles.stream().map(Candle::getClose).toList();
    }

    private static <T> List<T> lastN(List<T> values, int n) {
        return values.subList(values.size() - n, values.size());
    }

    private static double highestHigh(List<Candle> window) {
        return window.stream().mapToDouble(Candle::getHigh).max().orElse(0.0);
    }

    private static double lowestLow(List<Candle> window) {
        return window.stream().mapToDouble(Candle::getLow).min().orElse(0.0);
    }

    private static double sum(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).sum();
    }

    private static double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static double populationStdDev(List<Double> values, double mean) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double variance = values.stream().mapToDouble(v -> Math.pow(v - mean, 2)).sum() / values.size();
        return Math.sqrt(variance);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
