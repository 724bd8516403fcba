package com.quantcore.engine.model.marketmaking;

import com.quantcore.engine.exception.InvalidParameterException;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed 22-value feature vector consumed by downstream learners. The order of
 * {@link #toArray()} and {@link #featureNames()} is a versioned contract:
 * bump {@link #VERSION} whenever it changes.
 */
@Value
@Builder
public class ASFeatures {

    public static final int FEATURE_COUNT = 22;
    public static final int VERSION = 1;

    private static final List<String> FEATURE_NAMES = List.of(
            // Inventory
            "CurrentInventory", "InventoryPct", "InventoryDistanceFromTarget", "InventoryChangeRate",
            // Order book
            "BestBid", "BestAsk", "BidVolume", "AskVolume", "Spread", "SpreadPct",
            "OrderBookImbalance", "Microprice", "WeightedMidPrice",
            // Microstructure
            "RecentTradeDirection", "TradeFlowImbalance", "QuoteUpdateFrequency", "TimeSinceLastTrade",
            // Volatility / candles
            "Volatility1Min", "Momentum1Min", "Volume1Min", "VWAPDistance", "HighLowRange1Min"
    );

    // Inventory (4)
    double currentInventory;
    double inventoryPct;
    double inventoryDistanceFromTarget;
    double inventoryChangeRate;

    // Order book (9)
    double bestBid;
    double bestAsk;
    double bidVolume;
    double askVolume;
    double spread;
    double spreadPct;
    double orderBookImbalance;
    double microprice;
    double weightedMidPrice;

    // Microstructure (4)
    double recentTradeDirection;
    double tradeFlowImbalance;
    double quoteUpdateFrequency;
    double timeSinceLastTrade;

    // Volatility / candles (5)
    double volatility1Min;
    double momentum1Min;
    double volume1Min;
    double vwapDistance;
    double highLowRange1Min;

    public double[] toArray() {
        return new double[] {
                currentInventory, inventoryPct, inventoryDistanceFromTarget, inventoryChangeRate,
                bestBid, bestAsk, bidVolume, askVolume, spread, spreadPct,
                orderBookImbalance, microprice, weightedMidPrice,
                recentTradeDirection, tradeFlowImbalance, quoteUpdateFrequency, timeSinceLastTrade,
                volatility1Min, momentum1Min, volume1Min, vwapDistance, highLowRange1Min
        };
    }

    public static List<String> featureNames() {
        return FEATURE_NAMES;
    }

    public static ASFeatures fromArray(double[] values) {
        if (values == null || values.length != FEATURE_COUNT) {
            throw new InvalidParameterException("Expected " + FEATURE_COUNT + " features, got "
                    + (values == null ? 0 : values.length));
        }
        return ASFeatures.builder()
                .currentInventory(values[0])
                .inventoryPct(values[1])
                .inventoryDistanceFromTarget(values[2])
                .inventoryChangeRate(values[3])
                .bestBid(values[4])
                .bestAsk(values[5])
                .bidVolume(values[6])
                .askVolume(values[7])
                .spread(values[8])
                .spreadPct(values[9])
                .orderBookImbalance(values[10])
                .microprice(values[11])
                .weightedMidPrice(values[12])
                .recentTradeDirection(values[13])
                .tradeFlowImbalance(values[14])
                .quoteUpdateFrequency(values[15])
                .timeSinceLastTrade(values[16])
                .volatility1Min(values[17])
                .momentum1Min(values[18])
                .volume1Min(values[19])
                .vwapDistance(values[20])
                .highLowRange1Min(values[21])
                .build();
    }

    public Map<String, Double> toMap() {
        double[] values = toArray();
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < FEATURE_COUNT; i++) {
            map.put(FEATURE_NAMES.get(i), values[i]);
        }
        return map;
    }

    @Override
    public String toString() {
        return String.format("ASFeatures[22]: Inv=%.1f%%, Spread=%.2f%%, OBI=%.2f, Vol=%.4f",
                inventoryPct * 100.0, spreadPct * 100.0, orderBookImbalance, volatility1Min);
    }
}
