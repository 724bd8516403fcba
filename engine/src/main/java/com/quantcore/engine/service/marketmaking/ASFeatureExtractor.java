package com.quantcore.engine.service.marketmaking;

import com.quantcore.engine.config.MarketMakingProperties;
import com.quantcore.engine.model.Candle;
import com.quantcore.engine.model.OrderSide;
import com.quantcore.engine.model.marketmaking.ASFeatures;
import com.quantcore.engine.model.marketmaking.InventoryState;
import com.quantcore.engine.model.marketmaking.MarketContext;
import com.quantcore.engine.model.marketmaking.OrderBookSnapshot;
import com.quantcore.engine.model.marketmaking.TradeTick;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Builds the 22-value {@link ASFeatures} vector. Pure: the same snapshot,
 * inventory and context always give the same vector.
 */
@Component
public class ASFeatureExtractor {

    private final int depthLevels;

    @Autowired
    public ASFeatureExtractor(MarketMakingProperties properties) {
        this(properties.getFeatureDepthLevels());
    }

    public ASFeatureExtractor(int depthLevels) {
        this.depthLevels = depthLevels;
    }

    /**
     * @throws com.quantcore.engine.exception.InvalidMarketStateException if the book is empty, crossed or unsorted
     */
    public ASFeatures extract(OrderBookSnapshot snapshot, InventoryState inventory, MarketContext context) {
        snapshot.requireValid();
        MarketContext ctx = context == null ? MarketContext.empty() : context;

        ASFeatures.ASFeaturesBuilder features = ASFeatures.builder();
        inventoryFeatures(features, inventory, ctx);
        orderBookFeatures(features, snapshot);
        microstructureFeatures(features, snapshot, ctx);
        candleFeatures(features, snapshot, ctx.getRecentCandles());
        return features.build();
    }

    private void inventoryFeatures(ASFeatures.ASFeaturesBuilder features, InventoryState inventory, MarketContext ctx) {
        double maxInventory = inventory.getMaxInventory();
        double change = inventory.getCurrentInventory() - ctx.getPreviousInventory();
        features.currentInventory(inventory.getCurrentInventory())
                .inventoryPct(inventory.getInventoryPercent())
                .inventoryDistanceFromTarget(inventory.getDistanceFromTarget())
                .inventoryChangeRate(maxInventory == 0 ? 0.0 : change / maxInventory);
    }

    private void orderBookFeatures(ASFeatures.ASFeaturesBuilder features, OrderBookSnapshot snapshot) {
        features.bestBid(snapshot.getBestBid())
                .bestAsk(snapshot.getBestAsk())
                .bidVolume(snapshot.getBidVolume(depthLevels))
                .askVolume(snapshot.getAskVolume(depthLevels))
                .spread(snapshot.getSpread())
                .spreadPct(snapshot.getSpreadPercent())
                .orderBookImbalance(snapshot.getOrderBookImbalance(depthLevels))
                .microprice(snapshot.getMicroprice())
                .weightedMidPrice(snapshot.getWeightedMidPrice(depthLevels));
    }

    private void microstructureFeatures(ASFeatures.ASFeaturesBuilder features, OrderBookSnapshot snapshot,
                                        MarketContext ctx) {
        List<TradeTick> trades = ctx.getRecentTrades();
        int buys = 0;
        int sells = 0;
        double buyVolume = 0.0;
        double sellVolume = 0.0;
        TradeTick last = null;
        for (TradeTick trade : trades) {
            if (trade.getAggressor() == OrderSide.BUY) {
                buys++;
                buyVolume += trade.getQuantity();
            } else if (trade.getAggressor() == OrderSide.SELL) {
                sells++;
                sellVolume += trade.getQuantity();
            }
            if (last == null || trade.getTimestamp().isAfter(last.getTimestamp())) {
                last = trade;
            }
        }

        double direction = buys + sells == 0 ? 0.0 : (double) (buys - sells) / (buys + sells);
        double flow = buyVolume + sellVolume == 0 ? 0.0 : (buyVolume - sellVolume) / (buyVolume + sellVolume);

        Duration window = ctx.getQuoteWindow();
        double windowSeconds = window == null ? 0.0 : window.toMillis() / 1000.0;
        double quoteFrequency = windowSeconds <= 0 ? 0.0 : ctx.getQuoteUpdates() / windowSeconds;

        double sinceLastTrade = 0.0;
        if (last != null && snapshot.getTimestamp() != null) {
            long millis = Duration.between(last.getTimestamp(), snapshot.getTimestamp()).toMillis();
            sinceLastTrade = Math.max(0, millis) / 1000.0;
        }

        features.recentTradeDirection(direction)
                .tradeFlowImbalance(flow)
                .quoteUpdateFrequency(quoteFrequency)
                .timeSinceLastTrade(sinceLastTrade);
    }

    private void candleFeatures(ASFeatures.ASFeaturesBuilder features, OrderBookSnapshot snapshot,
                                List<Candle> candles) {
        if (candles.isEmpty()) {
            features.volatility1Min(0.0).momentum1Min(0.0).volume1Min(0.0).vwapDistance(0.0).highLowRange1Min(0.0);
            return;
        }
        Candle last = candles.get(candles.size() - 1);

        double priceVolume = 0.0;
        double volume = 0.0;
        for (Candle candle : candles) {
            priceVolume += candle.typicalPrice() * candle.getVolume();
            volume += candle.getVolume();
        }
        double vwap = volume == 0 ? 0.0 : priceVolume / volume;
        double mid = snapshot.getMidPrice();

        features.volatility1Min(returnsStdDev(candles))
                .momentum1Min(last.getOpen() == 0 ? 0.0 : (last.getClose() - last.getOpen()) / last.getOpen())
                .volume1Min(last.getVolume())
                .vwapDistance(vwap == 0 ? 0.0 : (mid - vwap) / vwap)
                .highLowRange1Min(last.getClose() == 0 ? 0.0 : (last.getHigh() - last.getLow()) / last.getClose());
    }

    private static double returnsStdDev(List<Candle> candles) {
        if (candles.size() < 2) {
            return 0.0;
        }
        double[] returns = new double[candles.size() - 1];
        for (int i = 1; i < candles.size(); i++) {
            double previous = candles.get(i - 1).getClose();
            returns[i - 1] = previous == 0 ? 0.0 : (candles.get(i).getClose() - previous) / previous;
        }
        double mean = 0.0;
        for (double r : returns) {
            mean += r;
        }
        mean /= returns.length;
        double variance = 0.0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        return Math.sqrt(variance / returns.length);
    }
}
