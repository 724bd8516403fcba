package com.quantcore.engine.model.marketmaking;

import com.quantcore.engine.exception.InvalidMarketStateException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Bid/ask ladder for one symbol on one exchange. Bids are expected in
 * descending price order, asks ascending. Every metric is computed from the
 * levels on demand.
 */
@Value
@Builder(toBuilder = true)
public class OrderBookSnapshot {

    public static final int DEFAULT_LEVELS = 5;

    String symbol;
    String exchange;
    Instant timestamp;
    @Singular
    List<OrderBookLevel> bids;
    @Singular
    List<OrderBookLevel> asks;

    public double getBestBid() {
        return bids.isEmpty() ? 0.0 : bids.get(0).getPrice();
    }

    public double getBestAsk() {
        return asks.isEmpty() ? 0.0 : asks.get(0).getPrice();
    }

    public double getSpread() {
        return getBestAsk() - getBestBid();
    }

    public double getMidPrice() {
        return (getBestBid() + getBestAsk()) / 2.0;
    }

    public double getSpreadPercent() {
        double mid = getMidPrice();
        return mid == 0 ? 0.0 : getSpread() / mid;
    }

    /**
     * Top-of-book price weighted by the opposite side's size: a heavy bid pulls
     * the estimate toward the ask.
     */
    public double getMicroprice() {
        if (bids.isEmpty() || asks.isEmpty()) {
            return getMidPrice();
        }
        double bidVolume = bids.get(0).getQuantity();
        double askVolume = asks.get(0).getQuantity();
        if (bidVolume + askVolume == 0) {
            return getMidPrice();
        }
        return (getBestBid() * askVolume + getBestAsk() * bidVolume) / (bidVolume + askVolume);
    }

    public double getBidDepth(int levels) {
        return bids.stream().limit(levels).mapToDouble(OrderBookLevel::notional).sum();
    }

    public double getAskDepth(int levels) {
        return asks.stream().limit(levels).mapToDouble(OrderBookLevel::notional).sum();
    }

    public double getTotalDepth(int levels) {
        return getBidDepth(levels) + getAskDepth(levels);
    }

    public double getBidVolume(int levels) {
        return bids.stream().limit(levels).mapToDouble(OrderBookLevel::getQuantity).sum();
    }

    public double getAskVolume(int levels) {
        return asks.stream().limit(levels).mapToDouble(OrderBookLevel::getQuantity).sum();
    }

    /**
     * (bidVolume - askVolume) / (bidVolume + askVolume) over the top levels, in [-1, 1].
     */
    public double getOrderBookImbalance(int levels) {
        double bidVolume = getBidVolume(levels);
        double askVolume = getAskVolume(levels);
        if (bidVolume + askVolume == 0) {
            return 0.0;
        }
        return (bidVolume - askVolume) / (bidVolume + askVolume);
    }

    public double getWeightedMidPrice(int levels) {
        double bidVolume = getBidVolume(levels);
        double askVolume = getAskVolume(levels);
        if (bidVolume == 0 || askVolume == 0) {
            return getMidPrice();
        }
        double bidPrice = getBidDepth(levels) / bidVolume;
        double askPrice = getAskDepth(levels) / askVolume;
        return (bidPrice * askVolume + askPrice * bidVolume) / (bidVolume + askVolume);
    }

    public boolean isValid() {
        return validationError() == null;
    }

    /**
     * Throws when the book is empty on a side, crossed or out of order.
     */
    public void requireValid() {
        String error = validationError();
        if (error != null) {
            throw new InvalidMarketStateException(symbol + ": " + error);
        }
    }

    private String validationError() {
        if (bids.isEmpty() || asks.isEmpty()) {
            return "order book side is empty";
        }
        if (getBestBid() >= getBestAsk()) {
            return String.format("crossed book (bid %.8f >= ask %.8f)", getBestBid(), getBestAsk());
        }
        for (int i = 1; i < bids.size(); i++) {
            if (bids.get(i).getPrice() >= bids.get(i - 1).getPrice()) {
                return "bids are not strictly descending at level " + i;
            }
        }
        for (int i = 1; i < asks.size(); i++) {
            if (asks.get(i).getPrice() <= asks.get(i - 1).getPrice()) {
                return "asks are not strictly ascending at level " + i;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return String.format("%s @ %s | Spread: %.8f (%.2f%%) | Bid: %.8f | Ask: %.8f | Micro: %.8f | OBI: %.2f",
                symbol, exchange, getSpread(), getSpreadPercent() * 100.0, getBestBid(), getBestAsk(),
                getMicroprice(), getOrderBookImbalance(DEFAULT_LEVELS));
    }
}
