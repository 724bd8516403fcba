package com.quantcore.engine.service.marketmaking;

import com.quantcore.engine.config.MarketMakingProperties;
import com.quantcore.engine.exception.InvalidMarketStateException;
import com.quantcore.engine.model.Candle;
import com.quantcore.engine.model.OrderSide;
import com.quantcore.engine.model.marketmaking.ASFeatures;
import com.quantcore.engine.model.marketmaking.ASParameters;
import com.quantcore.engine.model.marketmaking.ASSignal;
import com.quantcore.engine.model.marketmaking.InventoryState;
import com.quantcore.engine.model.marketmaking.MarketContext;
import com.quantcore.engine.model.marketmaking.OrderBookSnapshot;
import com.quantcore.engine.model.marketmaking.TradeTick;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps per-symbol market-making state and recomputes the quote whenever the
 * book or the inventory changes. Work for one symbol is serialized by that
 * symbol's lock; different symbols run independently.
 *
 * <p>Never throws for bad market input: missing symbols, stale or malformed
 * books and bad fills are logged and answered with invalid quotes or the
 * unchanged state.
 */
@Service
@Slf4j
public class MarketMakingService {

    private final OrderBookStore orderBookStore;
    private final AvellanedaStoikovQuoter quoter;
    private final ASFeatureExtractor featureExtractor;
    private final ASParameters defaultParameters;
    private final int recentTradeLimit;
    private final Duration quoteWindow;
    private final Map<String, SymbolState> states = new ConcurrentHashMap<>();

    @Autowired
    public MarketMakingService(OrderBookStore orderBookStore, AvellanedaStoikovQuoter quoter,
                               ASFeatureExtractor featureExtractor, MarketMakingProperties properties) {
        this(orderBookStore, quoter, featureExtractor, properties.toParameters(), properties.getRecentTradeLimit(),
                Duration.ofSeconds(properties.getQuoteWindowSeconds()));
    }

    public MarketMakingService(OrderBookStore orderBookStore, AvellanedaStoikovQuoter quoter,
                               ASFeatureExtractor featureExtractor, ASParameters defaultParameters,
                               int recentTradeLimit, Duration quoteWindow) {
        this.orderBookStore = orderBookStore;
        this.quoter = quoter;
        this.featureExtractor = featureExtractor;
        this.defaultParameters = defaultParameters;
        this.recentTradeLimit = recentTradeLimit;
        this.quoteWindow = quoteWindow;
    }

    /**
     * Applies a snapshot and requotes. Returns the fresh quote, or an invalid
     * quote explaining why the snapshot was not used.
     */
    public ASSignal onOrderBook(OrderBookSnapshot snapshot) {
        if (snapshot == null || snapshot.getSymbol() == null) {
            return ASSignal.invalid(null, "Order book snapshot has no symbol");
        }
        SymbolState state = state(snapshot.getSymbol());
        state.lock.lock();
        try {
            OrderBookStore.UpdateResult result = orderBookStore.update(snapshot);
            switch (result) {
                case INVALID:
                    return ASSignal.invalid(snapshot.getSymbol(), snapshot.getTimestamp(),
                            "Invalid order book: " + snapshot);
                case STALE:
                    return ASSignal.invalid(snapshot.getSymbol(), snapshot.getTimestamp(),
                            "Stale order book snapshot discarded (timestamp " + snapshot.getTimestamp() + ")");
                default:
                    return requote(state, snapshot);
            }
        } finally {
            state.lock.unlock();
        }
    }

    public void onTrade(TradeTick tick) {
        if (tick == null || tick.getSymbol() == null) {
            log.warn("Ignoring trade without symbol: {}", tick);
            return;
        }
        SymbolState state = state(tick.getSymbol());
        state.lock.lock();
        try {
            state.recentTrades.addLast(tick);
            while (state.recentTrades.size() > recentTradeLimit) {
                state.recentTrades.removeFirst();
            }
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Books a fill against the inventory (BUY adds, SELL subtracts) and
     * requotes from the latest book when one is held.
     */
    public InventoryState onFill(String symbol, OrderSide side, double quantity) {
        if (symbol == null) {
            log.warn("Ignoring fill without symbol: {} {}", side, quantity);
            return unknownSymbol();
        }
        SymbolState state = state(symbol);
        state.lock.lock();
        try {
            if (side == null || !(quantity > 0)) {
                log.warn("Ignoring fill for {} with side {} and quantity {}", symbol, side, quantity);
                return inventoryState(symbol, state);
            }
            state.previousInventory = state.inventory;
            state.inventory += side.sign() * quantity;
            log.info("Fill {} {} {}: inventory {} -> {}", symbol, side, quantity, state.previousInventory,
                    state.inventory);
            orderBookStore.latest(symbol).ifPresent(book -> requote(state, book));
            return inventoryState(symbol, state);
        } finally {
            state.lock.unlock();
        }
    }

    public Optional<ASSignal> currentQuote(String symbol) {
        SymbolState state = symbol == null ? null : states.get(symbol);
        if (state == null) {
            return Optional.empty();
        }
        state.lock.lock();
        try {
            return Optional.ofNullable(state.lastQuote);
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Feature vector for the latest held book, or empty when no usable book
     * has been seen for the symbol.
     */
    public Optional<ASFeatures> features(String symbol, List<Candle> recentCandles) {
        if (symbol == null) {
            return Optional.empty();
        }
        Optional<OrderBookSnapshot> book = orderBookStore.latest(symbol);
        if (book.isEmpty()) {
            return Optional.empty();
        }
        SymbolState state = state(symbol);
        state.lock.lock();
        try {
            OrderBookSnapshot snapshot = book.get();
            MarketContext context = MarketContext.builder()
                    .recentTrades(new ArrayList<>(state.recentTrades))
                    .recentCandles(recentCandles == null ? List.of() : recentCandles)
                    .quoteUpdates(quoteUpdatesWithinWindow(state, snapshot.getTimestamp()))
                    .quoteWindow(quoteWindow)
                    .previousInventory(state.previousInventory)
                    .build();
            return Optional.of(featureExtractor.extract(snapshot, inventoryState(symbol, state), context));
        } catch (InvalidMarketStateException e) {
            log.warn("Cannot extract features for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        } finally {
            state.lock.unlock();
        }
    }

    public InventoryState inventory(String symbol) {
        if (symbol == null) {
            return unknownSymbol();
        }
        SymbolState state = state(symbol);
        state.lock.lock();
        try {
            return inventoryState(symbol, state);
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Overrides the quoting parameters for one symbol. Returns false, leaving
     * the current parameters in place, when the symbol or parameters are missing.
     */
    public boolean configure(String symbol, ASParameters parameters) {
        if (symbol == null || parameters == null) {
            log.warn("Ignoring parameters {} for symbol {}", parameters, symbol);
            return false;
        }
        SymbolState state = state(symbol);
        state.lock.lock();
        try {
            state.parameters = parameters;
            log.info("Quoting parameters for {} set to {}", symbol, parameters);
            return true;
        } finally {
            state.lock.unlock();
        }
    }

    private ASSignal requote(SymbolState state, OrderBookSnapshot snapshot) {
        ASSignal quote = quoter.quote(snapshot, state.parameters, state.inventory);
        if (quote.isValid()) {
            state.lastQuote = quote;
            state.quoteUpdates.addLast(snapshot.getTimestamp());
            pruneQuoteUpdates(state, snapshot.getTimestamp());
        } else if (state.lastQuote != null) {
            // the held quote was priced for a book or inventory that no longer applies
            log.info("Withdrawing quote for {}: {}", snapshot.getSymbol(), quote.getInvalidReason());
            state.lastQuote = null;
        }
        return quote;
    }

    private int quoteUpdatesWithinWindow(SymbolState state, Instant now) {
        pruneQuoteUpdates(state, now);
        return state.quoteUpdates.size();
    }

    private void pruneQuoteUpdates(SymbolState state, Instant now) {
        Instant cutoff = now.minus(quoteWindow);
        while (!state.quoteUpdates.isEmpty() && !state.quoteUpdates.peekFirst().isAfter(cutoff)) {
            state.quoteUpdates.removeFirst();
        }
    }

    private InventoryState inventoryState(String symbol, SymbolState state) {
        Double price = orderBookStore.latest(symbol).map(OrderBookSnapshot::getMidPrice).orElse(null);
        return InventoryState.builder()
                .symbol(symbol)
                .timestamp(orderBookStore.latest(symbol).map(OrderBookSnapshot::getTimestamp).orElse(null))
                .currentInventory(state.inventory)
                .targetInventory(state.parameters.getTargetInventory())
                .maxInventory(state.parameters.getMaxInventory())
                .currentPrice(price)
                .build();
    }

    private InventoryState unknownSymbol() {
        return InventoryState.builder()
                .targetInventory(defaultParameters.getTargetInventory())
                .maxInventory(defaultParameters.getMaxInventory())
                .build();
    }

    private SymbolState state(String symbol) {
        return states.computeIfAbsent(symbol, ignored -> new SymbolState(defaultParameters));
    }

    private static final class SymbolState {
        private final ReentrantLock lock = new ReentrantLock();
        private final Deque<TradeTick> recentTrades = new ArrayDeque<>();
        private final Deque<Instant> quoteUpdates = new ArrayDeque<>();
        private ASParameters parameters;
        private double inventory;
        private double previousInventory;
        private ASSignal lastQuote;

        private SymbolState(ASParameters parameters) {
            this.parameters = parameters;
        }
    }
}
