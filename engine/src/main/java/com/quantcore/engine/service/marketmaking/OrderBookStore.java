package com.quantcore.engine.service.marketmaking;

import com.quantcore.engine.model.marketmaking.OrderBookSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest order book per symbol. A snapshot replaces the held one only when
 * its timestamp is strictly newer; stale and malformed snapshots are counted
 * and dropped.
 */
@Component
@Slf4j
public class OrderBookStore {

    public enum UpdateResult {
        APPLIED,
        STALE,
        INVALID
    }

    private final Map<String, OrderBookSnapshot> books = new ConcurrentHashMap<>();
    private final Counter applied;
    private final Counter discarded;
    private final Counter rejected;

    public OrderBookStore(MeterRegistry meterRegistry) {
        this.applied = Counter.builder("orderbook_snapshots_applied_total").register(meterRegistry);
        this.discarded = Counter.builder("orderbook_snapshots_discarded_total").register(meterRegistry);
        this.rejected = Counter.builder("orderbook_snapshots_rejected_total").register(meterRegistry);
    }

    public UpdateResult update(OrderBookSnapshot snapshot) {
        if (snapshot == null || snapshot.getSymbol() == null || snapshot.getTimestamp() == null || !snapshot.isValid()) {
            rejected.increment();
            log.warn("Rejected order book snapshot: {}", snapshot);
            return UpdateResult.INVALID;
        }

        boolean[] replaced = new boolean[1];
        books.compute(snapshot.getSymbol(), (symbol, held) -> {
            if (held == null || snapshot.getTimestamp().isAfter(held.getTimestamp())) {
                replaced[0] = true;
                return snapshot;
            }
            return held;
        });

        if (replaced[0]) {
            applied.increment();
            return UpdateResult.APPLIED;
        }
        discarded.increment();
        log.warn("Discarded stale order book for {} at {}", snapshot.getSymbol(), snapshot.getTimestamp());
        return UpdateResult.STALE;
    }

    public Optional<OrderBookSnapshot> latest(String symbol) {
        return symbol == null ? Optional.empty() : Optional.ofNullable(books.get(symbol));
    }

    public Set<String> symbols() {
        return Set.copyOf(books.keySet());
    }

    public long discardedCount() {
        return (long) discarded.count();
    }

    public void clear() {
        books.clear();
    }
}
