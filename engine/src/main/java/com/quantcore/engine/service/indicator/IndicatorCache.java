package com.quantcore.engine.service.indicator;

import com.quantcore.engine.config.IndicatorProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * TTL cache for indicator results with single-flight loading: the first
 * caller for a key computes, concurrent callers for the same key wait on the
 * same future. Failures are handed to every waiter and never cached.
 *
 * <p>Keys carry the bar's time bucket, so old keys are never asked for again
 * once the stream moves on. Misses sweep expired entries at most once per TTL.
 */
@Component
@Slf4j
public class IndicatorCache {

    private final ConcurrentHashMap<IndicatorCacheKey, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;
    private final Counter hits;
    private final Counter misses;
    private final AtomicReference<Instant> nextSweep = new AtomicReference<>(Instant.MIN);

    @Autowired
    public IndicatorCache(IndicatorProperties properties, MeterRegistry meterRegistry) {
        this(properties.getCache().getTtl(), meterRegistry, Clock.systemUTC());
    }

    public IndicatorCache(Duration ttl, MeterRegistry meterRegistry, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
        this.hits = Counter.builder("indicator_cache_hits_total").register(meterRegistry);
        this.misses = Counter.builder("indicator_cache_misses_total").register(meterRegistry);
        Gauge.builder("indicator_cache_size", entries, ConcurrentHashMap::size).register(meterRegistry);
    }

    @SuppressWarnings("unchecked")
    public <T extends IndicatorResult> T getOrCompute(IndicatorCacheKey key, Supplier<T> computation) {
        Instant now = clock.instant();
        Entry created = new Entry();
        Entry entry = entries.compute(key, (k, existing) ->
                existing != null && !existing.isExpired(now) ? existing : created);

        if (entry != created) {
            hits.increment();
            return (T) await(entry.future);
        }

        misses.increment();
        sweepIfDue(now);
        try {
            T value = computation.get();
            entry.expiresAt = clock.instant().plus(ttl);
            entry.future.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            entries.remove(key, entry);
            entry.future.completeExceptionally(e);
            throw e;
        }
    }

    public void clear() {
        int size = entries.size();
        entries.clear();
        log.info("Indicator cache cleared ({} entries)", size);
    }

    public int evictExpired() {
        return evictExpired(clock.instant());
    }

    private int evictExpired(Instant now) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        return before - entries.size();
    }

    private void sweepIfDue(Instant now) {
        Instant due = nextSweep.get();
        if (now.isBefore(due) || !nextSweep.compareAndSet(due, now.plus(ttl))) {
            return;
        }
        int evicted = evictExpired(now);
        if (evicted > 0) {
            log.debug("Evicted {} expired indicator cache entries", evicted);
        }
    }

    public int size() {
        return entries.size();
    }

    private static IndicatorResult await(CompletableFuture<IndicatorResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    private static final class Entry {
        private final CompletableFuture<IndicatorResult> future = new CompletableFuture<>();
        /** Null while the computation is still running. */
        private volatile Instant expiresAt;

        private boolean isExpired(Instant now) {
            Instant expiry = expiresAt;
            return expiry != null && !now.isBefore(expiry);
        }
    }
}
