package com.quantcore.engine.service.indicator;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class IndicatorCacheTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private Clock clock;
    private SimpleMeterRegistry registry;
    private IndicatorCache cache;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(T0);
        registry = new SimpleMeterRegistry();
        cache = new IndicatorCache(Duration.ofSeconds(60), registry, clock);
    }

    private static IndicatorCacheKey key(String symbol) {
        return new IndicatorCacheKey(IndicatorType.RSI, symbol, IndicatorParams.period(14), T0);
    }

    @Test
    void concurrentRequestsShareOneComputation() throws Exception {
        AtomicInteger computations = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<ScalarResult>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> cache.getOrCompute(key("BTCUSD"), () -> {
                    computations.incrementAndGet();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return new ScalarResult(42.0);
                })));
            }
            Thread.sleep(100);
            release.countDown();

            for (Future<ScalarResult> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS).value()).isEqualTo(42.0);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(computations.get()).isEqualTo(1);
        assertThat(registry.counter("indicator_cache_misses_total").count()).isEqualTo(1.0);
        assertThat(registry.counter("indicator_cache_hits_total").count()).isEqualTo(7.0);
    }

    @Test
    void entriesExpireAfterTtl() {
        AtomicInteger computations = new AtomicInteger();

        cache.getOrCompute(key("BTCUSD"), () -> new ScalarResult(computations.incrementAndGet()));
        when(clock.instant()).thenReturn(T0.plusSeconds(59));
        ScalarResult cached = cache.getOrCompute(key("BTCUSD"), () -> new ScalarResult(computations.incrementAndGet()));
        when(clock.instant()).thenReturn(T0.plusSeconds(60));
        ScalarResult refreshed = cache.getOrCompute(key("BTCUSD"), () -> new ScalarResult(computations.incrementAndGet()));

        assertThat(cached.value()).isEqualTo(1.0);
        assertThat(refreshed.value()).isEqualTo(2.0);
        assertThat(cache.evictExpired()).isZero();

        when(clock.instant()).thenReturn(T0.plusSeconds(200));
        assertThat(cache.evictExpired()).isEqualTo(1);
        assertThat(cache.size()).isZero();
    }

    @Test
    void streamingBucketsDoNotAccumulate() {
        for (int bar = 0; bar < 500; bar++) {
            Instant at = T0.plus(Duration.ofMinutes(bar));
            when(clock.instant()).thenReturn(at);
            IndicatorCacheKey key = new IndicatorCacheKey(IndicatorType.RSI, "BTCUSD", IndicatorParams.period(14), at);
            double value = bar;
            cache.getOrCompute(key, () -> new ScalarResult(value));
        }

        assertThat(cache.size()).isLessThanOrEqualTo(2);
        assertThat(registry.counter("indicator_cache_misses_total").count()).isEqualTo(500.0);
    }

    @Test
    void failuresAreNotCached() {
        assertThatThrownBy(() -> cache.getOrCompute(key("BTCUSD"), () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        ScalarResult result = cache.getOrCompute(key("BTCUSD"), () -> new ScalarResult(7.0));

        assertThat(result.value()).isEqualTo(7.0);
    }

    @Test
    void clearDropsEveryEntry() {
        cache.getOrCompute(key("BTCUSD"), () -> new ScalarResult(1.0));
        cache.getOrCompute(key("ETHUSD"), () -> new ScalarResult(2.0));
        assertThat(cache.size()).isEqualTo(2);

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.getOrCompute(key("BTCUSD"), () -> new ScalarResult(3.0)).value()).isEqualTo(3.0);
    }
}
