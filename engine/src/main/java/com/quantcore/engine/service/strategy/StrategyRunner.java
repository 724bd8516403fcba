package com.quantcore.engine.service.strategy;

import com.quantcore.engine.config.StrategyProperties;
import com.quantcore.engine.model.Candle;
import com.quantcore.engine.model.Signal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Evaluates independent strategies against the same bar in parallel. The
 * returned signals are in the same order as the strategies.
 */
@Service
@Slf4j
public class StrategyRunner {

    private final Executor executor;
    private final long timeoutMillis;

    @Autowired
    public StrategyRunner(@Qualifier("strategyExecutor") Executor executor, StrategyProperties properties) {
        this(executor, properties.getRunner().getTimeoutMillis());
    }

    StrategyRunner(Executor executor, long timeoutMillis) {
        this.executor = executor;
        this.timeoutMillis = timeoutMillis;
    }

    public List<Signal> evaluate(List<TradingStrategy> strategies, Candle current, List<Candle> historical) {
        List<CompletableFuture<Signal>> futures = new ArrayList<>(strategies.size());
        for (TradingStrategy strategy : strategies) {
            CompletableFuture<Signal> future = CompletableFuture
                    .supplyAsync(() -> strategy.analyze(current, historical), executor)
                    .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                    .exceptionally(e -> fallback(strategy, current, e));
            futures.add(future);
        }

        List<Signal> signals = new ArrayList<>(futures.size());
        for (CompletableFuture<Signal> future : futures) {
            signals.add(future.join());
        }
        log.debug("Evaluated {} strategies for {}", signals.size(), current.getSymbol());
        return signals;
    }

    private Signal fallback(TradingStrategy strategy, Candle current, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            log.error("Strategy {} timed out after {} ms for {}", strategy.name(), timeoutMillis, current.getSymbol());
            cause = new TimeoutException(strategy.name() + " timed out after " + timeoutMillis + " ms");
        } else {
            log.error("Strategy {} failed for {}", strategy.name(), current.getSymbol(), cause);
        }
        return Signal.error(current.getSymbol(), strategy.name(), current.getTimestamp(), cause);
    }
}
