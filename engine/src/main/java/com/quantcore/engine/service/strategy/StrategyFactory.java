package com.quantcore.engine.service.strategy;

import com.quantcore.engine.config.StrategyProperties;
import com.quantcore.engine.exception.InvalidParameterException;
import com.quantcore.engine.service.indicator.IndicatorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Name-based registry of strategies. Lookups are case-insensitive and every
 * {@link #create(String)} call returns a fresh instance.
 */
@Service
@Slf4j
public class StrategyFactory {

    private final Map<String, Supplier<TradingStrategy>> registry = new ConcurrentHashMap<>();

    public StrategyFactory(StrategyProperties properties, IndicatorService indicatorService) {
        register("momentum", () -> new MomentumStrategy(properties.getMomentum(), indicatorService));
        register("rsi", () -> new RsiStrategy(properties.getRsi(), indicatorService));
        register("macd", () -> new MacdStrategy(properties.getMacd(), indicatorService));
        register("mfi", () -> new MfiStrategy(properties.getMfi(), indicatorService));
        register("vwap", () -> new VwapStrategy(properties.getVwap(), indicatorService));
    }

    public TradingStrategy create(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidParameterException("Strategy name must not be blank");
        }
        Supplier<TradingStrategy> supplier = registry.get(normalize(name));
        if (supplier == null) {
            throw new InvalidParameterException(String.format("Unknown strategy: '%s'. Available strategies: %s",
                    name, String.join(", ", availableStrategies())));
        }
        return supplier.get();
    }

    public List<TradingStrategy> createAll(List<String> names) {
        List<TradingStrategy> strategies = new ArrayList<>(names.size());
        for (String name : names) {
            strategies.add(create(name));
        }
        return strategies;
    }

    public List<String> availableStrategies() {
        List<String> names = new ArrayList<>(registry.keySet());
        Collections.sort(names);
        return names;
    }

    public boolean isRegistered(String name) {
        return name != null && registry.containsKey(normalize(name));
    }

    /**
     * Adds or replaces a strategy under {@code name}.
     */
    public void register(String name, Supplier<TradingStrategy> supplier) {
        if (name == null || name.isBlank() || supplier == null) {
            throw new InvalidParameterException("Strategy registration needs a name and a supplier");
        }
        if (registry.put(normalize(name), supplier) != null) {
            log.info("Strategy '{}' re-registered", name);
        } else {
            log.debug("Registered strategy '{}'", name);
        }
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
