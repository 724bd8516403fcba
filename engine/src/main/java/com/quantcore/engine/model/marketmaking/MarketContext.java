package com.quantcore.engine.model.marketmaking;

import com.quantcore.engine.model.Candle;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Recent trade flow and candle history used for the microstructure and
 * volatility feature groups.
 */
@Value
@Builder
public class MarketContext {
    @Singular
    List<TradeTick> recentTrades;
    @Singular
    List<Candle> recentCandles;
    int quoteUpdates;
    @Builder.Default
    Duration quoteWindow = Duration.ofMinutes(1);
    double previousInventory;

    public static MarketContext empty() {
        return MarketContext.builder().build();
    }
}
