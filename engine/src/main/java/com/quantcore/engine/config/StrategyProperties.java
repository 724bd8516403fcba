package com.quantcore.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "strategy")
@Data
@Validated
public class StrategyProperties {

    @Valid
    private Rsi rsi = new Rsi();
    @Valid
    private Macd macd = new Macd();
    @Valid
    private Momentum momentum = new Momentum();
    @Valid
    private Mfi mfi = new Mfi();
    @Valid
    private Vwap vwap = new Vwap();
    @Valid
    private Runner runner = new Runner();

    @Data
    public static class Rsi {
        @Min(1)
        private int period = 14;
        private double oversoldThreshold = 30.0;
        private double overboughtThreshold = 70.0;
    }

    @Data
    public static class Macd {
        @Min(1)
        private int fastPeriod = 12;
        @Min(1)
        private int slowPeriod = 26;
        @Min(1)
        private int signalPeriod = 9;
        private double buyThreshold = 0.0001;
        private double sellThreshold = -0.0001;
        @PositiveOrZero
        private double minVolumeThreshold = 100_000;
    }

    @Data
    public static class Momentum {
        private double buyThreshold = 2.0;
        private double sellThreshold = -2.0;
        private double volatilityFilter = 0.15;
        @Min(1)
        private int volatilityPeriod = 20;
        @PositiveOrZero
        private double minVolumeThreshold = 100_000;
    }

    @Data
    public static class Mfi {
        @Min(1)
        private int period = 14;
        private double oversoldThreshold = 20.0;
        private double overboughtThreshold = 80.0;
        @PositiveOrZero
        private double minVolumeThreshold = 50_000;
    }

    @Data
    public static class Vwap {
        @Min(1)
        private int period = 20;
        private double buyDeviationThreshold = -2.0;
        private double sellDeviationThreshold = 2.0;
        private boolean useVolumeConfirmation = true;
    }

    @Data
    public static class Runner {
        @Min(1)
        private long timeoutMillis = 5_000;
    }
}
