package com.quantcore.engine.config;

import com.quantcore.engine.model.marketmaking.ASParameters;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "marketmaking")
@Data
@Validated
public class MarketMakingProperties {

    private double gamma = 0.1;
    private double kappa = 1.5;
    private double sigma = 0.5;
    private double timeRemaining = 1.0;
    @Positive
    private double maxInventory = 1.0;
    private double targetInventory = 0.0;
    @PositiveOrZero
    private double minSpreadBps = 10.0;
    private double maxSpreadBps = 50.0;

    @Positive
    private double baseOrderSize = 0.1;
    @Min(1)
    private int featureDepthLevels = 5;
    @Min(1)
    private int recentTradeLimit = 100;
    @Min(1)
    private long quoteWindowSeconds = 60;

    /**
     * Builds validated quoting parameters; throws listing every bad value.
     */
    public ASParameters toParameters() {
        return ASParameters.builder()
                .gamma(gamma)
                .kappa(kappa)
                .sigma(sigma)
                .timeRemaining(timeRemaining)
                .maxInventory(maxInventory)
                .targetInventory(targetInventory)
                .minSpreadBps(minSpreadBps)
                .maxSpreadBps(maxSpreadBps)
                .build();
    }
}
