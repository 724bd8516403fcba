package com.quantcore.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "indicator")
@Data
@Validated
public class IndicatorProperties {

    @Valid
    private Cache cache = new Cache();

    @Data
    public static class Cache {
        @NotNull
        private Duration ttl = Duration.ofSeconds(60);
        /** Width of the time bucket the latest bar's timestamp is truncated to. */
        @NotNull
        private Duration bucket = Duration.ofMinutes(1);
    }
}
