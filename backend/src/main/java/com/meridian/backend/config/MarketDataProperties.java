package com.meridian.backend.config;

import com.meridian.backend.model.Timeframe;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "meridian.market-data")
@Data
@Validated
public class MarketDataProperties {

    @NotNull
    private Timeframe timeframe = Timeframe.M15;

    /** Idle time after which a symbol's series is evicted. */
    @NotNull
    private Duration ttl = Duration.ofMinutes(30);

    @Min(1)
    private int maxCandles = 1000;

    /** How old a cached series may be and still be served when the upstream fails. */
    @NotNull
    private Duration stalenessTolerance = Duration.ofMinutes(30);

    @NotNull
    private Duration fetchTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration evictionInterval = Duration.ofMinutes(1);

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class RateLimit {
        @Positive
        private int limitPerSecond = 8;

        @NotNull
        private Duration timeout = Duration.ofSeconds(2);
    }
}
