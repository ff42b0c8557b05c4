package com.meridian.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "meridian.scheduler")
@Data
@Validated
public class SchedulerProperties {

    private boolean enabled = false;

    @NotNull
    private Duration tickInterval = Duration.ofSeconds(60);

    /** Subtracted from the tick interval to get the default per-run ceiling. */
    @NotNull
    private Duration safetyMargin = Duration.ofSeconds(5);

    /** Overrides the derived per-run ceiling when set. */
    private Duration runTimeout;

    @NotNull
    private List<String> symbols = new ArrayList<>(List.of("BTCUSDT"));

    @Min(1)
    private int workerPoolSize = 4;

    @Min(1)
    private int queueCapacity = 100;

    @Min(1)
    private int maxAttempts = 3;

    @NotNull
    private Duration retryBaseDelay = Duration.ofMillis(500);

    private double retryMultiplier = 2.0;

    @Min(1)
    private int consecutiveFailureAlertThreshold = 5;

    /** Forward directional signals to the risk manager for execution. */
    private boolean autoExecute = false;

    private double defaultQuantity = 1.0;

    public Duration effectiveRunTimeout() {
        if (runTimeout != null) {
            return runTimeout;
        }
        Duration derived = tickInterval.minus(safetyMargin);
        return derived.isNegative() || derived.isZero() ? tickInterval : derived;
    }
}
