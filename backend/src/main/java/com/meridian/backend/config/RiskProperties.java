package com.meridian.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "meridian.risk")
@Data
@Validated
public class RiskProperties {

    @Valid
    private Trailing trailing = new Trailing();

    /** Take-profit schedule as (distance from entry, fraction of quantity) pairs. */
    @NotNull
    @Valid
    private List<Level> takeProfitLevels = new ArrayList<>(List.of(
            new Level(0.01, 0.3),
            new Level(0.02, 0.3),
            new Level(0.03, 0.4)
    ));

    /** Initial stop distance when the signal carries no stop-loss price. */
    @Positive
    private double defaultStopDistance = 0.02;

    private boolean breakevenAfterFirstTarget = true;

    @Valid
    private Dispatch dispatch = new Dispatch();

    @Data
    public static class Trailing {
        private boolean enabled = true;

        /** Unrealized return at which trailing starts, e.g. 0.015 = +1.5%. */
        @Positive
        private double activationProfit = 0.015;

        /** Trail distance as a fraction of the water mark. */
        @Positive
        private double distance = 0.005;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Level {
        @Positive
        private double distance;
        @Positive
        private double fraction;
    }

    @Data
    public static class Dispatch {
        @Min(1)
        private int maxAttempts = 5;

        @NotNull
        private Duration baseDelay = Duration.ofMillis(200);

        private double multiplier = 2.0;
    }
}
