package com.meridian.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "meridian.signal")
@Data
@Validated
public class SignalProperties {

    @NotBlank
    private String strategyId = "patchtst_ml";

    /** Weights for 15m, 1h, 4h, 12h in that order. */
    @NotNull
    @Size(min = 4, max = 4)
    private List<Double> horizonWeights = List.of(0.4, 0.3, 0.2, 0.1);

    private double lowThreshold = 0.5;
    private double highThreshold = 1.5;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidence = 0.45;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minAgreement = 0.5;

    private Band stopLoss = new Band(0.005, 0.025);
    private Band takeProfit = new Band(0.01, 0.05);

    /** Fractions of the take-profit distance at which ladder prices are placed. */
    @NotNull
    private List<Double> takeProfitLadder = List.of(0.5, 1.0);

    @NotNull
    private Duration ttl = Duration.ofMinutes(5);

    @NotNull
    private Duration dedupBucket = Duration.ofMinutes(5);

    @Data
    public static class Band {
        private double min;
        private double max;

        public Band() {
        }

        public Band(double min, double max) {
            this.min = min;
            this.max = max;
        }
    }
}
