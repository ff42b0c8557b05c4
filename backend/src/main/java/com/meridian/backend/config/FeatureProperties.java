package com.meridian.backend.config;

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
@ConfigurationProperties(prefix = "meridian.features")
@Data
@Validated
public class FeatureProperties {

    @Min(30)
    private int lookback = 96;

    @NotNull
    private Duration cacheTtl = Duration.ofSeconds(90);

    @Valid
    private Macd macd = new Macd();
    @Valid
    private Adx adx = new Adx();
    @Valid
    private Rsi rsi = new Rsi();
    @Valid
    private Atr atr = new Atr();
    @Valid
    private Bollinger bollinger = new Bollinger();
    @Valid
    private Keltner keltner = new Keltner();
    @Valid
    private Stochastic stochastic = new Stochastic();
    @Valid
    private Channel channel = new Channel();

    @Data
    public static class Macd {
        @Positive
        private int fastPeriod = 12;
        @Positive
        private int slowPeriod = 26;
        @Positive
        private int signalPeriod = 9;
    }

    @Data
    public static class Adx {
        @Positive
        private int period = 14;
    }

    @Data
    public static class Rsi {
        @Positive
        private int period = 14;
    }

    @Data
    public static class Atr {
        @Positive
        private int period = 14;
    }

    @Data
    public static class Bollinger {
        @Positive
        private int period = 20;
        @Positive
        private double deviation = 2.0;
    }

    @Data
    public static class Keltner {
        @Positive
        private int period = 20;
        @Positive
        private double atrMultiplier = 1.5;
    }

    @Data
    public static class Stochastic {
        @Positive
        private int period = 14;
        @Positive
        private int smoothing = 3;
    }

    @Data
    public static class Channel {
        @Positive
        private int donchianPeriod = 20;
        @Positive
        private int choppinessPeriod = 14;
    }
}
