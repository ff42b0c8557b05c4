package com.meridian.backend.config;

import com.meridian.backend.exception.PipelineException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    @Bean
    public RateLimiter marketDataRateLimiter(MarketDataProperties properties) {
        return buildMarketDataRateLimiter(properties.getRateLimit());
    }

    @Bean
    public Retry pipelineRunRetry(SchedulerProperties properties) {
        return buildPipelineRunRetry(properties);
    }

    @Bean
    public Retry exitDispatchRetry(RiskProperties properties) {
        return buildExitDispatchRetry(properties.getDispatch());
    }

    public static RateLimiter buildMarketDataRateLimiter(MarketDataProperties.RateLimit rateLimit) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rateLimit.getLimitPerSecond())
                .timeoutDuration(rateLimit.getTimeout())
                .build();
        return RateLimiter.of("market-data", config);
    }

    /**
     * Only failures flagged retryable (rate limits, short history) are retried; shape
     * mismatches and missing data fail the run immediately.
     */
    public static Retry buildPipelineRunRetry(SchedulerProperties properties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(properties.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        properties.getRetryBaseDelay(),
                        properties.getRetryMultiplier()))
                .retryOnException(ex -> ex instanceof PipelineException pe && pe.isRetryable())
                .build();
        return Retry.of("pipeline-run", config);
    }

    public static Retry buildExitDispatchRetry(RiskProperties.Dispatch dispatch) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(dispatch.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        dispatch.getBaseDelay(),
                        dispatch.getMultiplier()))
                .retryExceptions(RuntimeException.class)
                .build();
        return Retry.of("exit-dispatch", config);
    }
}
