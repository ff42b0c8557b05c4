package com.meridian.backend.service.signal;

import com.meridian.backend.config.SignalProperties;
import com.meridian.backend.model.Horizon;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable reconciliation parameters. A configuration change means building a new
 * instance; nothing here is mutated while runs are in flight.
 */
public record ReconcilerSettings(
        String strategyId,
        Map<Horizon, Double> weights,
        double lowThreshold,
        double highThreshold,
        double minConfidence,
        double minAgreement,
        double stopLossMin,
        double stopLossMax,
        double takeProfitMin,
        double takeProfitMax,
        List<Double> takeProfitLadder,
        Duration ttl,
        Duration dedupBucket
) {
    private static final double WEIGHT_TOLERANCE = 1e-6;

    public ReconcilerSettings {
        EnumMap<Horizon, Double> copy = new EnumMap<>(Horizon.class);
        copy.putAll(weights);
        if (copy.size() != Horizon.values().length) {
            throw new IllegalArgumentException("Expected a weight for every horizon, got " + copy.keySet());
        }
        double sum = 0.0;
        for (double weight : copy.values()) {
            if (weight < 0) {
                throw new IllegalArgumentException("Horizon weights must be non-negative: " + copy);
            }
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("Horizon weights must sum to 1.0, got " + sum);
        }
        if (lowThreshold >= highThreshold) {
            throw new IllegalArgumentException("Low threshold " + lowThreshold + " must be below high threshold " + highThreshold);
        }
        if (stopLossMin <= 0 || stopLossMin > stopLossMax) {
            throw new IllegalArgumentException("Invalid stop-loss band [" + stopLossMin + ", " + stopLossMax + "]");
        }
        if (takeProfitMin <= 0 || takeProfitMin > takeProfitMax) {
            throw new IllegalArgumentException("Invalid take-profit band [" + takeProfitMin + ", " + takeProfitMax + "]");
        }
        for (double step : takeProfitLadder) {
            if (step <= 0 || step > 1.0) {
                throw new IllegalArgumentException("Take-profit ladder steps must be in (0, 1]: " + takeProfitLadder);
            }
        }
        if (ttl.isNegative() || ttl.isZero() || dedupBucket.getSeconds() < 1) {
            throw new IllegalArgumentException("Signal ttl must be positive and the dedup bucket at least one second");
        }
        if (ttl.compareTo(dedupBucket) < 0) {
            throw new IllegalArgumentException("Signal ttl " + ttl + " must cover the dedup bucket " + dedupBucket
                    + " or a duplicate could be emitted inside one bucket");
        }
        weights = Collections.unmodifiableMap(copy);
        takeProfitLadder = List.copyOf(takeProfitLadder);
    }

    public static ReconcilerSettings from(SignalProperties properties) {
        List<Double> configured = properties.getHorizonWeights();
        Horizon[] horizons = Horizon.values();
        if (configured.size() != horizons.length) {
            throw new IllegalArgumentException("Expected " + horizons.length + " horizon weights, got " + configured.size());
        }
        Map<Horizon, Double> weights = new EnumMap<>(Horizon.class);
        for (int i = 0; i < horizons.length; i++) {
            weights.put(horizons[i], configured.get(i));
        }
        return new ReconcilerSettings(
                properties.getStrategyId(),
                weights,
                properties.getLowThreshold(),
                properties.getHighThreshold(),
                properties.getMinConfidence(),
                properties.getMinAgreement(),
                properties.getStopLoss().getMin(),
                properties.getStopLoss().getMax(),
                properties.getTakeProfit().getMin(),
                properties.getTakeProfit().getMax(),
                properties.getTakeProfitLadder(),
                properties.getTtl(),
                properties.getDedupBucket()
        );
    }

    public static ReconcilerSettings defaults() {
        return from(new SignalProperties());
    }

    public double weight(Horizon horizon) {
        return weights.get(horizon);
    }
}
