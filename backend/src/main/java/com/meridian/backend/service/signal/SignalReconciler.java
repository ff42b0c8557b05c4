package com.meridian.backend.service.signal;

import com.meridian.backend.model.Direction;
import com.meridian.backend.model.Horizon;
import com.meridian.backend.model.HorizonPrediction;
import com.meridian.backend.model.ModelPrediction;
import com.meridian.backend.model.Signal;
import com.meridian.backend.model.SignalType;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the per-horizon predictions into one signal. Stateless apart from its immutable
 * settings; the same prediction, price and clock value always give the same signal.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SignalReconciler {

    @Getter
    private final ReconcilerSettings settings;

    public Signal reconcile(ModelPrediction prediction, double referencePrice, Instant now) {
        if (!(referencePrice > 0) || !Double.isFinite(referencePrice)) {
            throw new IllegalArgumentException("Reference price must be positive: " + referencePrice);
        }
        List<Horizon> byWeight = horizonsByWeight();

        double score = 0.0;
        double weightedConfidence = 0.0;
        Map<Direction, Integer> votes = new EnumMap<>(Direction.class);
        for (Horizon horizon : Horizon.values()) {
            HorizonPrediction hp = prediction.get(horizon);
            double weight = settings.weight(horizon);
            score += weight * hp.direction().getValue();
            weightedConfidence += weight * hp.confidence();
            votes.merge(hp.direction(), 1, Integer::sum);
        }

        Direction majority = majority(votes, prediction, byWeight);
        double agreement = (double) votes.get(majority) / Horizon.values().length;
        double confidence = clamp01(weightedConfidence * agreement);

        SignalType type = SignalType.NEUTRAL;
        if (score < settings.lowThreshold()) {
            type = SignalType.SHORT;
        } else if (score > settings.highThreshold()) {
            type = SignalType.LONG;
        }
        if (type.isDirectional() && (confidence < settings.minConfidence() || agreement < settings.minAgreement())) {
            log.debug("Demoted {} to NEUTRAL symbol={} confidence={} agreement={}",
                    type, prediction.symbol(), confidence, agreement);
            type = SignalType.NEUTRAL;
        }

        Signal.SignalBuilder builder = Signal.builder()
                .symbol(prediction.symbol())
                .signalType(type)
                .confidence(confidence)
                .agreementRatio(agreement)
                .directionScore(score)
                .primaryHorizon(primaryHorizon(type, prediction, byWeight))
                .referencePrice(referencePrice)
                .strategyId(settings.strategyId())
                .fingerprint(SignalFingerprint.of(prediction.symbol(), type, settings.strategyId(), now, settings.dedupBucket()))
                .createdAt(now)
                .expiresAt(now.plus(settings.ttl()));

        if (type.isDirectional()) {
            applyLevels(builder, type, prediction, referencePrice);
        }
        return builder.build();
    }

    private void applyLevels(Signal.SignalBuilder builder, SignalType type, ModelPrediction prediction, double referencePrice) {
        double minReturn = Double.POSITIVE_INFINITY;
        double maxReturn = Double.NEGATIVE_INFINITY;
        for (HorizonPrediction hp : prediction.horizons().values()) {
            minReturn = Math.min(minReturn, hp.predictedReturn());
            maxReturn = Math.max(maxReturn, hp.predictedReturn());
        }

        double stopPct;
        double targetPct;
        if (type == SignalType.LONG) {
            stopPct = Math.abs(minReturn);
            targetPct = maxReturn;
        } else {
            stopPct = maxReturn;
            targetPct = Math.abs(minReturn);
        }
        stopPct = clamp(stopPct, settings.stopLossMin(), settings.stopLossMax());
        targetPct = clamp(targetPct, settings.takeProfitMin(), settings.takeProfitMax());

        double sign = type == SignalType.LONG ? 1.0 : -1.0;
        builder.stopLossPrice(referencePrice * (1.0 - sign * stopPct));
        for (double step : settings.takeProfitLadder()) {
            builder.takeProfitPrice(referencePrice * (1.0 + sign * targetPct * step));
        }
    }

    /**
     * Most voted direction. A tie prefers FLAT, then the direction of the heaviest tied horizon.
     */
    private Direction majority(Map<Direction, Integer> votes, ModelPrediction prediction, List<Horizon> byWeight) {
        int top = votes.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        Set<Direction> tied = EnumSet.noneOf(Direction.class);
        votes.forEach((direction, count) -> {
            if (count == top) {
                tied.add(direction);
            }
        });
        if (tied.size() == 1) {
            return tied.iterator().next();
        }
        if (tied.contains(Direction.FLAT)) {
            return Direction.FLAT;
        }
        for (Horizon horizon : byWeight) {
            Direction direction = prediction.get(horizon).direction();
            if (tied.contains(direction)) {
                return direction;
            }
        }
        return Direction.FLAT;
    }

    private Horizon primaryHorizon(SignalType type, ModelPrediction prediction, List<Horizon> byWeight) {
        if (type.isDirectional()) {
            Direction wanted = type == SignalType.LONG ? Direction.UP : Direction.DOWN;
            for (Horizon horizon : byWeight) {
                if (prediction.get(horizon).direction() == wanted) {
                    return horizon;
                }
            }
        }
        return byWeight.get(0);
    }

    // stable sort keeps the shorter horizon first on equal weights
    private List<Horizon> horizonsByWeight() {
        return Arrays.stream(Horizon.values())
                .sorted(Comparator.comparingDouble((Horizon h) -> settings.weight(h)).reversed())
                .toList();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double clamp01(double value) {
        return clamp(value, 0.0, 1.0);
    }
}
