package com.meridian.backend.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record ModelPrediction(
        String symbol,
        Instant asOf,
        String modelVersion,
        Map<Horizon, HorizonPrediction> horizons
) {
    public ModelPrediction {
        EnumMap<Horizon, HorizonPrediction> copy = new EnumMap<>(Horizon.class);
        copy.putAll(horizons);
        horizons = Collections.unmodifiableMap(copy);
    }

    public HorizonPrediction get(Horizon horizon) {
        HorizonPrediction prediction = horizons.get(horizon);
        if (prediction == null) {
            throw new IllegalArgumentException("No prediction for horizon " + horizon);
        }
        return prediction;
    }
}
