package com.meridian.backend.service.model;

import com.meridian.backend.exception.ModelUnavailableException;
import com.meridian.backend.service.feature.FeatureEngine;
import lombok.extern.slf4j.Slf4j;

/**
 * Placeholder used until a real model bean is provided. Accepts the engine's feature
 * shape and fails every prediction.
 */
@Slf4j
public class UnconfiguredPredictionModel implements PredictionModel {

    @Override
    public int inputDimension() {
        return FeatureEngine.FEATURE_NAMES.size();
    }

    @Override
    public int outputDimension() {
        return ModelOutputLayout.OUTPUT_SIZE;
    }

    @Override
    public double[] predict(double[] features) {
        log.warn("⚠️ Prediction requested but no model is configured");
        throw new ModelUnavailableException(null, "No prediction model is configured");
    }

    @Override
    public String version() {
        return "unconfigured";
    }
}
