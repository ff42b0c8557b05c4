package com.meridian.backend.service.model;

/**
 * A trained model seen as an opaque function from a feature vector to a raw output
 * array laid out as described by {@link ModelOutputLayout}. Implementations must be
 * safe to call from several threads.
 */
public interface PredictionModel {

    int inputDimension();

    int outputDimension();

    double[] predict(double[] features);

    String version();
}
