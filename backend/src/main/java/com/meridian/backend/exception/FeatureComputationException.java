package com.meridian.backend.exception;

public class FeatureComputationException extends PipelineException {

    public FeatureComputationException(String symbol, String message) {
        super(symbol, "COMPUTING", message);
    }
}
