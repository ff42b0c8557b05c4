package com.meridian.backend.exception;

public class InferenceTimeoutException extends PipelineException {

    public InferenceTimeoutException(String symbol, long timeoutMs) {
        super(symbol, "COMPUTING", "Model inference for " + symbol + " exceeded " + timeoutMs + "ms");
    }
}
