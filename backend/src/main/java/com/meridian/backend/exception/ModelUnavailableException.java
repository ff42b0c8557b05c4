package com.meridian.backend.exception;

public class ModelUnavailableException extends PipelineException {

    public ModelUnavailableException(String symbol, String message) {
        super(symbol, "COMPUTING", message);
    }

    public ModelUnavailableException(String symbol, String message, Throwable cause) {
        super(symbol, "COMPUTING", message, cause);
    }
}
