package com.meridian.backend.exception;

public class DataUnavailableException extends PipelineException {

    public DataUnavailableException(String symbol, String message) {
        super(symbol, "FETCHING", message);
    }

    public DataUnavailableException(String symbol, String message, Throwable cause) {
        super(symbol, "FETCHING", message, cause);
    }
}
