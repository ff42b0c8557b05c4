package com.meridian.backend.exception;

public class RateLimitedException extends PipelineException {

    public RateLimitedException(String symbol, String message) {
        super(symbol, "FETCHING", message);
    }

    public RateLimitedException(String symbol, String message, Throwable cause) {
        super(symbol, "FETCHING", message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
