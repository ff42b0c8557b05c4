package com.meridian.backend.exception;

import lombok.Getter;

/**
 * Base for failures raised inside a single symbol's pipeline run. Carries the symbol and
 * the stage so the scheduler can log and count without inspecting messages.
 */
@Getter
public class PipelineException extends RuntimeException {

    private final String symbol;
    private final String stage;

    public PipelineException(String symbol, String stage, String message) {
        super(message);
        this.symbol = symbol;
        this.stage = stage;
    }

    public PipelineException(String symbol, String stage, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
        this.stage = stage;
    }

    /**
     * Whether the same run may succeed if attempted again shortly.
     */
    public boolean isRetryable() {
        return false;
    }
}
