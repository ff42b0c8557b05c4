package com.meridian.backend.exception;

import lombok.Getter;

@Getter
public class InsufficientHistoryException extends PipelineException {

    private final int required;
    private final int available;

    public InsufficientHistoryException(String symbol, int required, int available) {
        super(symbol, "FETCHING", "Insufficient history for " + symbol + ": required=" + required + " available=" + available);
        this.required = required;
        this.available = available;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
