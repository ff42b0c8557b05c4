package com.meridian.backend.exception;

public class InsufficientWindowException extends PipelineException {

    public InsufficientWindowException(String symbol, int expected, int actual) {
        super(symbol, "COMPUTING", "Feature window for " + symbol + " has " + actual + " candles, expected " + expected);
    }

    public InsufficientWindowException(String symbol, String message) {
        super(symbol, "COMPUTING", message);
    }
}
