package com.meridian.backend.exception;

import lombok.Getter;

@Getter
public class FeatureShapeMismatchException extends PipelineException {

    private final int expected;
    private final int actual;

    public FeatureShapeMismatchException(String symbol, String what, int expected, int actual) {
        super(symbol, "COMPUTING", what + " shape mismatch for " + symbol + ": expected=" + expected + " actual=" + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
