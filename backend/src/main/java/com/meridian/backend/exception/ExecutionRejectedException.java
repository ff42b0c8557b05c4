package com.meridian.backend.exception;

import lombok.Getter;

@Getter
public class ExecutionRejectedException extends TradingException {

    private final String positionId;

    public ExecutionRejectedException(String positionId, String message) {
        super(message);
        this.positionId = positionId;
    }

    public ExecutionRejectedException(String positionId, String message, Throwable cause) {
        super(message, cause);
        this.positionId = positionId;
    }
}
