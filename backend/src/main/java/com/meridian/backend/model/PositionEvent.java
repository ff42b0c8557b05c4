package com.meridian.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PositionEvent {
    String positionId;
    String symbol;
    EventType type;
    double price;
    Double stopLossPrice;
    double closedFraction;
    PositionStatus status;
    String detail;
    Instant timestamp;

    public enum EventType {
        OPENED,
        STOP_UPDATED,
        TRAILING_ACTIVATED,
        PARTIAL_CLOSED,
        CLOSED,
        DISPATCH_FAILED
    }
}
