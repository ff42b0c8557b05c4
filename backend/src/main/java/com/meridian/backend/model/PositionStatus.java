package com.meridian.backend.model;

public enum PositionStatus {
    OPEN,
    PARTIALLY_CLOSED,
    CLOSED
}
