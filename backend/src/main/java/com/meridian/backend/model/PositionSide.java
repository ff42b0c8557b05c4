package com.meridian.backend.model;

public enum PositionSide {
    LONG,
    SHORT
}
