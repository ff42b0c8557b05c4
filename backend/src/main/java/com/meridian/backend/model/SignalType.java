package com.meridian.backend.model;

public enum SignalType {
    LONG,
    SHORT,
    NEUTRAL;

    public boolean isDirectional() {
        return this != NEUTRAL;
    }
}
