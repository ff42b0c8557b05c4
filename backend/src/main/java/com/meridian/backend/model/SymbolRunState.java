package com.meridian.backend.model;

public enum SymbolRunState {
    IDLE,
    FETCHING,
    COMPUTING,
    EMITTING,
    FAILED
}
