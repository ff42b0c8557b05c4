package com.meridian.backend.model;

import java.time.Instant;

public record CriticalAlert(String type, String positionId, String symbol, String message, Instant timestamp) {}
