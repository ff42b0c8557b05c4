package com.meridian.backend.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * Forward-looking prediction windows, declared in ascending order. The model output
 * layout depends on this order.
 */
@Getter
@RequiredArgsConstructor
public enum Horizon {
    M15("15m", Duration.ofMinutes(15)),
    H1("1h", Duration.ofHours(1)),
    H4("4h", Duration.ofHours(4)),
    H12("12h", Duration.ofHours(12));

    private final String label;
    private final Duration duration;
}
