package com.meridian.backend.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;

@Getter
@RequiredArgsConstructor
public enum Timeframe {
    M1("1", Duration.ofMinutes(1)),
    M5("5", Duration.ofMinutes(5)),
    M15("15", Duration.ofMinutes(15)),
    H1("60", Duration.ofHours(1)),
    H4("240", Duration.ofHours(4)),
    D1("D", Duration.ofDays(1));

    private final String code;
    private final Duration duration;

    public static Timeframe fromCode(String code) {
        String normalized = code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(tf -> tf.code.equals(normalized) || tf.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported timeframe: " + code));
    }
}
