package com.meridian.backend.dto;

import java.util.Map;

public record MetricsSnapshot(
        Map<String, Long> runsByOutcome,
        long signalsEmitted,
        long signalsSuppressed,
        Map<String, Long> positionActionsByType,
        long exitDispatchFailures,
        long persistenceFailures
) {}
