package com.meridian.backend.service.scheduler;

import com.meridian.backend.model.SymbolRunState;

import java.time.Instant;

public record SymbolRunStatus(
        String symbol,
        SymbolRunState state,
        RunOutcome lastOutcome,
        String lastError,
        Instant lastRunAt,
        int consecutiveFailures,
        long totalRuns
) {}
