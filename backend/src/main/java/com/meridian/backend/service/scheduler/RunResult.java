package com.meridian.backend.service.scheduler;

import com.meridian.backend.model.Signal;

import java.time.Duration;

public record RunResult(String symbol, RunOutcome outcome, Signal signal, Duration elapsed, String error) {

    static RunResult of(String symbol, RunOutcome outcome, Signal signal, Duration elapsed) {
        return new RunResult(symbol, outcome, signal, elapsed, null);
    }

    static RunResult failed(String symbol, Duration elapsed, String error) {
        return new RunResult(symbol, RunOutcome.FAILED, null, elapsed, error);
    }

    static RunResult skipped(String symbol, String reason) {
        return new RunResult(symbol, RunOutcome.SKIPPED, null, Duration.ZERO, reason);
    }
}
