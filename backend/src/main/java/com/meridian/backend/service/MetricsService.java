package com.meridian.backend.service;

import com.meridian.backend.dto.MetricsSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Service
@Slf4j
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, AtomicLong> runsByOutcome = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> actionsByType = new ConcurrentHashMap<>();
    private final AtomicLong signalsEmitted = new AtomicLong();
    private final AtomicLong signalsSuppressed = new AtomicLong();
    private final AtomicLong dispatchFailures = new AtomicLong();
    private final AtomicLong persistenceFailures = new AtomicLong();

    private final Counter signalsEmittedCounter;
    private final Counter signalsSuppressedCounter;
    private final Counter dispatchFailuresCounter;
    private final Counter persistenceFailuresCounter;
    private final Timer runDuration;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.signalsEmittedCounter = Counter.builder("signals_emitted_total").register(meterRegistry);
        this.signalsSuppressedCounter = Counter.builder("signals_suppressed_total").register(meterRegistry);
        this.dispatchFailuresCounter = Counter.builder("exit_dispatch_failures_total").register(meterRegistry);
        this.persistenceFailuresCounter = Counter.builder("persistence_failures_total").register(meterRegistry);
        this.runDuration = Timer.builder("pipeline_run_duration").register(meterRegistry);
    }

    public void recordRun(String outcome, Duration elapsed) {
        runsByOutcome.computeIfAbsent(outcome, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("pipeline_runs_total")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
        runDuration.record(elapsed);
    }

    public void recordSignalEmitted() {
        signalsEmitted.incrementAndGet();
        signalsEmittedCounter.increment();
    }

    public void recordSignalSuppressed() {
        signalsSuppressed.incrementAndGet();
        signalsSuppressedCounter.increment();
    }

    public void recordPositionAction(String type) {
        actionsByType.computeIfAbsent(type, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("position_actions_total")
                .tag("type", type)
                .register(meterRegistry)
                .increment();
    }

    public void recordDispatchFailure() {
        dispatchFailures.incrementAndGet();
        dispatchFailuresCounter.increment();
    }

    public void recordPersistenceFailure() {
        persistenceFailures.incrementAndGet();
        persistenceFailuresCounter.increment();
    }

    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                toCounts(runsByOutcome),
                signalsEmitted.get(),
                signalsSuppressed.get(),
                toCounts(actionsByType),
                dispatchFailures.get(),
                persistenceFailures.get()
        );
    }

    private static Map<String, Long> toCounts(Map<String, AtomicLong> source) {
        return source.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().get()));
    }
}
