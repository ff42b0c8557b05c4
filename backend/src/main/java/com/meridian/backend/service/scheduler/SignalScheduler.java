package com.meridian.backend.service.scheduler;

import com.meridian.backend.config.SchedulerProperties;
import com.meridian.backend.exception.FeatureShapeMismatchException;
import com.meridian.backend.exception.PipelineException;
import com.meridian.backend.model.SymbolRunState;
import com.meridian.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans each tick out to one pipeline run per tracked symbol on the bounded worker pool.
 * <p>
 * A symbol whose previous run is still in flight is skipped for the tick. Every run is
 * watched: once it exceeds the run timeout it is cancelled. Failures are contained here,
 * recorded against the symbol and never reach the tick driver, so a failing symbol is
 * attempted again on the next tick.
 */
@Service
@Slf4j
public class SignalScheduler {

    private final SymbolPipelineRunner runner;
    private final SchedulerProperties properties;
    private final AsyncTaskExecutor workerExecutor;
    private final TaskScheduler taskScheduler;
    private final MetricsService metricsService;
    private final Clock clock;

    private final Set<String> tracked = ConcurrentHashMap.newKeySet();
    private final Map<String, SymbolTracker> trackers = new ConcurrentHashMap<>();
    private final Map<String, Future<RunResult>> inFlight = new ConcurrentHashMap<>();

    public SignalScheduler(SymbolPipelineRunner runner,
                           SchedulerProperties properties,
                           @Qualifier("signalWorkerExecutor") AsyncTaskExecutor workerExecutor,
                           @Qualifier("taskScheduler") TaskScheduler taskScheduler,
                           MetricsService metricsService,
                           Clock clock) {
        this.runner = runner;
        this.properties = properties;
        this.workerExecutor = workerExecutor;
        this.taskScheduler = taskScheduler;
        this.metricsService = metricsService;
        this.clock = clock;
        properties.getSymbols().forEach(this::track);
    }

    public boolean track(String symbol) {
        String normalized = normalize(symbol);
        trackers.computeIfAbsent(normalized, SymbolTracker::new);
        boolean added = tracked.add(normalized);
        if (added) {
            log.info("➕ Tracking {}", normalized);
        }
        return added;
    }

    public boolean untrack(String symbol) {
        String normalized = normalize(symbol);
        boolean removed = tracked.remove(normalized);
        if (removed) {
            trackers.remove(normalized);
            log.info("➖ Stopped tracking {}", normalized);
        }
        return removed;
    }

    public List<String> trackedSymbols() {
        return tracked.stream().sorted().toList();
    }

    /**
     * Submits one run per tracked symbol from a snapshot of the tracked set.
     *
     * @return the runs submitted on this tick, by symbol
     */
    public Map<String, Future<RunResult>> tick() {
        List<String> snapshot = trackedSymbols();
        Map<String, Future<RunResult>> submitted = new LinkedHashMap<>();
        int skipped = 0;
        for (String symbol : snapshot) {
            Future<RunResult> future = submit(symbol);
            if (future != null) {
                submitted.put(symbol, future);
            } else {
                skipped++;
            }
        }
        log.debug("Tick submitted={} skipped={} tracked={}", submitted.size(), skipped, snapshot.size());
        return submitted;
    }

    /**
     * Runs one symbol on demand and waits for the result.
     */
    public RunResult runOnce(String symbol) {
        String normalized = normalize(symbol);
        Future<RunResult> future = submit(normalized);
        if (future == null) {
            return RunResult.skipped(normalized, "A run is already in flight or the worker queue is full");
        }
        Duration timeout = properties.effectiveRunTimeout();
        try {
            return future.get(timeout.toMillis() + 1_000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return RunResult.failed(normalized, Duration.ZERO, "Interrupted while waiting for run");
        } catch (CancellationException | TimeoutException ex) {
            future.cancel(true);
            return RunResult.failed(normalized, timeout, "Run exceeded " + timeout.toMillis() + "ms");
        } catch (ExecutionException ex) {
            return RunResult.failed(normalized, Duration.ZERO, ex.getCause().getMessage());
        }
    }

    public List<SymbolRunStatus> status() {
        List<SymbolRunStatus> statuses = new ArrayList<>();
        for (SymbolTracker tracker : trackers.values()) {
            statuses.add(tracker.snapshot());
        }
        statuses.sort(Comparator.comparing(SymbolRunStatus::symbol));
        return statuses;
    }

    public SymbolRunState state(String symbol) {
        SymbolTracker tracker = trackers.get(normalize(symbol));
        return tracker != null ? tracker.state : null;
    }

    private Future<RunResult> submit(String symbol) {
        Future<RunResult> previous = inFlight.get(symbol);
        if (previous != null && !previous.isDone()) {
            log.info("⏭️ Skipping {}: previous run still in flight", symbol);
            metricsService.recordRun(RunOutcome.SKIPPED.metricTag(), Duration.ZERO);
            return null;
        }
        Future<RunResult> future;
        try {
            future = workerExecutor.submit(() -> execute(symbol));
        } catch (RejectedExecutionException ex) {
            log.warn("⚠️ Worker queue full, {} not scheduled this tick", symbol);
            metricsService.recordRun(RunOutcome.SKIPPED.metricTag(), Duration.ZERO);
            return null;
        }
        inFlight.put(symbol, future);
        Duration timeout = properties.effectiveRunTimeout();
        taskScheduler.schedule(() -> cancelIfOverrun(symbol, future, timeout), clock.instant().plus(timeout));
        return future;
    }

    private void cancelIfOverrun(String symbol, Future<RunResult> future, Duration timeout) {
        if (!future.isDone()) {
            log.warn("⏱️ Run for {} exceeded {}ms, cancelling", symbol, timeout.toMillis());
            future.cancel(true);
        }
    }

    private RunResult execute(String symbol) {
        SymbolTracker tracker = trackers.computeIfAbsent(symbol, SymbolTracker::new);
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put("symbol", symbol);
        MDC.put("runId", runId);
        Instant started = clock.instant();
        try {
            RunResult result = runner.run(symbol, state -> tracker.state = state);
            tracker.succeeded(result, started);
            metricsService.recordRun(result.outcome().metricTag(), result.elapsed());
            log.debug("Run finished symbol={} outcome={} elapsedMs={}", symbol, result.outcome(), result.elapsed().toMillis());
            return result;
        } catch (RuntimeException ex) {
            Duration elapsed = Duration.between(started, clock.instant());
            SymbolRunState failedIn = tracker.state;
            tracker.failed(ex, started);
            metricsService.recordRun(RunOutcome.FAILED.metricTag(), elapsed);
            logFailure(symbol, failedIn, tracker.consecutiveFailures, ex);
            tracker.state = SymbolRunState.IDLE;
            return RunResult.failed(symbol, elapsed, ex.getMessage());
        } finally {
            MDC.remove("symbol");
            MDC.remove("runId");
        }
    }

    private void logFailure(String symbol, SymbolRunState stage, int consecutive, RuntimeException ex) {
        if (ex instanceof FeatureShapeMismatchException) {
            log.error("❌ Run failed symbol={} stage={} consecutive={} error={}", symbol, stage, consecutive, ex.getMessage());
        } else if (ex instanceof PipelineException) {
            log.warn("⚠️ Run failed symbol={} stage={} consecutive={} error={}", symbol, stage, consecutive, ex.getMessage());
        } else {
            log.error("❌ Unexpected failure symbol={} stage={} consecutive={}", symbol, stage, consecutive, ex);
        }
        int threshold = properties.getConsecutiveFailureAlertThreshold();
        if (consecutive >= threshold && consecutive % threshold == 0) {
            log.error("🚨 {} has failed {} runs in a row", symbol, consecutive);
        }
    }

    private static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol must not be blank");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    private static final class SymbolTracker {
        private final String symbol;
        private volatile SymbolRunState state = SymbolRunState.IDLE;
        private volatile RunOutcome lastOutcome;
        private volatile String lastError;
        private volatile Instant lastRunAt;
        private volatile int consecutiveFailures;
        private volatile long totalRuns;

        private SymbolTracker(String symbol) {
            this.symbol = symbol;
        }

        private synchronized void succeeded(RunResult result, Instant startedAt) {
            state = SymbolRunState.IDLE;
            lastOutcome = result.outcome();
            lastError = null;
            lastRunAt = startedAt;
            consecutiveFailures = 0;
            totalRuns++;
        }

        private synchronized void failed(RuntimeException ex, Instant startedAt) {
            state = SymbolRunState.FAILED;
            lastOutcome = RunOutcome.FAILED;
            lastError = ex.getMessage();
            lastRunAt = startedAt;
            consecutiveFailures++;
            totalRuns++;
        }

        private SymbolRunStatus snapshot() {
            return new SymbolRunStatus(symbol, state, lastOutcome, lastError, lastRunAt, consecutiveFailures, totalRuns);
        }
    }
}
