package com.meridian.backend.controller;

import com.meridian.backend.config.SchedulerProperties;
import com.meridian.backend.dto.PipelineStatusResponse;
import com.meridian.backend.exception.NotFoundException;
import com.meridian.backend.service.AlertService;
import com.meridian.backend.service.MetricsService;
import com.meridian.backend.service.marketdata.MarketDataCache;
import com.meridian.backend.service.model.ModelAdapter;
import com.meridian.backend.service.risk.CriticalAlertListener;
import com.meridian.backend.service.risk.PositionRiskManager;
import com.meridian.backend.service.scheduler.RunResult;
import com.meridian.backend.service.scheduler.SignalScheduler;
import com.meridian.backend.service.signal.SignalDeduplicator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final SignalScheduler signalScheduler;
    private final MarketDataCache marketDataCache;
    private final SignalDeduplicator signalDeduplicator;
    private final PositionRiskManager positionRiskManager;
    private final ModelAdapter modelAdapter;
    private final MetricsService metricsService;
    private final CriticalAlertListener criticalAlertListener;
    private final SchedulerProperties schedulerProperties;
    private final Clock clock;

    @GetMapping("/status")
    public ResponseEntity<PipelineStatusResponse> getStatus() {
        return ResponseEntity.ok(PipelineStatusResponse.builder()
                .timestamp(clock.instant())
                .schedulerEnabled(schedulerProperties.isEnabled())
                .modelVersion(modelAdapter.modelVersion())
                .symbols(signalScheduler.status())
                .cache(marketDataCache.stats())
                .dedup(signalDeduplicator.stats())
                .openPositions(positionRiskManager.openPositions().size())
                .metrics(metricsService.snapshot())
                .recentAlerts(criticalAlertListener instanceof AlertService alertService
                        ? alertService.recentAlerts()
                        : List.of())
                .build());
    }

    @GetMapping("/symbols")
    public ResponseEntity<List<String>> getSymbols() {
        return ResponseEntity.ok(signalScheduler.trackedSymbols());
    }

    @PostMapping("/symbols/{symbol}")
    public ResponseEntity<List<String>> trackSymbol(@PathVariable String symbol) {
        boolean added = signalScheduler.track(symbol);
        log.info("Track request for {} added={}", symbol, added);
        return ResponseEntity.status(added ? HttpStatus.CREATED : HttpStatus.OK)
                .body(signalScheduler.trackedSymbols());
    }

    @DeleteMapping("/symbols/{symbol}")
    public ResponseEntity<Void> untrackSymbol(@PathVariable String symbol) {
        if (!signalScheduler.untrack(symbol)) {
            throw new NotFoundException("Symbol is not tracked: " + symbol);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/symbols/{symbol}/run")
    public ResponseEntity<RunResult> runSymbol(@PathVariable String symbol) {
        log.info("Manual run requested for {}", symbol);
        return ResponseEntity.ok(signalScheduler.runOnce(symbol));
    }
}
