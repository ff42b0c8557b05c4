package com.meridian.backend.service.scheduler;

import com.meridian.backend.config.FeatureProperties;
import com.meridian.backend.config.MarketDataProperties;
import com.meridian.backend.config.SchedulerProperties;
import com.meridian.backend.exception.ExecutionRejectedException;
import com.meridian.backend.exception.PipelineException;
import com.meridian.backend.model.Candle;
import com.meridian.backend.model.FeatureVector;
import com.meridian.backend.model.ModelPrediction;
import com.meridian.backend.model.Signal;
import com.meridian.backend.model.SymbolRunState;
import com.meridian.backend.service.MetricsService;
import com.meridian.backend.service.feature.FeatureVectorCache;
import com.meridian.backend.service.marketdata.MarketDataCache;
import com.meridian.backend.service.model.ModelAdapter;
import com.meridian.backend.service.persistence.AsyncPersistenceService;
import com.meridian.backend.service.risk.PositionRiskManager;
import com.meridian.backend.service.signal.SignalDeduplicator;
import com.meridian.backend.service.signal.SignalReconciler;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * One pipeline run for one symbol: window, features, inference, reconciliation, then
 * dedup and emission. The stages up to reconciliation are retried as a unit for
 * retryable failures; emission happens at most once per run.
 */
@Component
@Slf4j
public class SymbolPipelineRunner {

    private final MarketDataCache marketDataCache;
    private final FeatureVectorCache featureVectorCache;
    private final ModelAdapter modelAdapter;
    private final SignalReconciler signalReconciler;
    private final SignalDeduplicator signalDeduplicator;
    private final AsyncPersistenceService persistenceService;
    private final PositionRiskManager positionRiskManager;
    private final MetricsService metricsService;
    private final Retry retry;
    private final MarketDataProperties marketDataProperties;
    private final FeatureProperties featureProperties;
    private final SchedulerProperties schedulerProperties;
    private final Clock clock;

    public SymbolPipelineRunner(MarketDataCache marketDataCache,
                                FeatureVectorCache featureVectorCache,
                                ModelAdapter modelAdapter,
                                SignalReconciler signalReconciler,
                                SignalDeduplicator signalDeduplicator,
                                AsyncPersistenceService persistenceService,
                                PositionRiskManager positionRiskManager,
                                MetricsService metricsService,
                                @Qualifier("pipelineRunRetry") Retry pipelineRunRetry,
                                MarketDataProperties marketDataProperties,
                                FeatureProperties featureProperties,
                                SchedulerProperties schedulerProperties,
                                Clock clock) {
        this.marketDataCache = marketDataCache;
        this.featureVectorCache = featureVectorCache;
        this.modelAdapter = modelAdapter;
        this.signalReconciler = signalReconciler;
        this.signalDeduplicator = signalDeduplicator;
        this.persistenceService = persistenceService;
        this.positionRiskManager = positionRiskManager;
        this.metricsService = metricsService;
        this.retry = pipelineRunRetry;
        this.marketDataProperties = marketDataProperties;
        this.featureProperties = featureProperties;
        this.schedulerProperties = schedulerProperties;
        this.clock = clock;
    }

    /**
     * @throws PipelineException when a stage fails after any retries
     */
    public RunResult run(String symbol, Consumer<SymbolRunState> stateSink) {
        Instant started = clock.instant();
        Signal signal = Retry.decorateSupplier(retry, () -> produce(symbol, stateSink)).get();

        stateSink.accept(SymbolRunState.EMITTING);
        if (Thread.currentThread().isInterrupted()) {
            throw new PipelineException(symbol, SymbolRunState.EMITTING.name(), "Run cancelled before emission");
        }
        RunOutcome outcome = emit(signal);
        return RunResult.of(symbol, outcome, signal, Duration.between(started, clock.instant()));
    }

    private Signal produce(String symbol, Consumer<SymbolRunState> stateSink) {
        stateSink.accept(SymbolRunState.FETCHING);
        List<Candle> window = marketDataCache.getWindow(symbol, marketDataProperties.getTimeframe(), featureProperties.getLookback());

        stateSink.accept(SymbolRunState.COMPUTING);
        FeatureVector features = featureVectorCache.computeIfAbsent(window);
        ModelPrediction prediction = modelAdapter.infer(features);
        double referencePrice = window.get(window.size() - 1).getClose();
        return signalReconciler.reconcile(prediction, referencePrice, clock.instant());
    }

    private RunOutcome emit(Signal signal) {
        if (!signal.getSignalType().isDirectional()) {
            log.debug("Neutral signal symbol={} score={} confidence={}",
                    signal.getSymbol(), signal.getDirectionScore(), signal.getConfidence());
            return RunOutcome.NEUTRAL;
        }
        if (!signalDeduplicator.tryRegister(signal)) {
            metricsService.recordSignalSuppressed();
            return RunOutcome.SUPPRESSED;
        }
        persistenceService.saveSignal(signal);
        metricsService.recordSignalEmitted();
        log.info("📡 Signal {} {} confidence={} agreement={} stop={} targets={} fingerprint={}",
                signal.getSignalType(), signal.getSymbol(), String.format("%.3f", signal.getConfidence()),
                signal.getAgreementRatio(), signal.getStopLossPrice(), signal.getTakeProfitPrices(), signal.getFingerprint());

        if (schedulerProperties.isAutoExecute()) {
            try {
                positionRiskManager.onSignal(signal, schedulerProperties.getDefaultQuantity());
            } catch (ExecutionRejectedException ex) {
                log.error("❌ Entry rejected for {} fingerprint={}: {}", signal.getSymbol(), signal.getFingerprint(), ex.getMessage());
            }
        }
        return RunOutcome.EMITTED;
    }
}
