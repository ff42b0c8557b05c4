package com.meridian.backend.service.risk;

import com.meridian.backend.exception.ExecutionRejectedException;
import com.meridian.backend.model.CriticalAlert;
import com.meridian.backend.model.PositionAction;
import com.meridian.backend.service.MetricsService;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Sends position actions to the {@link ExecutionPort} with exponential-backoff retries.
 * When the retries are exhausted an operator alert is raised and the failure is rethrown
 * so the caller keeps the position in its previous state.
 */
@Service
@Slf4j
public class ExitDispatcher {

    private final ExecutionPort executionPort;
    private final Retry retry;
    private final CriticalAlertListener alertListener;
    private final MetricsService metricsService;
    private final Clock clock;

    public ExitDispatcher(ExecutionPort executionPort,
                          @Qualifier("exitDispatchRetry") Retry exitDispatchRetry,
                          CriticalAlertListener alertListener,
                          MetricsService metricsService,
                          Clock clock) {
        this.executionPort = executionPort;
        this.retry = exitDispatchRetry;
        this.alertListener = alertListener;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    public ExecutionPort.ExecutionAck dispatch(PositionAction action) {
        Supplier<ExecutionPort.ExecutionAck> call = () -> switch (action.type()) {
            case FULL_CLOSE, PARTIAL_CLOSE -> executionPort.closePosition(action.positionId(), action.fraction(), action.reason());
            case UPDATE_STOP -> executionPort.updateStop(action.positionId(), action.newStopPrice());
        };
        try {
            ExecutionPort.ExecutionAck ack = Retry.decorateSupplier(retry, call).get();
            metricsService.recordPositionAction(action.type().name());
            return ack;
        } catch (RuntimeException ex) {
            metricsService.recordDispatchFailure();
            String message = "Giving up on " + action.type() + " for position " + action.positionId()
                    + " (" + action.reason() + "): " + ex.getMessage();
            log.error("🚨 {}", message, ex);
            alertListener.onCriticalAlert(new CriticalAlert(
                    "EXIT_DISPATCH_FAILED", action.positionId(), action.symbol(), message, clock.instant()));
            if (ex instanceof ExecutionRejectedException rejected) {
                throw rejected;
            }
            throw new ExecutionRejectedException(action.positionId(), message, ex);
        }
    }
}
