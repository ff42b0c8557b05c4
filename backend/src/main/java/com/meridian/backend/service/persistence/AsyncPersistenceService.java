package com.meridian.backend.service.persistence;

import com.meridian.backend.model.PositionEvent;
import com.meridian.backend.model.Signal;
import com.meridian.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget front for the {@link PersistencePort}. Failures are logged and counted
 * and never reach the pipeline or the risk manager.
 */
@Service
@Slf4j
public class AsyncPersistenceService {

    private final PersistencePort persistencePort;
    private final Executor persistenceExecutor;
    private final MetricsService metricsService;

    public AsyncPersistenceService(PersistencePort persistencePort,
                                   @Qualifier("persistenceExecutor") Executor persistenceExecutor,
                                   MetricsService metricsService) {
        this.persistencePort = persistencePort;
        this.persistenceExecutor = persistenceExecutor;
        this.metricsService = metricsService;
    }

    public void saveSignal(Signal signal) {
        submit("signal " + signal.getFingerprint(), () -> persistencePort.saveSignal(signal));
    }

    public void savePositionEvent(PositionEvent event) {
        submit("event " + event.getType() + " for " + event.getPositionId(),
                () -> persistencePort.savePositionEvent(event));
    }

    private void submit(String description, Runnable write) {
        try {
            persistenceExecutor.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException ex) {
                    metricsService.recordPersistenceFailure();
                    log.error("❌ Persisting {} failed: {}", description, ex.getMessage(), ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            metricsService.recordPersistenceFailure();
            log.error("❌ Persistence queue full, dropped {}", description);
        }
    }
}
