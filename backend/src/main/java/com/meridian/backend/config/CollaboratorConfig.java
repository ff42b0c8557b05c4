package com.meridian.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meridian.backend.service.AlertService;
import com.meridian.backend.service.marketdata.CandleSource;
import com.meridian.backend.service.marketdata.UnconfiguredCandleSource;
import com.meridian.backend.service.model.PredictionModel;
import com.meridian.backend.service.model.UnconfiguredPredictionModel;
import com.meridian.backend.service.persistence.LoggingPersistencePort;
import com.meridian.backend.service.persistence.PersistencePort;
import com.meridian.backend.service.risk.CriticalAlertListener;
import com.meridian.backend.service.risk.ExecutionPort;
import com.meridian.backend.service.risk.PaperExecutionPort;
import com.meridian.backend.service.signal.ReconcilerSettings;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Safe defaults for the external collaborators. Any bean of the same type defined by a
 * deployment replaces the default.
 */
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean(CandleSource.class)
    public CandleSource candleSource() {
        return new UnconfiguredCandleSource();
    }

    @Bean
    @ConditionalOnMissingBean(PredictionModel.class)
    public PredictionModel predictionModel() {
        return new UnconfiguredPredictionModel();
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionPort.class)
    public ExecutionPort executionPort(Clock clock) {
        return new PaperExecutionPort(clock);
    }

    @Bean
    @ConditionalOnMissingBean(PersistencePort.class)
    public PersistencePort persistencePort(ObjectMapper objectMapper) {
        return new LoggingPersistencePort(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(CriticalAlertListener.class)
    public AlertService alertService() {
        return new AlertService();
    }

    @Bean
    public ReconcilerSettings reconcilerSettings(SignalProperties signalProperties) {
        return ReconcilerSettings.from(signalProperties);
    }
}
