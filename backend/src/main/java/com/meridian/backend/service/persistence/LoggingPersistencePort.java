package com.meridian.backend.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meridian.backend.model.PositionEvent;
import com.meridian.backend.model.Signal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Default sink that writes each record as one JSON log line.
 */
@Slf4j
@RequiredArgsConstructor
public class LoggingPersistencePort implements PersistencePort {

    private final ObjectMapper objectMapper;

    @Override
    public void saveSignal(Signal signal) {
        log.info("📡 signal {}", toJson(signal));
    }

    @Override
    public void savePositionEvent(PositionEvent event) {
        log.info("📒 position-event {}", toJson(event));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize " + value.getClass().getSimpleName(), ex);
        }
    }
}
