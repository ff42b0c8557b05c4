package com.meridian.backend.service.persistence;

import com.meridian.backend.model.PositionEvent;
import com.meridian.backend.model.Signal;

/**
 * Sink for emitted signals and position audit events. Implementations may block; the
 * pipeline only reaches them through {@link AsyncPersistenceService}.
 */
public interface PersistencePort {

    void saveSignal(Signal signal);

    void savePositionEvent(PositionEvent event);
}
