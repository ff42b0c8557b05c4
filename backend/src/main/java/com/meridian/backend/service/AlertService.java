package com.meridian.backend.service;

import com.meridian.backend.model.CriticalAlert;
import com.meridian.backend.service.risk.CriticalAlertListener;
import lombok.extern.slf4j.Slf4j;

import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Default alert sink: logs at error level and keeps the latest alerts for the status API.
 */
@Slf4j
public class AlertService implements CriticalAlertListener {

    private static final int RETAINED = 50;

    private final Deque<CriticalAlert> recent = new ConcurrentLinkedDeque<>();

    @Override
    public void onCriticalAlert(CriticalAlert alert) {
        log.error("🚨 CRITICAL [{}] symbol={} positionId={} {}",
                alert.type(), alert.symbol(), alert.positionId(), alert.message());
        recent.addFirst(alert);
        while (recent.size() > RETAINED) {
            recent.pollLast();
        }
    }

    public List<CriticalAlert> recentAlerts() {
        return List.copyOf(recent);
    }
}
