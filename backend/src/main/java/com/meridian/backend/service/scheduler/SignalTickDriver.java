package com.meridian.backend.service.scheduler;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "meridian.scheduler.enabled", havingValue = "true")
public class SignalTickDriver {

    private final SignalScheduler signalScheduler;

    @Scheduled(fixedRateString = "${meridian.scheduler.tick-interval:PT60S}")
    public void onTick() {
        signalScheduler.tick();
    }
}
