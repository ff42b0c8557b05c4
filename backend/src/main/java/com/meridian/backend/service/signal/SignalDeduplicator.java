package com.meridian.backend.service.signal;

import com.meridian.backend.model.Signal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry of unexpired signals by fingerprint. Registration is atomic per fingerprint,
 * so two overlapping runs cannot both emit the same signal.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SignalDeduplicator {

    private final Clock clock;

    private final Map<String, Signal> active = new ConcurrentHashMap<>();
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong suppressed = new AtomicLong();

    /**
     * @return true if the signal is new and now registered, false if an unexpired signal
     * with the same fingerprint already exists
     */
    public boolean tryRegister(Signal signal) {
        Instant now = clock.instant();
        AtomicBoolean registered = new AtomicBoolean(false);
        active.compute(signal.getFingerprint(), (fingerprint, existing) -> {
            if (existing != null && !existing.isExpiredAt(now)) {
                return existing;
            }
            registered.set(true);
            return signal;
        });
        if (registered.get()) {
            accepted.incrementAndGet();
        } else {
            suppressed.incrementAndGet();
            log.info("🔁 Duplicate signal suppressed symbol={} type={} fingerprint={}",
                    signal.getSymbol(), signal.getSignalType(), signal.getFingerprint());
        }
        return registered.get();
    }

    public boolean isActive(String fingerprint) {
        Signal signal = active.get(fingerprint);
        return signal != null && !signal.isExpiredAt(clock.instant());
    }

    @Scheduled(fixedDelayString = "${meridian.signal.cleanup-interval:PT1M}")
    public void removeExpired() {
        Instant now = clock.instant();
        active.values().removeIf(signal -> signal.isExpiredAt(now));
    }

    public DedupStats stats() {
        return new DedupStats(active.size(), accepted.get(), suppressed.get());
    }

    public record DedupStats(int activeSignals, long accepted, long suppressed) {}
}
