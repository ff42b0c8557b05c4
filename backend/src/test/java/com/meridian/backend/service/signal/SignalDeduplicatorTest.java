package com.meridian.backend.service.signal;

import com.meridian.backend.model.Signal;
import com.meridian.backend.model.SignalType;
import com.meridian.backend.util.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class SignalDeduplicatorTest {

    private static final Instant NOW = Instant.parse("2026-01-06T12:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final SignalDeduplicator deduplicator = new SignalDeduplicator(clock);

    @Test
    void suppressesSameFingerprintUntilExpiry() {
        Signal signal = signal("abc123", NOW.plus(Duration.ofMinutes(5)));

        assertThat(deduplicator.tryRegister(signal)).isTrue();
        assertThat(deduplicator.tryRegister(signal.toBuilder().confidence(0.9).build())).isFalse();
        assertThat(deduplicator.isActive("abc123")).isTrue();

        clock.advance(Duration.ofMinutes(5));

        assertThat(deduplicator.isActive("abc123")).isFalse();
        assertThat(deduplicator.tryRegister(signal("abc123", clock.instant().plus(Duration.ofMinutes(5))))).isTrue();
        assertThat(deduplicator.stats().accepted()).isEqualTo(2);
        assertThat(deduplicator.stats().suppressed()).isEqualTo(1);
    }

    @Test
    void differentFingerprintsAreIndependent() {
        assertThat(deduplicator.tryRegister(signal("a", NOW.plusSeconds(60)))).isTrue();
        assertThat(deduplicator.tryRegister(signal("b", NOW.plusSeconds(60)))).isTrue();
        assertThat(deduplicator.stats().activeSignals()).isEqualTo(2);
    }

    @Test
    void removeExpiredDropsOnlyExpired() {
        deduplicator.tryRegister(signal("short", NOW.plusSeconds(30)));
        deduplicator.tryRegister(signal("long", NOW.plusSeconds(600)));

        clock.advance(Duration.ofSeconds(60));
        deduplicator.removeExpired();

        assertThat(deduplicator.stats().activeSignals()).isEqualTo(1);
        assertThat(deduplicator.isActive("long")).isTrue();
    }

    @Test
    void concurrentRegistrationAcceptsExactlyOne() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 16; i++) {
                Callable<Boolean> attempt = () -> {
                    start.await();
                    return deduplicator.tryRegister(signal("race", NOW.plusSeconds(300)));
                };
                results.add(pool.submit(attempt));
            }
            start.countDown();
            int accepted = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    accepted++;
                }
            }
            assertThat(accepted).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    private static Signal signal(String fingerprint, Instant expiresAt) {
        return Signal.builder()
                .symbol("BTCUSDT")
                .signalType(SignalType.LONG)
                .confidence(0.6)
                .referencePrice(100.0)
                .strategyId("patchtst_ml")
                .fingerprint(fingerprint)
                .createdAt(NOW)
                .expiresAt(expiresAt)
                .build();
    }
}
