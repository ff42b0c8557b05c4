package com.meridian.backend.service.risk;

import com.meridian.backend.model.PositionSide;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.UUID;

/**
 * Simulated venue: every order fills immediately at the requested price.
 */
@Slf4j
@RequiredArgsConstructor
public class PaperExecutionPort implements ExecutionPort {

    private final Clock clock;

    @Override
    public PositionFill openPosition(String symbol, PositionSide side, double quantity, double entryHint) {
        String positionId = "PAPER-" + UUID.randomUUID();
        log.info("📝 PAPER open {} {} qty={} @ {}", side, symbol, quantity, entryHint);
        return new PositionFill(positionId, symbol, side, quantity, entryHint, clock.instant());
    }

    @Override
    public ExecutionAck closePosition(String positionId, double fraction, String reason) {
        log.info("📝 PAPER close positionId={} fraction={} reason={}", positionId, fraction, reason);
        return new ExecutionAck(positionId, null, clock.instant());
    }

    @Override
    public ExecutionAck updateStop(String positionId, double stopPrice) {
        log.info("📝 PAPER stop positionId={} stop={}", positionId, stopPrice);
        return new ExecutionAck(positionId, null, clock.instant());
    }
}
