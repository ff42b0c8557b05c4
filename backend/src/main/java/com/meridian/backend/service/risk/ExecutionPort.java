package com.meridian.backend.service.risk;

import com.meridian.backend.exception.ExecutionRejectedException;
import com.meridian.backend.model.PositionSide;

import java.time.Instant;

/**
 * The exchange as seen by the risk manager. Every method either acknowledges or throws;
 * a refusal by the venue is reported as {@link ExecutionRejectedException}.
 */
public interface ExecutionPort {

    PositionFill openPosition(String symbol, PositionSide side, double quantity, double entryHint);

    /**
     * Closes {@code fraction} of the position's original quantity.
     */
    ExecutionAck closePosition(String positionId, double fraction, String reason);

    ExecutionAck updateStop(String positionId, double stopPrice);

    record PositionFill(
            String positionId,
            String symbol,
            PositionSide side,
            double quantity,
            double fillPrice,
            Instant filledAt
    ) {}

    record ExecutionAck(String positionId, Double executedPrice, Instant acknowledgedAt) {}
}
