package com.meridian.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {
    private String id;
    private String symbol;
    private PositionSide side;
    private double entryPrice;
    private double quantity;
    private double stopLossPrice;
    @Builder.Default
    private List<TakeProfitLevel> takeProfitLevels = new ArrayList<>();
    private TrailingStopState trailingStop;
    @Builder.Default
    private PositionStatus status = PositionStatus.OPEN;
    private double closedFraction;
    private boolean breakevenApplied;
    private String signalFingerprint;
    private Instant openedAt;
    private Instant updatedAt;
    private Instant closedAt;
    private String exitReason;

    public double remainingFraction() {
        return Math.max(0.0, 1.0 - closedFraction);
    }

    public double remainingQuantity() {
        return quantity * remainingFraction();
    }

    public boolean isOpen() {
        return status != PositionStatus.CLOSED;
    }

    public double unrealizedReturn(double price) {
        if (entryPrice <= 0) {
            return 0.0;
        }
        double change = (price - entryPrice) / entryPrice;
        return side == PositionSide.LONG ? change : -change;
    }

    /**
     * Deep copy used as the working state of a tick; committed only after the
     * execution collaborator acknowledges every action.
     */
    public Position copy() {
        List<TakeProfitLevel> levels = new ArrayList<>(takeProfitLevels.size());
        for (TakeProfitLevel level : takeProfitLevels) {
            levels.add(level.copy());
        }
        return toBuilder()
                .takeProfitLevels(levels)
                .trailingStop(trailingStop != null ? trailingStop.copy() : null)
                .build();
    }
}
