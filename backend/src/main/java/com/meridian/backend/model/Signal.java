package com.meridian.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class Signal {
    String symbol;
    SignalType signalType;
    double confidence;
    double agreementRatio;
    double directionScore;
    Horizon primaryHorizon;
    double referencePrice;
    Double stopLossPrice;
    @Singular
    List<Double> takeProfitPrices;
    String strategyId;
    String fingerprint;
    Instant createdAt;
    Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public PositionSide side() {
        return switch (signalType) {
            case LONG -> PositionSide.LONG;
            case SHORT -> PositionSide.SHORT;
            case NEUTRAL -> throw new IllegalStateException("NEUTRAL signal has no side");
        };
    }
}
