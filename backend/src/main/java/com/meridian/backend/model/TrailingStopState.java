package com.meridian.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Trailing-stop bookkeeping. {@code waterMark} is the best price seen since activation:
 * the high for a long position, the low for a short one.
 */
@Data
@AllArgsConstructor
public class TrailingStopState {
    private boolean active;
    private double waterMark;
    private double trailDistance;

    public static TrailingStopState inactive(double entryPrice, double trailDistance) {
        return new TrailingStopState(false, entryPrice, trailDistance);
    }

    public TrailingStopState copy() {
        return new TrailingStopState(active, waterMark, trailDistance);
    }
}
