package com.meridian.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class TakeProfitLevel {
    private double price;
    private double fraction;
    private boolean filled;

    public static TakeProfitLevel of(double price, double fraction) {
        return new TakeProfitLevel(price, fraction, false);
    }

    public TakeProfitLevel copy() {
        return new TakeProfitLevel(price, fraction, filled);
    }

    public boolean isReachedBy(PositionSide side, double price) {
        return side == PositionSide.LONG ? price >= this.price : price <= this.price;
    }
}
