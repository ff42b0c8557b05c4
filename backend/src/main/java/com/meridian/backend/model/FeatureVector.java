package com.meridian.backend.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Named, ordered numeric features derived from one candle window. Values are copied on
 * the way in and out so a vector never changes after construction.
 */
public final class FeatureVector {

    private final String symbol;
    private final Instant asOf;
    private final List<String> names;
    private final double[] values;

    public FeatureVector(String symbol, Instant asOf, List<String> names, double[] values) {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(asOf, "asOf");
        if (names.size() != values.length) {
            throw new IllegalArgumentException("Feature names (" + names.size()
                    + ") and values (" + values.length + ") differ in length");
        }
        this.symbol = symbol;
        this.asOf = asOf;
        this.names = List.copyOf(names);
        this.values = values.clone();
    }

    public String getSymbol() {
        return symbol;
    }

    public Instant getAsOf() {
        return asOf;
    }

    public List<String> getNames() {
        return names;
    }

    public double[] getValues() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double get(String name) {
        int index = names.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown feature: " + name);
        }
        return values[index];
    }

    public boolean isFinite() {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureVector that)) {
            return false;
        }
        return symbol.equals(that.symbol)
                && asOf.equals(that.asOf)
                && names.equals(that.names)
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(symbol, asOf, names);
        return 31 * result + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector{symbol=" + symbol + ", asOf=" + asOf + ", size=" + values.length + "}";
    }
}
