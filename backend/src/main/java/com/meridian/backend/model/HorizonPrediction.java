package com.meridian.backend.model;

public record HorizonPrediction(
        Horizon horizon,
        double predictedReturn,
        Direction direction,
        double probDown,
        double probFlat,
        double probUp,
        double riskScore
) {
    public double confidence() {
        return Math.max(probDown, Math.max(probFlat, probUp));
    }

    public double probability(Direction dir) {
        return switch (dir) {
            case DOWN -> probDown;
            case FLAT -> probFlat;
            case UP -> probUp;
        };
    }
}
