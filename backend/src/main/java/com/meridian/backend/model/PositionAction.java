package com.meridian.backend.model;

public record PositionAction(
        ActionType type,
        String positionId,
        String symbol,
        double fraction,
        Integer levelIndex,
        Double newStopPrice,
        double triggerPrice,
        String reason
) {
    public enum ActionType {
        FULL_CLOSE,
        PARTIAL_CLOSE,
        UPDATE_STOP
    }

    public static PositionAction fullClose(Position position, double fraction, double price, String reason) {
        return new PositionAction(ActionType.FULL_CLOSE, position.getId(), position.getSymbol(),
                fraction, null, null, price, reason);
    }

    public static PositionAction partialClose(Position position, int levelIndex, double fraction, double price) {
        return new PositionAction(ActionType.PARTIAL_CLOSE, position.getId(), position.getSymbol(),
                fraction, levelIndex, null, price, "TAKE_PROFIT_" + (levelIndex + 1));
    }

    public static PositionAction updateStop(Position position, double newStop, double price, String reason) {
        return new PositionAction(ActionType.UPDATE_STOP, position.getId(), position.getSymbol(),
                0.0, null, newStop, price, reason);
    }

    public boolean isClose() {
        return type != ActionType.UPDATE_STOP;
    }
}
