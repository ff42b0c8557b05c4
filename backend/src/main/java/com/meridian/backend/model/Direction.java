package com.meridian.backend.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Direction {
    DOWN(0),
    FLAT(1),
    UP(2);

    private final int value;

    public static Direction fromClassIndex(int index) {
        return switch (index) {
            case 0 -> DOWN;
            case 1 -> FLAT;
            case 2 -> UP;
            default -> throw new IllegalArgumentException("Unknown direction class: " + index);
        };
    }
}
