package com.example.berry.domain.enumtype;

public enum SwipeDirection {
    LEFT(1),
    RIGHT(-1);

    private final int step;

    SwipeDirection(int step) {
        this.step = step;
    }

    /**
     * Index delta: swiping left reveals the next cover.
     */
    public int getStep() {
        return step;
    }
}
