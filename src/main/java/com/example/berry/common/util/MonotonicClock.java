package com.example.berry.common.util;

/**
 * Time source for deadlines, cooldowns and worker delays. Never goes backwards.
 */
public interface MonotonicClock {

    long nowMillis();

    void sleepMillis(long millis) throws InterruptedException;
}
