package com.example.berry.common.util;

import java.util.concurrent.TimeUnit;

public class SystemMonotonicClock implements MonotonicClock {

    @Override
    public long nowMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }

    @Override
    public void sleepMillis(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}
