package com.example.berry.application.service;

import com.example.berry.application.event.DeviceWokeEvent;
import com.example.berry.common.config.AppSleepProperties;
import com.example.berry.common.util.MonotonicClock;
import com.example.berry.infrastructure.system.BacklightControl;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Turns the screen off after a period without touch while nothing plays, and back on for
 * touch or when playback starts.
 */
@Service
public class SleepManager {

    private static final Logger log = LoggerFactory.getLogger(SleepManager.class);

    private final AppSleepProperties properties;
    private final BacklightControl backlightControl;
    private final ApplicationEventPublisher eventPublisher;
    private final MonotonicClock clock;

    private boolean sleeping;
    private long lastActivityAt;

    public SleepManager(AppSleepProperties properties,
                        BacklightControl backlightControl,
                        ApplicationEventPublisher eventPublisher,
                        MonotonicClock clock) {
        this.properties = properties;
        this.backlightControl = backlightControl;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.lastActivityAt = clock.nowMillis();
    }

    /**
     * Touch input.
     *
     * @return true when the touch woke the screen and should not be handled further
     */
    public boolean recordActivity() {
        synchronized (this) {
            lastActivityAt = clock.nowMillis();
            if (!sleeping) {
                return false;
            }
        }
        wakeUp("touch");
        return true;
    }

    /**
     * Enters sleep once the inactivity timeout passed and nothing is playing.
     */
    public void check(boolean playing) {
        synchronized (this) {
            if (sleeping) {
                return;
            }
            if (playing) {
                lastActivityAt = clock.nowMillis();
                return;
            }
            if (clock.nowMillis() - lastActivityAt < properties.getTimeoutMs()) {
                return;
            }
        }
        enterSleep();
    }

    public void enterSleep() {
        synchronized (this) {
            if (sleeping) {
                return;
            }
            sleeping = true;
        }
        log.info("Entering sleep mode after {}s of inactivity", TimeUnit.MILLISECONDS.toSeconds(properties.getTimeoutMs()));
        backlightControl.setPower(false);
    }

    public void wakeUp(String reason) {
        synchronized (this) {
            if (!sleeping) {
                return;
            }
            sleeping = false;
            lastActivityAt = clock.nowMillis();
        }
        log.info("Waking up, reason={}", reason);
        backlightControl.setPower(true);
        eventPublisher.publishEvent(new DeviceWokeEvent(this, reason));
    }

    public synchronized boolean isSleeping() {
        return sleeping;
    }
}
