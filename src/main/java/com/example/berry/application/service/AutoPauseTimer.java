package com.example.berry.application.service;

import com.example.berry.common.config.AppAutoPauseProperties;
import com.example.berry.common.util.MetricsRecorder;
import com.example.berry.common.util.MonotonicClock;
import com.example.berry.domain.enumtype.AutoPausePhase;
import com.example.berry.infrastructure.librespot.LibrespotClient;
import com.example.berry.infrastructure.system.SystemVolumeControl;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Pauses playback after a long stretch of continuous listening in one context, fading the
 * local volume out first.
 *
 * <p>IDLE -> ARMED on play start or context change, ARMED -> FADING once the timeout passes,
 * FADING -> IDLE after the pause is issued and the volume restored. Stop or pause always
 * returns to IDLE.
 */
@Service
public class AutoPauseTimer {

    private static final Logger log = LoggerFactory.getLogger(AutoPauseTimer.class);

    private final AppAutoPauseProperties properties;
    private final LibrespotClient librespotClient;
    private final SystemVolumeControl systemVolumeControl;
    private final Executor commandExecutor;
    private final MonotonicClock clock;
    private final MetricsRecorder metrics;

    private AutoPausePhase phase = AutoPausePhase.IDLE;
    private String contextUri;
    private long playStartedAt;
    private int savedVolume = 100;
    private boolean restorePending;
    // Bumped on every reset so a finishing fade cannot clobber newer state.
    private long generation;

    public AutoPauseTimer(AppAutoPauseProperties properties,
                          LibrespotClient librespotClient,
                          SystemVolumeControl systemVolumeControl,
                          @Qualifier("commandExecutor") Executor commandExecutor,
                          MonotonicClock clock,
                          ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.properties = properties;
        this.librespotClient = librespotClient;
        this.systemVolumeControl = systemVolumeControl;
        this.commandExecutor = commandExecutor;
        this.clock = clock;
        this.metrics = new MetricsRecorder(meterRegistryProvider);
    }

    /**
     * Playback is running in the given context. Same context keeps the original start time.
     */
    public synchronized void onPlaying(String playingContextUri) {
        if (playingContextUri == null) {
            reset();
            return;
        }
        if (phase == AutoPausePhase.FADING) {
            return;
        }
        if (phase == AutoPausePhase.IDLE || !playingContextUri.equals(contextUri)) {
            phase = AutoPausePhase.ARMED;
            contextUri = playingContextUri;
            playStartedAt = clock.nowMillis();
            log.info("Auto-pause: new context, timer reset ({}min)", TimeUnit.MILLISECONDS.toMinutes(properties.getTimeoutMs()));
        }
    }

    public synchronized void onStopped() {
        if (phase != AutoPausePhase.IDLE) {
            log.debug("Auto-pause: playback stopped, phase={} -> IDLE", phase);
        }
        reset();
    }

    /**
     * Checks the timeout; starts the fade when it passed.
     *
     * @return true when a fade was triggered by this call
     */
    public boolean tick(boolean playing) {
        final long fadeGeneration;
        synchronized (this) {
            if (!properties.isEnabled() || !playing || phase != AutoPausePhase.ARMED) {
                return false;
            }
            if (clock.nowMillis() - playStartedAt < properties.getTimeoutMs()) {
                return false;
            }
            log.info("Auto-pause: {} minutes reached, fading out...", TimeUnit.MILLISECONDS.toMinutes(properties.getTimeoutMs()));
            phase = AutoPausePhase.FADING;
            savedVolume = systemVolumeControl.getMasterLevel();
            restorePending = true;
            fadeGeneration = generation;
        }
        try {
            commandExecutor.execute(() -> fadeOutAndPause(fadeGeneration));
        } catch (RejectedExecutionException e) {
            synchronized (this) {
                if (generation == fadeGeneration && phase == AutoPausePhase.FADING) {
                    // Back to ARMED with the original start time; the next tick retries.
                    phase = AutoPausePhase.ARMED;
                    restorePending = false;
                }
            }
            log.warn("Auto-pause: fade not started, command pool busy");
            return false;
        }
        metrics.count("berry.auto_pause.triggered");
        return true;
    }

    /**
     * Manual resume: puts the pre-fade volume back right away if a fade left it lowered.
     */
    public synchronized void restoreVolumeIfNeeded() {
        if (!restorePending) {
            return;
        }
        log.info("Auto-pause: restoring volume to {}%", savedVolume);
        restorePending = false;
        systemVolumeControl.setMasterLevel(savedVolume);
    }

    public synchronized AutoPausePhase getPhase() {
        return phase;
    }

    public synchronized String getContextUri() {
        return contextUri;
    }

    /**
     * Milliseconds until auto-pause, or -1 when not armed.
     */
    public synchronized long remainingMillis() {
        if (phase == AutoPausePhase.IDLE) {
            return -1L;
        }
        return Math.max(0L, properties.getTimeoutMs() - (clock.nowMillis() - playStartedAt));
    }

    private void fadeOutAndPause(long fadeGeneration) {
        int steps = Math.max(1, properties.getFadeSteps());
        long stepDelay = properties.getFadeDurationMs() / steps;
        int startVolume;
        synchronized (this) {
            startVolume = savedVolume;
        }
        try {
            boolean completed = true;
            for (int i = 1; i <= steps; i++) {
                synchronized (this) {
                    if (!restorePending || generation != fadeGeneration) {
                        completed = false;
                        break;
                    }
                    systemVolumeControl.setMasterLevel(Math.max(0, startVolume * (steps - i) / steps));
                }
                clock.sleepMillis(stepDelay);
            }
            if (completed) {
                log.info("Auto-pause: pausing playback");
                if (!librespotClient.pause()) {
                    log.warn("Auto-pause: pause command failed");
                }
                clock.sleepMillis(properties.getRestoreDelayMs());
            } else {
                log.info("Auto-pause: fade interrupted by manual resume or new playback");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Auto-pause: fade interrupted");
        } finally {
            synchronized (this) {
                restoreVolumeIfNeeded();
                if (generation == fadeGeneration) {
                    reset();
                }
            }
            log.info("Auto-pause: complete, volume restored");
        }
    }

    private void reset() {
        phase = AutoPausePhase.IDLE;
        contextUri = null;
        playStartedAt = 0L;
        generation++;
    }
}
