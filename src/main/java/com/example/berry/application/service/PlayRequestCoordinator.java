package com.example.berry.application.service;

import com.example.berry.common.config.AppPlaybackProperties;
import com.example.berry.common.util.MetricsRecorder;
import com.example.berry.common.util.MonotonicClock;
import com.example.berry.domain.model.PlayRequest;
import com.example.berry.domain.model.PlaybackSnapshot;
import com.example.berry.domain.model.SavedProgress;
import com.example.berry.infrastructure.librespot.LibrespotClient;
import com.example.berry.infrastructure.progress.ProgressStore;
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
 * Turns "play context X" intents into player commands, one at a time. While a request runs,
 * newer ones overwrite a single pending slot; after the current one finishes and a short
 * settle delay, only the freshest pending request is executed. The progress of the context
 * being left is saved on the worker before the play command goes out.
 */
@Service
public class PlayRequestCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PlayRequestCoordinator.class);

    private final LibrespotClient librespotClient;
    private final ProgressStore progressStore;
    private final ProgressTracker progressTracker;
    private final PlaybackStateStore playbackStateStore;
    private final VolumeOwnershipArbiter volumeOwnershipArbiter;
    private final AppPlaybackProperties properties;
    private final MonotonicClock clock;
    private final Executor playRequestExecutor;
    private final MetricsRecorder metrics;

    private final Object lock = new Object();
    // Guarded by lock. busy stays true through the settle delay so late requests coalesce.
    private boolean busy;
    private PlayRequest pending;

    private volatile boolean inFlight;
    private volatile String lastUserPlayUri;
    private volatile long lastUserPlayAt = -1L;

    public PlayRequestCoordinator(LibrespotClient librespotClient,
                                  ProgressStore progressStore,
                                  ProgressTracker progressTracker,
                                  PlaybackStateStore playbackStateStore,
                                  VolumeOwnershipArbiter volumeOwnershipArbiter,
                                  AppPlaybackProperties properties,
                                  MonotonicClock clock,
                                  @Qualifier("playRequestExecutor") Executor playRequestExecutor,
                                  ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.librespotClient = librespotClient;
        this.progressStore = progressStore;
        this.progressTracker = progressTracker;
        this.playbackStateStore = playbackStateStore;
        this.volumeOwnershipArbiter = volumeOwnershipArbiter;
        this.properties = properties;
        this.clock = clock;
        this.playRequestExecutor = playRequestExecutor;
        this.metrics = new MetricsRecorder(meterRegistryProvider);
    }

    public void requestPlay(String contextUri) {
        requestPlay(contextUri, false);
    }

    /**
     * Non-blocking. Returns immediately; the command runs on the play worker.
     */
    public void requestPlay(String contextUri, boolean fromBeginning) {
        if (contextUri == null || contextUri.trim().isEmpty()) {
            log.warn("Play request ignored: empty context uri");
            return;
        }
        lastUserPlayUri = contextUri;
        lastUserPlayAt = clock.nowMillis();

        PlaybackSnapshot snapshot = playbackStateStore.current();
        PlayRequest request;
        if (snapshot.isActive() && snapshot.getContextUri() != null && !snapshot.isContext(contextUri)) {
            request = new PlayRequest(contextUri, fromBeginning, snapshot.getContextUri(), snapshot.getTrackUri());
        } else {
            request = new PlayRequest(contextUri, fromBeginning);
        }
        synchronized (lock) {
            inFlight = true;
            if (busy) {
                if (pending != null) {
                    log.debug("Replacing pending play request, old={} new={}", pending.getContextUri(), contextUri);
                }
                pending = request;
                metrics.count("berry.play.request", "outcome", "coalesced");
                return;
            }
            busy = true;
        }
        try {
            playRequestExecutor.execute(() -> drain(request));
        } catch (RejectedExecutionException e) {
            log.warn("Play request rejected, worker unavailable, contextUri={}", contextUri);
            synchronized (lock) {
                busy = false;
                pending = null;
            }
            inFlight = false;
        }
    }

    public boolean isInFlight() {
        return inFlight;
    }

    /**
     * The poll saw playback start; the indicator may stop waiting even if the worker is
     * still finishing (e.g. the seek).
     */
    public void markPlaybackStarted() {
        inFlight = false;
    }

    public String getLastUserPlayUri() {
        return lastUserPlayUri;
    }

    /**
     * True when a local play was requested within the given window.
     */
    public boolean isRecentUserPlay(long windowMs) {
        long at = lastUserPlayAt;
        return at >= 0 && clock.nowMillis() - at < windowMs;
    }

    private void drain(PlayRequest first) {
        PlayRequest current = first;
        try {
            while (current != null) {
                execute(current);
                synchronized (lock) {
                    if (pending == null) {
                        busy = false;
                        inFlight = false;
                        return;
                    }
                }
                clock.sleepMillis(properties.getSettleDelayMs());
                synchronized (lock) {
                    current = pending;
                    pending = null;
                    if (current == null) {
                        busy = false;
                        inFlight = false;
                        return;
                    }
                }
                log.debug("Executing pending play request, contextUri={}", current.getContextUri());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Play worker interrupted, dropping pending request");
            synchronized (lock) {
                busy = false;
                pending = null;
            }
            inFlight = false;
        }
    }

    private void execute(PlayRequest request) throws InterruptedException {
        long startedAt = System.nanoTime();
        String contextUri = request.getContextUri();
        boolean ok = false;
        try {
            if (request.getLeavingContextUri() != null) {
                progressTracker.saveBeforeSwitch(request.getLeavingContextUri(), request.getLeavingTrackUri());
            }
            volumeOwnershipArbiter.ensureRemoteAtFull();
            SavedProgress saved = request.isFromBeginning() ? null : progressStore.getProgress(contextUri);
            String skipTo = saved == null ? null : saved.getTrackUri();
            ok = librespotClient.play(contextUri, skipTo);
            if (ok && saved != null && saved.getPositionMs() > 0) {
                clock.sleepMillis(properties.getSeekDelayMs());
                if (!librespotClient.seek(saved.getPositionMs())) {
                    log.warn("Seek after play failed, contextUri={} positionMs={}", contextUri, saved.getPositionMs());
                }
            }
        } catch (RuntimeException e) {
            log.error("Play request failed, contextUri={}", contextUri, e);
        } finally {
            long elapsed = System.nanoTime() - startedAt;
            log.info("PLAYBACK_EVENT event=play_request contextUri={} fromBeginning={} outcome={} latencyMs={}",
                    contextUri, request.isFromBeginning(), ok ? "ok" : "failed",
                    TimeUnit.NANOSECONDS.toMillis(elapsed));
            metrics.count("berry.play.request", "outcome", ok ? "executed" : "failed");
            metrics.duration("berry.play.request.latency", elapsed);
        }
    }
}
