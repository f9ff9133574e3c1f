package com.example.berry.application.service;

import com.example.berry.common.config.AppProgressProperties;
import com.example.berry.common.util.MonotonicClock;
import com.example.berry.domain.model.StatusReport;
import com.example.berry.domain.model.TrackInfo;
import com.example.berry.infrastructure.librespot.LibrespotClient;
import com.example.berry.infrastructure.progress.ProgressStore;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Writes the resume position of the playing context: periodically while playing, before
 * switching to another context and once at shutdown.
 */
@Service
public class ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final LibrespotClient librespotClient;
    private final ProgressStore progressStore;
    private final PlaybackStateStore playbackStateStore;
    private final Executor commandExecutor;
    private final MonotonicClock clock;
    private final AppProgressProperties properties;

    private volatile long lastSaveAt;

    public ProgressTracker(LibrespotClient librespotClient,
                           ProgressStore progressStore,
                           PlaybackStateStore playbackStateStore,
                           @Qualifier("commandExecutor") Executor commandExecutor,
                           MonotonicClock clock,
                           AppProgressProperties properties) {
        this.librespotClient = librespotClient;
        this.progressStore = progressStore;
        this.playbackStateStore = playbackStateStore;
        this.commandExecutor = commandExecutor;
        this.clock = clock;
        this.properties = properties;
        this.lastSaveAt = clock.nowMillis();
    }

    /**
     * Saves in the background when the save interval elapsed and something is playing.
     */
    public void saveIfDue() {
        long now = clock.nowMillis();
        if (now - lastSaveAt < properties.getSaveIntervalMs()) {
            return;
        }
        lastSaveAt = now;
        if (!playbackStateStore.current().isPlaying()) {
            return;
        }
        saveAsync();
    }

    public void saveAsync() {
        try {
            commandExecutor.execute(this::saveNow);
        } catch (RejectedExecutionException e) {
            log.debug("Progress save skipped, command pool busy");
        }
    }

    /**
     * Synchronous last save before the process exits.
     */
    public void saveOnShutdown() {
        log.info("Saving progress before shutdown");
        saveNow();
    }

    /**
     * Reads the current position from the player and stores it for the playing context.
     *
     * @return true when something was saved
     */
    public boolean saveNow() {
        try {
            StatusReport report = librespotClient.status();
            if (!hasTrack(report)) {
                return false;
            }
            String contextUri = report.getContextUri() != null
                    ? report.getContextUri()
                    : playbackStateStore.current().getContextUri();
            return store(contextUri, report.getTrack());
        } catch (RuntimeException e) {
            log.warn("Progress save failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Saves the position of the context about to be replaced. Must run before the play command
     * for the new context. Skipped when the player has already moved on from the expected
     * track, since the position would belong to something else.
     *
     * @return true when something was saved
     */
    public boolean saveBeforeSwitch(String leavingContextUri, String expectedTrackUri) {
        try {
            StatusReport report = librespotClient.status();
            if (!hasTrack(report)) {
                return false;
            }
            TrackInfo track = report.getTrack();
            if (report.getContextUri() != null && !report.getContextUri().equals(leavingContextUri)) {
                log.debug("Progress save skipped, player context={} expected={}", report.getContextUri(), leavingContextUri);
                return false;
            }
            if (expectedTrackUri != null && !expectedTrackUri.equals(track.getUri())) {
                log.debug("Progress save skipped, player track={} expected={}", track.getUri(), expectedTrackUri);
                return false;
            }
            return store(leavingContextUri, track);
        } catch (RuntimeException e) {
            log.warn("Progress save before switch failed: {}", e.getMessage());
            return false;
        }
    }

    private boolean hasTrack(StatusReport report) {
        return report != null && report.getTrack() != null && !report.isStopped();
    }

    private boolean store(String contextUri, TrackInfo track) {
        if (contextUri == null || track.getUri() == null) {
            return false;
        }
        progressStore.saveProgress(contextUri, track.getUri(), track.getPositionMs(),
                track.getName(), track.joinedArtists());
        return true;
    }
}
