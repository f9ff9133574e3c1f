package com.example.berry.application.service;

import com.example.berry.common.config.AppPlaybackProperties;
import com.example.berry.domain.model.PlaybackSnapshot;
import com.example.berry.domain.model.StatusReport;
import com.example.berry.infrastructure.librespot.PlaybackContextSource;
import com.example.berry.infrastructure.progress.ProgressStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies one successful poll to every component that follows player state. Runs on the
 * poll thread, exactly once per report.
 */
@Service
public class StatusRefreshService {

    private static final Logger log = LoggerFactory.getLogger(StatusRefreshService.class);

    private final PlaybackStateStore playbackStateStore;
    private final PlaybackContextSource playbackContextSource;
    private final PlayStateTracker playStateTracker;
    private final VolumeOwnershipArbiter volumeOwnershipArbiter;
    private final CatalogService catalogService;
    private final PlayRequestCoordinator playRequestCoordinator;
    private final ProgressStore progressStore;
    private final SleepManager sleepManager;
    private final AutoPauseTimer autoPauseTimer;
    private final AppPlaybackProperties playbackProperties;

    // Poll thread only.
    private String lastSeenContextUri;

    public StatusRefreshService(PlaybackStateStore playbackStateStore,
                                PlaybackContextSource playbackContextSource,
                                PlayStateTracker playStateTracker,
                                VolumeOwnershipArbiter volumeOwnershipArbiter,
                                CatalogService catalogService,
                                PlayRequestCoordinator playRequestCoordinator,
                                ProgressStore progressStore,
                                SleepManager sleepManager,
                                AutoPauseTimer autoPauseTimer,
                                AppPlaybackProperties playbackProperties) {
        this.playbackStateStore = playbackStateStore;
        this.playbackContextSource = playbackContextSource;
        this.playStateTracker = playStateTracker;
        this.volumeOwnershipArbiter = volumeOwnershipArbiter;
        this.catalogService = catalogService;
        this.playRequestCoordinator = playRequestCoordinator;
        this.progressStore = progressStore;
        this.sleepManager = sleepManager;
        this.autoPauseTimer = autoPauseTimer;
        this.playbackProperties = playbackProperties;
    }

    public PlaybackSnapshot apply(StatusReport report) {
        String contextUri = report.getContextUri();
        if (contextUri == null && !report.isStopped()) {
            contextUri = playbackContextSource.lastContextUri();
        }
        PlaybackSnapshot snapshot = PlaybackSnapshot.from(report, contextUri);
        PlaybackSnapshot previous = playbackStateStore.replace(snapshot);
        if (previous.isPlaying() != snapshot.isPlaying() || !sameContext(previous, snapshot)) {
            log.info("PLAYBACK_EVENT event=status_change playing={} paused={} contextUri={} track={}",
                    snapshot.isPlaying(), snapshot.isPaused(), snapshot.getContextUri(), snapshot.getTrackName());
        }

        playStateTracker.clear();

        if (report.getVolume() != null) {
            volumeOwnershipArbiter.onRemoteVolumeObserved(report.getVolume());
        }

        catalogService.updateTempItem(snapshot);

        detectNaturalFinish(snapshot);

        if (snapshot.isPlaying() && sleepManager.isSleeping()) {
            sleepManager.wakeUp("playback_started");
        }

        if (snapshot.isPlaying()) {
            autoPauseTimer.onPlaying(snapshot.getContextUri());
            autoPauseTimer.tick(true);
        } else {
            autoPauseTimer.onStopped();
        }
        return snapshot;
    }

    /**
     * A context change the user did not ask for means the previous context played to its end;
     * its resume position is stale.
     */
    private void detectNaturalFinish(PlaybackSnapshot snapshot) {
        String contextUri = snapshot.getContextUri();
        if (contextUri == null) {
            return;
        }
        String previousContextUri = lastSeenContextUri;
        lastSeenContextUri = contextUri;
        if (previousContextUri == null || previousContextUri.equals(contextUri) || !snapshot.isPlaying()) {
            return;
        }
        if (playRequestCoordinator.isRecentUserPlay(playbackProperties.getUserPlayWindowMs())
                || contextUri.equals(playRequestCoordinator.getLastUserPlayUri())) {
            return;
        }
        log.info("PLAYBACK_EVENT event=context_finished contextUri={} next={}", previousContextUri, contextUri);
        progressStore.clearProgress(previousContextUri);
    }

    private boolean sameContext(PlaybackSnapshot a, PlaybackSnapshot b) {
        return a.getContextUri() == null ? b.getContextUri() == null : a.getContextUri().equals(b.getContextUri());
    }
}
