package com.example.berry.application.service;

import com.example.berry.common.config.AppPlaybackProperties;
import com.example.berry.common.util.MonotonicClock;
import com.example.berry.domain.enumtype.PendingAction;
import org.springframework.stereotype.Service;

/**
 * Optimistic play/pause display state and the loading indicator. A pending action is cleared
 * as soon as real status arrives.
 */
@Service
public class PlayStateTracker {

    private final AppPlaybackProperties properties;
    private final MonotonicClock clock;

    private PendingAction pendingAction;
    private long loadingSince = -1L;

    public PlayStateTracker(AppPlaybackProperties properties, MonotonicClock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public synchronized void setPending(PendingAction action) {
        pendingAction = action;
        loadingSince = action == PendingAction.PLAY ? clock.nowMillis() : -1L;
    }

    /**
     * Real status arrived. The loading indicator is left to the UI tick.
     */
    public synchronized void clear() {
        pendingAction = null;
    }

    public synchronized PendingAction getPendingAction() {
        return pendingAction;
    }

    public synchronized void startLoading() {
        if (loadingSince < 0) {
            loadingSince = clock.nowMillis();
        }
    }

    public synchronized void stopLoading() {
        loadingSince = -1L;
    }

    /**
     * Any loading state, used for the play button icon.
     */
    public synchronized boolean shouldShowLoading() {
        return loadingSince >= 0;
    }

    /**
     * True once loading lasted long enough to show the spinner.
     */
    public synchronized boolean isSpinnerVisible() {
        return loadingSince >= 0 && clock.nowMillis() - loadingSince > properties.getSpinnerDelayMs();
    }

    public synchronized boolean displayPlaying(boolean actuallyPlaying) {
        if (pendingAction == PendingAction.PAUSE) {
            return false;
        }
        if (pendingAction == PendingAction.PLAY || loadingSince >= 0) {
            return true;
        }
        return actuallyPlaying;
    }
}
