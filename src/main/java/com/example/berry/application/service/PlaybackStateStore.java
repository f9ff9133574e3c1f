package com.example.berry.application.service;

import com.example.berry.domain.model.PlaybackSnapshot;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Service;

/**
 * Holds the current {@link PlaybackSnapshot}. Written by the poll thread, read everywhere;
 * readers always see a fully formed snapshot.
 */
@Service
public class PlaybackStateStore {

    private final AtomicReference<PlaybackSnapshot> snapshot = new AtomicReference<>(PlaybackSnapshot.idle());

    public PlaybackSnapshot current() {
        return snapshot.get();
    }

    /**
     * Replaces the snapshot and returns the previous one.
     */
    public PlaybackSnapshot replace(PlaybackSnapshot next) {
        return snapshot.getAndSet(next == null ? PlaybackSnapshot.idle() : next);
    }
}
