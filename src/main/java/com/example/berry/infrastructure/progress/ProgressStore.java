package com.example.berry.infrastructure.progress;

import com.example.berry.domain.model.SavedProgress;

/**
 * Resume positions per context. Implementations are best-effort and never throw.
 */
public interface ProgressStore {

    /**
     * Saved progress for the context, or null when there is none or it expired.
     */
    SavedProgress getProgress(String contextUri);

    void saveProgress(String contextUri, String trackUri, long positionMs, String trackName, String artist);

    void clearProgress(String contextUri);
}
