package com.example.berry.infrastructure.librespot;

import com.example.berry.domain.model.StatusReport;

/**
 * Status source and command sink of the remote player. No method throws; commands report
 * success so callers can use them fire-and-forget.
 */
public interface LibrespotClient {

    /**
     * Current status, {@link StatusReport#noPlayback()} when nothing is loaded or the payload
     * is unusable, null when the player could not be reached.
     */
    StatusReport status();

    boolean isConnected();

    boolean play(String contextUri, String skipToTrackUri);

    boolean pause();

    boolean resume();

    boolean next();

    boolean prev();

    boolean seek(long positionMs);

    boolean setVolume(int level);
}
