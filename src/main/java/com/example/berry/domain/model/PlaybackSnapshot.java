package com.example.berry.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * What the player is doing, as of the last successful poll. Replaced wholesale, never mutated.
 */
@Getter
@Builder
@ToString
public class PlaybackSnapshot {

    private static final PlaybackSnapshot IDLE = PlaybackSnapshot.builder().stopped(true).build();

    private final boolean playing;
    private final boolean paused;
    private final boolean stopped;
    private final String contextUri;
    private final String trackUri;
    private final String trackName;
    private final String trackArtist;
    private final String trackAlbum;
    private final String trackCover;
    private final long positionMs;
    private final long durationMs;

    public static PlaybackSnapshot idle() {
        return IDLE;
    }

    public static PlaybackSnapshot from(StatusReport report, String contextUri) {
        TrackInfo track = report.getTrack();
        PlaybackSnapshotBuilder builder = PlaybackSnapshot.builder()
                .playing(report.isPlaying())
                .paused(report.isPaused())
                .stopped(report.isStopped())
                .contextUri(contextUri);
        if (track != null) {
            builder.trackUri(track.getUri())
                    .trackName(track.getName())
                    .trackArtist(track.joinedArtists())
                    .trackAlbum(track.getAlbumName())
                    .trackCover(track.getAlbumCoverUrl())
                    .positionMs(track.getPositionMs())
                    .durationMs(track.getDurationMs());
        }
        return builder.build();
    }

    public boolean isActive() {
        return !stopped;
    }

    public double progress() {
        if (durationMs <= 0) {
            return 0.0D;
        }
        return Math.min(1.0D, (double) positionMs / (double) durationMs);
    }

    public boolean isContext(String uri) {
        return uri != null && uri.equals(contextUri);
    }
}
