package com.example.berry.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One status response from the player. A report always means the player answered;
 * an unreachable player yields no report at all.
 */
@Getter
@Builder
@ToString
public class StatusReport {

    private final boolean stopped;
    private final boolean paused;
    private final Integer volume;
    private final String contextUri;
    private final TrackInfo track;

    public static StatusReport noPlayback() {
        return StatusReport.builder().stopped(true).build();
    }

    public boolean isPlaying() {
        return !stopped && !paused;
    }
}
