package com.example.berry.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NowPlayingResponse {

    private boolean playing;
    private boolean paused;
    private boolean stopped;
    private String contextUri;
    private String trackUri;
    private String trackName;
    private String artist;
    private String album;
    private String coverUrl;
    private long positionMs;
    private long durationMs;
    /**
     * 0..1, 0 when the duration is unknown.
     */
    private double progress;
}
