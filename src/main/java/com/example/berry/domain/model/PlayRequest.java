package com.example.berry.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public final class PlayRequest {

    private final String contextUri;
    private final boolean fromBeginning;
    /**
     * Context that was active when the request was made, null when nothing was or it is the
     * requested one. Its progress is saved before the switch.
     */
    private final String leavingContextUri;
    private final String leavingTrackUri;

    public PlayRequest(String contextUri, boolean fromBeginning) {
        this(contextUri, fromBeginning, null, null);
    }

    public PlayRequest(String contextUri, boolean fromBeginning, String leavingContextUri, String leavingTrackUri) {
        this.contextUri = contextUri;
        this.fromBeginning = fromBeginning;
        this.leavingContextUri = leavingContextUri;
        this.leavingTrackUri = leavingTrackUri;
    }
}
