package com.example.berry.domain.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Either inactive, or paused because the user swiped away from the playing context.
 */
@ToString
@EqualsAndHashCode
public final class NavigationPause {

    private static final NavigationPause INACTIVE = new NavigationPause(null);

    private final String pausedContextUri;

    private NavigationPause(String pausedContextUri) {
        this.pausedContextUri = pausedContextUri;
    }

    public static NavigationPause inactive() {
        return INACTIVE;
    }

    public static NavigationPause pausedFor(String contextUri) {
        if (contextUri == null) {
            return INACTIVE;
        }
        return new NavigationPause(contextUri);
    }

    public boolean isActive() {
        return pausedContextUri != null;
    }

    public boolean matches(String contextUri) {
        return pausedContextUri != null && pausedContextUri.equals(contextUri);
    }

    public String getPausedContextUri() {
        return pausedContextUri;
    }
}
