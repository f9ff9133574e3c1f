package com.example.berry.application.event;

import org.springframework.context.ApplicationEvent;

/**
 * Asks the poll loop for an out-of-cycle status poll.
 */
public class RepollRequestedEvent extends ApplicationEvent {

    private final String reason;
    private final boolean resetConnection;

    public RepollRequestedEvent(Object source, String reason, boolean resetConnection) {
        super(source);
        this.reason = reason;
        this.resetConnection = resetConnection;
    }

    public static RepollRequestedEvent playerEvent(Object source) {
        return new RepollRequestedEvent(source, "player_event", false);
    }

    public static RepollRequestedEvent feedReconnected(Object source) {
        return new RepollRequestedEvent(source, "feed_reconnected", true);
    }

    public String getReason() {
        return reason;
    }

    /**
     * Whether the failure counter should be reset optimistically before polling.
     */
    public boolean isResetConnection() {
        return resetConnection;
    }
}
