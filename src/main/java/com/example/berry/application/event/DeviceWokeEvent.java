package com.example.berry.application.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published when the screen wakes from sleep, by touch or because playback started.
 */
public class DeviceWokeEvent extends ApplicationEvent {

    private final String reason;

    public DeviceWokeEvent(Object source, String reason) {
        super(source);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
