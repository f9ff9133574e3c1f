package com.example.berry.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.connection")
public class AppConnectionProperties {

    /**
     * Consecutive failed polls before the device is shown as disconnected.
     */
    private int graceThreshold = 3;

    private long connectedPollIntervalMs = 1000;

    private long disconnectedPollIntervalMs = 500;

    private long initialRetryBaseMs = 1000;

    private long initialRetryMaxMs = 30000;

    private int initialRetryAttempts = 10;
}
