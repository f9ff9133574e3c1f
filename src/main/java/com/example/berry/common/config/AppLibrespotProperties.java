package com.example.berry.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.librespot")
public class AppLibrespotProperties {

    private String baseUrl = "http://localhost:3678";

    private String eventsUrl = "ws://localhost:3678/events";

    private int connectTimeoutMs = 1000;

    private int statusTimeoutMs = 2000;

    /**
     * Reachability probe used when a status call fails.
     */
    private int probeTimeoutMs = 1000;

    private int commandTimeoutMs = 2000;

    /**
     * Loading a new context takes longer than the other player commands.
     */
    private int playTimeoutMs = 5000;

    private long eventReconnectDelayMs = 1000;
}
