package com.example.berry.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.auto-pause")
public class AppAutoPauseProperties {

    private boolean enabled = true;

    /**
     * Continuous playback in one context before the fade-out starts.
     */
    private long timeoutMs = 30L * 60L * 1000L;

    private long fadeDurationMs = 5000;

    private int fadeSteps = 20;

    /**
     * Pause between issuing the pause command and restoring the pre-fade volume.
     */
    private long restoreDelayMs = 500;
}
