package com.example.berry.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.ui")
public class AppUiProperties {

    private int animatingFps = 60;

    private int playingFps = 10;

    private int idleFps = 5;

    /**
     * How long the carousel animates towards a new target before it counts as settled.
     */
    private long settleAnimationMs = 250;

    private long sleepingPollMs = 200;
}
