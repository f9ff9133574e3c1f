package com.example.berry.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.playback")
public class AppPlaybackProperties {

    /**
     * Time the carousel must rest on a cover before it starts playing.
     */
    private long playTimerDelayMs = 1000;

    /**
     * Sync-to-playing is blocked for this long after the play timer fired.
     */
    private long syncCooldownMs = 3000;

    /**
     * Wait before running a superseding play request, so an even newer one can replace it.
     */
    private long settleDelayMs = 500;

    /**
     * Wait between loading a context and seeking to the saved position.
     */
    private long seekDelayMs = 500;

    /**
     * A context change within this window after a local play is not treated as autoplay.
     */
    private long userPlayWindowMs = 5000;

    private long buttonDebounceMs = 300;

    /**
     * Delay before the loading spinner is shown, avoids flicker on fast responses.
     */
    private long spinnerDelayMs = 200;
}
