package com.example.berry.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.volume")
public class AppVolumeProperties {

    /**
     * Ladder cycled by the volume button while the device owns volume.
     */
    private List<Level> levels = new ArrayList<>(Arrays.asList(
            new Level(60, 60, "volume_none"),
            new Level(70, 70, "volume_low"),
            new Level(80, 80, "volume_high")));

    private int defaultIndex = 1;

    /**
     * Remote volume at or above this value means the device owns volume.
     */
    private int remoteTakeoverThreshold = 95;

    /**
     * Remote volume reports within this window after a local change are ignored.
     */
    private long echoWindowMs = 2000;

    private Mixer mixer = new Mixer();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Level {

        private int speaker;

        private int headphone;

        private String icon;
    }

    @Data
    public static class Mixer {

        private boolean enabled = true;

        private String command = "amixer";

        private String card = "2";

        private String masterControl = "Playback";

        private String speakerControl = "Speaker";

        private String headphoneControl = "Headphone";

        private long timeoutMs = 2000;
    }
}
