package com.example.berry.infrastructure.system;

import com.example.berry.common.config.AppVolumeProperties;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives the ALSA mixer through {@code amixer}. Only active on Linux.
 */
@Component
public class AmixerSystemVolumeControl implements SystemVolumeControl {

    private static final Logger log = LoggerFactory.getLogger(AmixerSystemVolumeControl.class);

    private final AppVolumeProperties.Mixer mixer;
    private final boolean active;
    private volatile int masterLevel = 100;

    public AmixerSystemVolumeControl(AppVolumeProperties volumeProperties) {
        this.mixer = volumeProperties.getMixer();
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        this.active = mixer.isEnabled() && os.contains("linux");
        if (!active) {
            log.info("System mixer disabled, enabled={} os={}", mixer.isEnabled(), os);
        }
    }

    @Override
    public void setLevels(int speakerPercent, int headphonePercent) {
        run(mixer.getSpeakerControl(), speakerPercent);
        run(mixer.getHeadphoneControl(), headphonePercent);
    }

    @Override
    public void setMasterLevel(int percent) {
        masterLevel = clamp(percent);
        run(mixer.getMasterControl(), masterLevel);
    }

    @Override
    public int getMasterLevel() {
        return masterLevel;
    }

    private void run(String control, int percent) {
        if (!active) {
            return;
        }
        List<String> command = new ArrayList<>(Arrays.asList(
                mixer.getCommand(), "-q", "-c", mixer.getCard(), "set", control, clamp(percent) + "%"));
        try {
            Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
            if (!process.waitFor(mixer.getTimeoutMs(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("amixer timed out, control={}", control);
                return;
            }
            if (process.exitValue() != 0) {
                log.debug("amixer exited with {}, control={}", process.exitValue(), control);
            }
        } catch (IOException e) {
            log.debug("Could not set system volume, control={}: {}", control, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while setting system volume, control={}", control);
        }
    }

    private int clamp(int percent) {
        return Math.max(0, Math.min(100, percent));
    }
}
