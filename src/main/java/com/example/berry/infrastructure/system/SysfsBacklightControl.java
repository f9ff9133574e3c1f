package com.example.berry.infrastructure.system;

import com.example.berry.common.config.AppSleepProperties;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Switches the touchscreen backlight through {@code bl_power}; a no-op when no backlight exists.
 */
@Component
public class SysfsBacklightControl implements BacklightControl {

    private static final Logger log = LoggerFactory.getLogger(SysfsBacklightControl.class);

    private final Path powerFile;

    public SysfsBacklightControl(AppSleepProperties properties) {
        this.powerFile = detect(properties.getBacklightDir());
        if (powerFile != null) {
            log.info("Backlight detected: {}", powerFile);
        } else {
            log.info("No backlight found");
        }
    }

    @Override
    public void setPower(boolean on) {
        if (powerFile == null) {
            return;
        }
        try {
            Files.write(powerFile, (on ? "0" : "1").getBytes(StandardCharsets.US_ASCII));
        } catch (IOException e) {
            log.debug("Could not set backlight power={}: {}", on, e.getMessage());
        }
    }

    private Path detect(String backlightDir) {
        File[] entries = new File(backlightDir).listFiles(File::isDirectory);
        if (entries == null || entries.length == 0) {
            return null;
        }
        Arrays.sort(entries);
        return entries[0].toPath().resolve("bl_power");
    }
}
