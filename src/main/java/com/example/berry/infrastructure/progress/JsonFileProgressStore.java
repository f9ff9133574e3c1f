package com.example.berry.infrastructure.progress;

import com.example.berry.common.config.AppProgressProperties;
import com.example.berry.domain.model.SavedProgress;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps resume positions in a small JSON file keyed by context uri. Entries older than the
 * configured expiry are dropped on read.
 */
@Component
public class JsonFileProgressStore implements ProgressStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileProgressStore.class);
    private static final TypeReference<LinkedHashMap<String, SavedProgress>> PROGRESS_MAP =
            new TypeReference<LinkedHashMap<String, SavedProgress>>() {
            };

    private final Path file;
    private final long expiryMs;
    private final ObjectMapper objectMapper;
    private final Clock wallClock;

    public JsonFileProgressStore(AppProgressProperties properties, ObjectMapper objectMapper, Clock wallClock) {
        this.file = Paths.get(properties.getFile());
        this.expiryMs = TimeUnit.HOURS.toMillis(Math.max(1, properties.getExpiryHours()));
        this.objectMapper = objectMapper;
        this.wallClock = wallClock;
    }

    @Override
    public synchronized SavedProgress getProgress(String contextUri) {
        if (contextUri == null) {
            return null;
        }
        Map<String, SavedProgress> entries = load();
        SavedProgress progress = entries.get(contextUri);
        if (progress == null) {
            return null;
        }
        long ageMs = wallClock.millis() - progress.getUpdatedAtEpochMs();
        if (ageMs > expiryMs) {
            log.debug("Progress expired, contextUri={} ageHours={}", contextUri, TimeUnit.MILLISECONDS.toHours(ageMs));
            entries.remove(contextUri);
            store(entries);
            return null;
        }
        log.info("Resume: \"{}\" @ {}s", progress.getTrackName(), progress.getPositionMs() / 1000L);
        return progress;
    }

    @Override
    public synchronized void saveProgress(String contextUri,
                                          String trackUri,
                                          long positionMs,
                                          String trackName,
                                          String artist) {
        if (contextUri == null || trackUri == null) {
            return;
        }
        Map<String, SavedProgress> entries = load();
        entries.put(contextUri, new SavedProgress(trackUri, Math.max(0L, positionMs), trackName, artist, wallClock.millis()));
        store(entries);
        log.debug("Saved progress: {} @ {}s", trackName, positionMs / 1000L);
    }

    @Override
    public synchronized void clearProgress(String contextUri) {
        if (contextUri == null) {
            return;
        }
        Map<String, SavedProgress> entries = load();
        if (entries.remove(contextUri) != null) {
            store(entries);
            log.debug("Cleared progress, contextUri={}", contextUri);
        }
    }

    private Map<String, SavedProgress> load() {
        if (!Files.isRegularFile(file)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, SavedProgress> entries = objectMapper.readValue(file.toFile(), PROGRESS_MAP);
            return entries == null ? new LinkedHashMap<>() : entries;
        } catch (IOException e) {
            log.warn("Error reading progress file {}, starting empty", file, e);
            return new LinkedHashMap<>();
        }
    }

    private void store(Map<String, SavedProgress> entries) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), entries);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.warn("Error writing progress file {}", file, e);
        }
    }
}
