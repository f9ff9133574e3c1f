package com.example.berry.application.service;

import com.example.berry.application.event.DeviceWokeEvent;
import com.example.berry.common.config.AppVolumeProperties;
import com.example.berry.common.util.MetricsRecorder;
import com.example.berry.common.util.MonotonicClock;
import com.example.berry.domain.enumtype.VolumeMode;
import com.example.berry.infrastructure.librespot.LibrespotClient;
import com.example.berry.infrastructure.system.SystemVolumeControl;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import javax.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Decides whether the device or the remote controller owns volume.
 *
 * <p>LOCAL: remote held at 100%, the device cycles its ladder. REMOTE: device mixer at 100%,
 * the remote value is authoritative. Remote observations shortly after a local change are
 * ignored so the device's own "remote to 100%" is not read as a foreign change.
 */
@Service
public class VolumeOwnershipArbiter {

    private static final Logger log = LoggerFactory.getLogger(VolumeOwnershipArbiter.class);

    private final AppVolumeProperties properties;
    private final LibrespotClient librespotClient;
    private final SystemVolumeControl systemVolumeControl;
    private final Executor commandExecutor;
    private final MonotonicClock clock;
    private final MetricsRecorder metrics;
    private final List<AppVolumeProperties.Level> levels;

    private VolumeMode mode = VolumeMode.LOCAL;
    private int index;
    private int localIndex;
    private long lastLocalChangeAt;
    private boolean localChangeSeen;
    private boolean remoteInitialized;

    public VolumeOwnershipArbiter(AppVolumeProperties properties,
                                  LibrespotClient librespotClient,
                                  SystemVolumeControl systemVolumeControl,
                                  @Qualifier("commandExecutor") Executor commandExecutor,
                                  MonotonicClock clock,
                                  ObjectProvider<MeterRegistry> meterRegistryProvider) {
        if (properties.getLevels() == null || properties.getLevels().isEmpty()) {
            throw new IllegalArgumentException("app.volume.levels must not be empty");
        }
        this.properties = properties;
        this.librespotClient = librespotClient;
        this.systemVolumeControl = systemVolumeControl;
        this.commandExecutor = commandExecutor;
        this.clock = clock;
        this.metrics = new MetricsRecorder(meterRegistryProvider);
        this.levels = properties.getLevels();
        this.index = Math.max(0, Math.min(properties.getDefaultIndex(), levels.size() - 1));
        this.localIndex = index;
    }

    @PostConstruct
    public synchronized void init() {
        mode = VolumeMode.LOCAL;
        AppVolumeProperties.Level level = levels.get(index);
        systemVolumeControl.setLevels(level.getSpeaker(), level.getHeadphone());
        log.info("Volume initialised, speaker={}% headphone={}%", level.getSpeaker(), level.getHeadphone());
    }

    /**
     * Local volume button: cycles the ladder, taking control back from the remote if needed.
     */
    public synchronized void toggle() {
        markLocalChange();
        if (mode == VolumeMode.REMOTE) {
            log.info("Volume: taking back control from remote");
            mode = VolumeMode.LOCAL;
            index = localIndex;
            metrics.count("berry.volume.ownership", "mode", "local", "reason", "toggle");
            resetRemoteAsync();
        }
        index = (index + 1) % levels.size();
        localIndex = index;
        AppVolumeProperties.Level level = levels.get(index);
        log.info("Volume: speaker={}% headphone={}%", level.getSpeaker(), level.getHeadphone());
        submit("set_levels", () -> systemVolumeControl.setLevels(level.getSpeaker(), level.getHeadphone()));
    }

    /**
     * Feeds one remote volume observation from a poll.
     */
    public synchronized void onRemoteVolumeObserved(int remoteVolume) {
        if (localChangeSeen && clock.nowMillis() - lastLocalChangeAt < properties.getEchoWindowMs()) {
            return;
        }
        int threshold = properties.getRemoteTakeoverThreshold();
        if (mode == VolumeMode.LOCAL) {
            if (remoteVolume < threshold) {
                log.info("Volume: remote took control ({}%)", remoteVolume);
                mode = VolumeMode.REMOTE;
                index = levels.size() - 1;
                metrics.count("berry.volume.ownership", "mode", "remote", "reason", "remote_change");
                systemVolumeControl.setLevels(100, 100);
            }
        } else if (remoteVolume >= threshold) {
            switchToLocal("remote_restored");
        }
    }

    /**
     * Sets the remote side to 100% the first time something is played.
     */
    public boolean ensureRemoteAtFull() {
        synchronized (this) {
            if (remoteInitialized) {
                return false;
            }
            remoteInitialized = true;
            markLocalChange();
        }
        boolean ok = librespotClient.setVolume(100);
        if (ok) {
            log.info("Remote volume set to 100%");
        }
        return ok;
    }

    @EventListener
    public void onDeviceWoke(DeviceWokeEvent event) {
        onWake();
    }

    public synchronized void onWake() {
        if (mode == VolumeMode.REMOTE) {
            switchToLocal("wake");
        }
    }

    public synchronized VolumeMode getMode() {
        return mode;
    }

    public synchronized int getIndex() {
        return index;
    }

    public synchronized String getIcon() {
        return levels.get(index).getIcon();
    }

    private void switchToLocal(String reason) {
        log.info("Volume: switching to local mode, reason={}", reason);
        mode = VolumeMode.LOCAL;
        index = localIndex;
        markLocalChange();
        metrics.count("berry.volume.ownership", "mode", "local", "reason", reason);
        AppVolumeProperties.Level level = levels.get(index);
        systemVolumeControl.setLevels(level.getSpeaker(), level.getHeadphone());
        resetRemoteAsync();
    }

    private void markLocalChange() {
        lastLocalChangeAt = clock.nowMillis();
        localChangeSeen = true;
    }

    private void resetRemoteAsync() {
        submit("reset_remote", () -> {
            if (!librespotClient.setVolume(100)) {
                log.debug("Resetting remote volume to 100% failed");
            }
        });
    }

    private void submit(String task, Runnable work) {
        try {
            commandExecutor.execute(work);
        } catch (RejectedExecutionException e) {
            log.warn("Volume task dropped, command pool busy, task={}", task);
        }
    }
}
