package com.example.berry.application.job;

import com.example.berry.api.response.DeviceStateResponse;
import com.example.berry.application.service.ProgressTracker;
import com.example.berry.application.service.SelectionPlaybackSync;
import com.example.berry.application.service.SleepManager;
import com.example.berry.common.config.AppUiProperties;
import com.example.berry.common.util.MonotonicClock;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * The UI thread. Owns the selection state: input is queued and applied at the start of the
 * next tick, after which a fresh {@link DeviceStateResponse} is published for readers.
 */
@Service
public class UiLoop {

    private static final Logger log = LoggerFactory.getLogger(UiLoop.class);

    private final SelectionPlaybackSync selectionPlaybackSync;
    private final SleepManager sleepManager;
    private final ProgressTracker progressTracker;
    private final AppUiProperties properties;
    private final MonotonicClock clock;

    private final Queue<Runnable> inputs = new ConcurrentLinkedQueue<>();
    private final Queue<CompletableFuture<DeviceStateResponse>> waiters = new ConcurrentLinkedQueue<>();
    private final AtomicReference<DeviceStateResponse> published = new AtomicReference<>();

    private volatile boolean running;
    private volatile Thread thread;

    public UiLoop(SelectionPlaybackSync selectionPlaybackSync,
                  SleepManager sleepManager,
                  ProgressTracker progressTracker,
                  AppUiProperties properties,
                  MonotonicClock clock) {
        this.selectionPlaybackSync = selectionPlaybackSync;
        this.sleepManager = sleepManager;
        this.progressTracker = progressTracker;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        Thread uiThread = new Thread(this::run, "ui-loop");
        uiThread.setDaemon(true);
        thread = uiThread;
        uiThread.start();
        log.info("UI loop started");
    }

    @PreDestroy
    public void stop() {
        Thread uiThread;
        synchronized (this) {
            running = false;
            uiThread = thread;
            thread = null;
        }
        if (uiThread != null) {
            uiThread.interrupt();
            try {
                uiThread.join(1000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        progressTracker.saveOnShutdown();
        log.info("UI loop stopped");
    }

    /**
     * Queues input for the UI thread.
     *
     * @return completes with the state published after the input was applied
     */
    public CompletableFuture<DeviceStateResponse> submit(Runnable input) {
        CompletableFuture<DeviceStateResponse> future = new CompletableFuture<>();
        inputs.add(() -> {
            try {
                input.run();
            } finally {
                waiters.add(future);
            }
        });
        return future;
    }

    /**
     * Latest published state, computed on demand before the first tick.
     */
    public DeviceStateResponse currentState() {
        DeviceStateResponse state = published.get();
        return state != null ? state : selectionPlaybackSync.describe();
    }

    /**
     * One frame: apply queued input, tick, publish.
     */
    public void runOnce() {
        Runnable input;
        while ((input = inputs.poll()) != null) {
            try {
                input.run();
            } catch (RuntimeException e) {
                log.warn("Input handling failed", e);
            }
        }
        try {
            selectionPlaybackSync.tick();
        } catch (RuntimeException e) {
            log.error("UI tick failed", e);
        }
        DeviceStateResponse state = selectionPlaybackSync.describe();
        published.set(state);
        List<CompletableFuture<DeviceStateResponse>> ready = new ArrayList<>();
        CompletableFuture<DeviceStateResponse> waiter;
        while ((waiter = waiters.poll()) != null) {
            ready.add(waiter);
        }
        for (CompletableFuture<DeviceStateResponse> future : ready) {
            future.complete(state);
        }
    }

    /**
     * 60 fps while the carousel moves, 10 while playing, 5 when idle, slow polling asleep.
     */
    long frameIntervalMillis() {
        if (sleepManager.isSleeping()) {
            return properties.getSleepingPollMs();
        }
        int fps;
        if (selectionPlaybackSync.isAnimating()) {
            fps = properties.getAnimatingFps();
        } else if (published.get() != null && published.get().isDisplayPlaying()) {
            fps = properties.getPlayingFps();
        } else {
            fps = properties.getIdleFps();
        }
        return 1000L / Math.max(1, fps);
    }

    private void run() {
        try {
            while (running) {
                long frameStart = clock.nowMillis();
                runOnce();
                long remaining = frameIntervalMillis() - (clock.nowMillis() - frameStart);
                if (remaining > 0) {
                    clock.sleepMillis(remaining);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
