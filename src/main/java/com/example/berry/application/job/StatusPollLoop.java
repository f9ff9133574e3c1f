package com.example.berry.application.job;

import com.example.berry.application.event.DeviceWokeEvent;
import com.example.berry.application.event.RepollRequestedEvent;
import com.example.berry.application.service.ConnectionMonitor;
import com.example.berry.application.service.StatusRefreshService;
import com.example.berry.common.config.AppConnectionProperties;
import com.example.berry.domain.model.StatusReport;
import com.example.berry.infrastructure.librespot.LibrespotClient;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Dedicated thread that polls the player. Startup retries with backoff, then polls at the
 * cadence chosen by the {@link ConnectionMonitor}. Wake and push events cut the wait short.
 */
@Service
public class StatusPollLoop {

    private static final Logger log = LoggerFactory.getLogger(StatusPollLoop.class);

    private final LibrespotClient librespotClient;
    private final ConnectionMonitor connectionMonitor;
    private final StatusRefreshService statusRefreshService;
    private final AppConnectionProperties properties;
    private final Semaphore repollSignal = new Semaphore(0);

    private volatile boolean running;
    private volatile Thread thread;

    public StatusPollLoop(LibrespotClient librespotClient,
                          ConnectionMonitor connectionMonitor,
                          StatusRefreshService statusRefreshService,
                          AppConnectionProperties properties) {
        this.librespotClient = librespotClient;
        this.connectionMonitor = connectionMonitor;
        this.statusRefreshService = statusRefreshService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        Thread pollThread = new Thread(this::run, "status-poll");
        pollThread.setDaemon(true);
        thread = pollThread;
        pollThread.start();
        log.info("Status poll loop started");
    }

    @PreDestroy
    public synchronized void stop() {
        running = false;
        Thread pollThread = thread;
        thread = null;
        if (pollThread != null) {
            pollThread.interrupt();
        }
        log.info("Status poll loop stopped");
    }

    /**
     * One poll: status, probe fallback, connection bookkeeping, fan-out on success.
     *
     * @return true when the player answered
     */
    public boolean pollOnce() {
        StatusReport report;
        try {
            report = librespotClient.status();
        } catch (RuntimeException e) {
            log.warn("Status poll failed unexpectedly", e);
            report = null;
        }
        if (report == null && !librespotClient.isConnected()) {
            connectionMonitor.recordFailure();
            return false;
        }
        connectionMonitor.recordSuccess();
        if (report != null) {
            try {
                statusRefreshService.apply(report);
            } catch (RuntimeException e) {
                log.error("Applying status failed", e);
            }
        }
        return true;
    }

    /**
     * Startup: retry with exponential backoff until the player answers or attempts run out.
     */
    public boolean initialConnect() throws InterruptedException {
        int attempts = Math.max(1, properties.getInitialRetryAttempts());
        for (int attempt = 0; attempt < attempts; attempt++) {
            if (pollOnce()) {
                log.info("Connected to player, attempt={}", attempt + 1);
                return true;
            }
            long delay = connectionMonitor.initialRetryDelayMillis(attempt);
            log.info("Player not reachable, retrying in {}ms (attempt {}/{})", delay, attempt + 1, attempts);
            waitForNextPoll(delay);
        }
        log.warn("Player not reachable after {} attempts, continuing with regular polling", attempts);
        return false;
    }

    public void requestImmediatePoll() {
        repollSignal.release();
    }

    @EventListener
    public void onDeviceWoke(DeviceWokeEvent event) {
        connectionMonitor.resetOptimistic();
        requestImmediatePoll();
    }

    @EventListener
    public void onRepollRequested(RepollRequestedEvent event) {
        if (event.isResetConnection()) {
            connectionMonitor.resetOptimistic();
        }
        log.debug("Re-poll requested, reason={}", event.getReason());
        requestImmediatePoll();
    }

    private void run() {
        try {
            initialConnect();
            while (running) {
                pollOnce();
                waitForNextPoll(connectionMonitor.pollIntervalMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Status poll loop crashed", e);
        }
    }

    private void waitForNextPoll(long delayMs) throws InterruptedException {
        if (repollSignal.tryAcquire(Math.max(0L, delayMs), TimeUnit.MILLISECONDS)) {
            repollSignal.drainPermits();
        }
    }
}
