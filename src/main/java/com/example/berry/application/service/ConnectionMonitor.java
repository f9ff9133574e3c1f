package com.example.berry.application.service;

import com.example.berry.common.config.AppConnectionProperties;
import com.example.berry.common.util.MetricsRecorder;
import com.example.berry.domain.model.ConnectionState;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Debounces raw poll outcomes into a connected flag and decides the poll cadence.
 */
@Service
public class ConnectionMonitor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionMonitor.class);

    private final AppConnectionProperties properties;
    private final MetricsRecorder metrics;
    private final Object lock = new Object();

    private ConnectionState state = ConnectionState.initial();
    private boolean fastPolling;

    public ConnectionMonitor(AppConnectionProperties properties, ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.properties = properties;
        this.metrics = new MetricsRecorder(meterRegistryProvider);
    }

    public ConnectionState recordSuccess() {
        ConnectionState previous;
        ConnectionState next;
        synchronized (lock) {
            previous = state;
            next = previous.onSuccess();
            state = next;
        }
        metrics.count("berry.poll.result", "outcome", "success");
        if (previous.getFailureCount() > 0) {
            log.debug("Connection recovered after {} failures", previous.getFailureCount());
        }
        logTransition(previous, next);
        return next;
    }

    public ConnectionState recordFailure() {
        ConnectionState previous;
        ConnectionState next;
        synchronized (lock) {
            previous = state;
            next = previous.onFailure(Math.max(1, properties.getGraceThreshold()));
            state = next;
        }
        metrics.count("berry.poll.result", "outcome", "failure");
        logTransition(previous, next);
        return next;
    }

    /**
     * Optimistically trusts the connection again, e.g. after wake. The next poll corrects it.
     */
    public void resetOptimistic() {
        ConnectionState previous;
        synchronized (lock) {
            previous = state;
            state = previous.optimisticReset();
        }
        log.info("Connection reset optimistically, connected={} failCount={}",
                previous.isConnected(), previous.getFailureCount());
    }

    public boolean isConnected() {
        synchronized (lock) {
            return state.isConnected();
        }
    }

    public ConnectionState getState() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Polls faster while disconnected to shorten recovery latency.
     */
    public long pollIntervalMillis() {
        boolean fast = !isConnected();
        synchronized (lock) {
            if (fast != fastPolling) {
                log.debug(fast ? "Fast polling mode (disconnected)" : "Normal polling mode (connected)");
                fastPolling = fast;
            }
        }
        return fast ? properties.getDisconnectedPollIntervalMs() : properties.getConnectedPollIntervalMs();
    }

    /**
     * Startup backoff: base, doubling per attempt, capped.
     */
    public long initialRetryDelayMillis(int attempt) {
        long base = Math.max(1L, properties.getInitialRetryBaseMs());
        int shift = Math.max(0, Math.min(attempt, 30));
        long delay = base << shift;
        if (delay <= 0 || delay > properties.getInitialRetryMaxMs()) {
            return properties.getInitialRetryMaxMs();
        }
        return delay;
    }

    private void logTransition(ConnectionState previous, ConnectionState next) {
        if (previous.isConnected() == next.isConnected()) {
            return;
        }
        if (next.isConnected()) {
            log.info("CONNECTION RESTORED (was disconnected)");
        } else {
            log.warn("CONNECTION LOST after {} failures", next.getFailureCount());
        }
        metrics.count("berry.connection.transition", "connected", String.valueOf(next.isConnected()));
    }
}
