package com.example.berry.common.util;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;

/**
 * Null-safe wrapper around an optional {@link MeterRegistry}.
 */
public class MetricsRecorder {

    private static final Logger log = LoggerFactory.getLogger(MetricsRecorder.class);

    private final MeterRegistry meterRegistry;

    public MetricsRecorder(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.meterRegistry = meterRegistryProvider == null ? null : meterRegistryProvider.getIfAvailable();
    }

    public void count(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("Metric counter failed, name={}", name, ex);
        }
    }

    public void duration(String name, long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Metric timer failed, name={}", name, ex);
        }
    }
}
