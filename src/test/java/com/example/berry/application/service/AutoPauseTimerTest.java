package com.example.berry.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.berry.common.config.AppAutoPauseProperties;
import com.example.berry.domain.enumtype.AutoPausePhase;
import com.example.berry.infrastructure.librespot.LibrespotClient;
import com.example.berry.infrastructure.system.SystemVolumeControl;
import com.example.berry.support.ManualClock;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class AutoPauseTimerTest {

    private static final long THIRTY_MINUTES = 30L * 60L * 1000L;
    private static final String A = "spotify:album:a";
    private static final String B = "spotify:album:b";

    private LibrespotClient client;
    private SystemVolumeControl volumeControl;
    private ManualClock clock;
    private AppAutoPauseProperties properties;
    private List<Runnable> queued;

    @BeforeEach
    void setUp() {
        client = mock(LibrespotClient.class);
        volumeControl = mock(SystemVolumeControl.class);
        when(volumeControl.getMasterLevel()).thenReturn(70);
        when(client.pause()).thenReturn(true);
        clock = new ManualClock();
        properties = new AppAutoPauseProperties();
        queued = new ArrayList<>();
    }

    @Test
    void shouldFadePauseAndRestoreVolumeAfterTimeout() {
        AutoPauseTimer timer = timer(Runnable::run);
        timer.onPlaying(A);
        clock.advance(THIRTY_MINUTES);

        assertTrue(timer.tick(true));

        InOrder order = inOrder(volumeControl, client);
        order.verify(volumeControl).setMasterLevel(0);
        order.verify(client).pause();
        order.verify(volumeControl).setMasterLevel(70);
        assertEquals(AutoPausePhase.IDLE, timer.getPhase());
        assertTrue(clock.getSleeps().contains(500L));
        assertEquals(21, clock.getSleeps().size());
    }

    @Test
    void shouldNotTriggerBeforeTimeout() {
        AutoPauseTimer timer = timer(Runnable::run);
        timer.onPlaying(A);
        clock.advance(THIRTY_MINUTES - 1L);

        assertFalse(timer.tick(true));
        assertEquals(1L, timer.remainingMillis());
        verify(client, never()).pause();
    }

    @Test
    void shouldKeepStartTimeWhenSameContextReported() {
        AutoPauseTimer timer = timer(Runnable::run);
        timer.onPlaying(A);
        clock.advance(20L * 60L * 1000L);
        timer.onPlaying(A);
        clock.advance(10L * 60L * 1000L);

        assertTrue(timer.tick(true));
    }

    @Test
    void shouldRestartOnContextChange() {
        AutoPauseTimer timer = timer(Runnable::run);
        timer.onPlaying(A);
        clock.advance(20L * 60L * 1000L);
        timer.onPlaying(B);
        clock.advance(20L * 60L * 1000L);

        assertFalse(timer.tick(true));
        assertEquals(B, timer.getContextUri());
        assertEquals(10L * 60L * 1000L, timer.remainingMillis());
    }

    @Test
    void shouldResetWhenPlaybackStops() {
        AutoPauseTimer timer = timer(Runnable::run);
        timer.onPlaying(A);
        timer.onStopped();

        assertEquals(AutoPausePhase.IDLE, timer.getPhase());
        assertNull(timer.getContextUri());
        assertEquals(-1L, timer.remainingMillis());
        clock.advance(THIRTY_MINUTES);
        assertFalse(timer.tick(true));
    }

    @Test
    void shouldDoNothingWhenDisabled() {
        properties.setEnabled(false);
        AutoPauseTimer timer = timer(Runnable::run);
        timer.onPlaying(A);
        clock.advance(THIRTY_MINUTES);

        assertFalse(timer.tick(true));
    }

    @Test
    void shouldRestoreImmediatelyOnManualResumeAndSkipPause() {
        AutoPauseTimer timer = timer(queued::add);
        timer.onPlaying(A);
        clock.advance(THIRTY_MINUTES);
        assertTrue(timer.tick(true));
        assertEquals(AutoPausePhase.FADING, timer.getPhase());

        timer.restoreVolumeIfNeeded();
        verify(volumeControl).setMasterLevel(70);

        queued.get(0).run();
        verify(client, never()).pause();
        verify(volumeControl, atLeastOnce()).setMasterLevel(anyInt());
        assertEquals(AutoPausePhase.IDLE, timer.getPhase());
    }

    @Test
    void shouldIgnoreStaleFadeAfterNewerPlayback() {
        AutoPauseTimer timer = timer(queued::add);
        timer.onPlaying(A);
        clock.advance(THIRTY_MINUTES);
        timer.tick(true);
        timer.onStopped();
        timer.onPlaying(B);

        queued.get(0).run();

        verify(client, never()).pause();
        assertEquals(AutoPausePhase.ARMED, timer.getPhase());
        assertEquals(B, timer.getContextUri());
    }

    @Test
    void shouldRetryFadeWhenCommandPoolRejectsIt() {
        AtomicBoolean reject = new AtomicBoolean(true);
        AutoPauseTimer timer = timer(task -> {
            if (reject.get()) {
                throw new RejectedExecutionException("full");
            }
            task.run();
        });
        timer.onPlaying(A);
        clock.advance(THIRTY_MINUTES);

        assertFalse(timer.tick(true));
        assertEquals(AutoPausePhase.ARMED, timer.getPhase());
        assertEquals(0L, timer.remainingMillis());
        timer.restoreVolumeIfNeeded();
        verify(volumeControl, never()).setMasterLevel(anyInt());

        reject.set(false);
        assertTrue(timer.tick(true));
        verify(client).pause();
        assertEquals(AutoPausePhase.IDLE, timer.getPhase());
    }

    private AutoPauseTimer timer(Executor executor) {
        return new AutoPauseTimer(properties, client, volumeControl, executor, clock,
                new StaticListableBeanFactory().getBeanProvider(MeterRegistry.class));
    }
}
