package com.example.berry.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.berry.application.event.DeviceWokeEvent;
import com.example.berry.common.config.AppVolumeProperties;
import com.example.berry.domain.enumtype.VolumeMode;
import com.example.berry.infrastructure.librespot.LibrespotClient;
import com.example.berry.infrastructure.system.SystemVolumeControl;
import com.example.berry.support.ManualClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class VolumeOwnershipArbiterTest {

    private LibrespotClient client;
    private SystemVolumeControl volumeControl;
    private ManualClock clock;
    private SimpleMeterRegistry meterRegistry;
    private VolumeOwnershipArbiter arbiter;

    @BeforeEach
    void setUp() {
        client = mock(LibrespotClient.class);
        volumeControl = mock(SystemVolumeControl.class);
        when(client.setVolume(anyInt())).thenReturn(true);
        clock = new ManualClock();
        meterRegistry = new SimpleMeterRegistry();
        arbiter = new VolumeOwnershipArbiter(new AppVolumeProperties(), client, volumeControl, Runnable::run,
                clock, beanProvider(meterRegistry));
        arbiter.init();
    }

    @Test
    void shouldApplyDefaultLevelOnStartup() {
        verify(volumeControl).setLevels(70, 70);
        assertEquals(VolumeMode.LOCAL, arbiter.getMode());
        assertEquals("volume_low", arbiter.getIcon());
    }

    @Test
    void shouldCycleLadderOnToggle() {
        arbiter.toggle();
        verify(volumeControl).setLevels(80, 80);
        assertEquals("volume_high", arbiter.getIcon());

        arbiter.toggle();
        verify(volumeControl).setLevels(60, 60);
        assertEquals(0, arbiter.getIndex());
    }

    @Test
    void shouldHandOverToRemoteWhenRemoteLowersVolume() {
        arbiter.onRemoteVolumeObserved(40);

        assertEquals(VolumeMode.REMOTE, arbiter.getMode());
        assertEquals(2, arbiter.getIndex());
        verify(volumeControl).setLevels(100, 100);
        assertEquals(1.0D, meterRegistry.counter("berry.volume.ownership",
                "mode", "remote", "reason", "remote_change").count());
    }

    @Test
    void shouldTakeBackControlWhenRemoteReturnsToFull() {
        arbiter.onRemoteVolumeObserved(40);
        clearInvocations(volumeControl);

        arbiter.onRemoteVolumeObserved(100);

        assertEquals(VolumeMode.LOCAL, arbiter.getMode());
        assertEquals(1, arbiter.getIndex());
        verify(volumeControl).setLevels(70, 70);
        verify(client).setVolume(100);
    }

    @Test
    void shouldIgnoreRemoteObservationInsideEchoWindow() {
        arbiter.toggle();
        clock.advance(1999L);

        arbiter.onRemoteVolumeObserved(30);
        assertEquals(VolumeMode.LOCAL, arbiter.getMode());

        clock.advance(1L);
        arbiter.onRemoteVolumeObserved(30);
        assertEquals(VolumeMode.REMOTE, arbiter.getMode());
    }

    @Test
    void shouldTakeBackControlOnLocalToggleInRemoteMode() {
        arbiter.onRemoteVolumeObserved(40);

        arbiter.toggle();

        assertEquals(VolumeMode.LOCAL, arbiter.getMode());
        assertEquals(2, arbiter.getIndex());
        verify(client).setVolume(100);
        verify(volumeControl).setLevels(80, 80);
    }

    @Test
    void shouldForceLocalOnWake() {
        arbiter.onRemoteVolumeObserved(40);

        arbiter.onDeviceWoke(new DeviceWokeEvent(this, "touch"));

        assertEquals(VolumeMode.LOCAL, arbiter.getMode());
    }

    @Test
    void shouldSetRemoteToFullOnlyOnce() {
        assertTrue(arbiter.ensureRemoteAtFull());
        assertFalse(arbiter.ensureRemoteAtFull());
        verify(client, times(1)).setVolume(100);
    }

    @Test
    void shouldNotFlipOnEchoOfInitialRemoteReset() {
        arbiter.ensureRemoteAtFull();
        arbiter.onRemoteVolumeObserved(65);

        assertEquals(VolumeMode.LOCAL, arbiter.getMode());
        verify(volumeControl, never()).setLevels(100, 100);
    }

    @Test
    void shouldRejectEmptyLadder() {
        AppVolumeProperties properties = new AppVolumeProperties();
        properties.setLevels(new ArrayList<>());

        assertThrows(IllegalArgumentException.class, () -> new VolumeOwnershipArbiter(properties, client,
                volumeControl, Runnable::run, clock, beanProvider(meterRegistry)));
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry registry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", registry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
