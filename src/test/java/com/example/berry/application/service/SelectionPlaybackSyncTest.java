package com.example.berry.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.berry.api.response.DeviceStateResponse;
import com.example.berry.common.config.AppCatalogProperties;
import com.example.berry.common.config.AppConnectionProperties;
import com.example.berry.common.config.AppPlaybackProperties;
import com.example.berry.common.config.AppUiProperties;
import com.example.berry.domain.enumtype.ControlButton;
import com.example.berry.domain.enumtype.PendingAction;
import com.example.berry.domain.enumtype.SwipeDirection;
import com.example.berry.domain.enumtype.VolumeMode;
import com.example.berry.domain.model.PlaybackSnapshot;
import com.example.berry.infrastructure.librespot.LibrespotClient;
import com.example.berry.support.InMemoryCatalogStore;
import com.example.berry.support.ManualClock;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class SelectionPlaybackSyncTest {

    private static final String A = "spotify:album:a";
    private static final String B = "spotify:album:b";
    private static final String C = "spotify:album:c";
    private static final String D = "spotify:playlist:d";

    private ManualClock clock;
    private CatalogService catalogService;
    private PlaybackStateStore stateStore;
    private ConnectionMonitor connectionMonitor;
    private PlayRequestCoordinator coordinator;
    private PlayStateTracker playStateTracker;
    private VolumeOwnershipArbiter volumeArbiter;
    private AutoPauseTimer autoPauseTimer;
    private ProgressTracker progressTracker;
    private SleepManager sleepManager;
    private LibrespotClient client;
    private SelectionPlaybackSync sync;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        AppCatalogProperties catalogProperties = new AppCatalogProperties();
        catalogProperties.getItems().add(catalogItem("1", A, "Album A"));
        catalogProperties.getItems().add(catalogItem("2", B, "Album B"));
        catalogProperties.getItems().add(catalogItem("3", C, "Album C"));
        catalogProperties.getItems().add(catalogItem("4", D, "Playlist D"));
        catalogService = new CatalogService(catalogProperties, new InMemoryCatalogStore(),
                Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC));
        stateStore = new PlaybackStateStore();
        connectionMonitor = new ConnectionMonitor(new AppConnectionProperties(),
                new StaticListableBeanFactory().getBeanProvider(MeterRegistry.class));
        connectionMonitor.recordSuccess();
        AppPlaybackProperties playbackProperties = new AppPlaybackProperties();
        playStateTracker = new PlayStateTracker(playbackProperties, clock);
        coordinator = mock(PlayRequestCoordinator.class);
        volumeArbiter = mock(VolumeOwnershipArbiter.class);
        when(volumeArbiter.getMode()).thenReturn(VolumeMode.LOCAL);
        when(volumeArbiter.getIcon()).thenReturn("volume_low");
        autoPauseTimer = mock(AutoPauseTimer.class);
        progressTracker = mock(ProgressTracker.class);
        sleepManager = mock(SleepManager.class);
        client = mock(LibrespotClient.class);
        when(client.pause()).thenReturn(true);
        when(client.resume()).thenReturn(true);
        when(client.next()).thenReturn(true);
        sync = new SelectionPlaybackSync(catalogService, stateStore, connectionMonitor, coordinator,
                playStateTracker, volumeArbiter, autoPauseTimer, progressTracker, sleepManager, client,
                Runnable::run, playbackProperties, new AppUiProperties(), clock);
    }

    @Test
    void shouldOnlyFireTimerForFinalItemOfFastSwipes() {
        for (int i = 0; i < 3; i++) {
            sync.onSwipe(SwipeDirection.LEFT);
            clock.advance(200L);
            sync.tick();
        }
        assertEquals(3, sync.getTargetIndex());

        clock.advance(250L);
        sync.tick();
        assertTrue(sync.getPlayTimer().isArmed());
        clock.advance(1000L);
        sync.tick();

        verify(coordinator, times(1)).requestPlay(D);
        verify(coordinator, never()).requestPlay(B);
        verify(coordinator, never()).requestPlay(C);
        assertEquals(3, sync.getSelectedIndex());
    }

    @Test
    void shouldResumeInsteadOfReplayWhenSwipingBackToPlayingItem() {
        playing(A);
        sync.tick();

        sync.onSwipe(SwipeDirection.LEFT);
        verify(client).pause();
        assertTrue(sync.getNavigationPause().matches(A));

        clock.advance(100L);
        sync.tick();
        assertTrue(sync.getNavigationPause().isActive());

        sync.onSwipe(SwipeDirection.RIGHT);
        verify(client).resume();
        verify(autoPauseTimer).restoreVolumeIfNeeded();
        assertFalse(sync.getNavigationPause().isActive());

        clock.advance(300L);
        sync.tick();
        clock.advance(1500L);
        sync.tick();
        verify(coordinator, never()).requestPlay(anyString());
        assertEquals(0, sync.getSelectedIndex());
    }

    @Test
    void shouldClearNavigationPauseWhenPlaybackResumesElsewhere() {
        playing(A);
        sync.tick();
        sync.onSwipe(SwipeDirection.LEFT);

        paused(A);
        sync.tick();
        assertTrue(sync.getNavigationPause().isActive());

        playing(A);
        sync.tick();
        assertFalse(sync.getNavigationPause().isActive());
    }

    @Test
    void shouldNotPullSelectionBackAfterPlayTimerFires() {
        playing(A);
        sync.tick();

        sync.onSwipe(SwipeDirection.LEFT);
        clock.advance(250L);
        sync.tick();
        clock.advance(1000L);
        sync.tick();
        verify(coordinator).requestPlay(B);

        playing(B);
        clock.advance(500L);
        sync.tick();
        assertEquals(1, sync.getTargetIndex());

        playing(C);
        clock.advance(500L);
        sync.tick();
        assertEquals(1, sync.getTargetIndex());

        playing(B);
        clock.advance(3000L);
        sync.tick();
        assertEquals(1, sync.getTargetIndex());
        assertNull(sync.getPlayTimer().getLastFiredUri());
    }

    @Test
    void shouldFollowContextStartedElsewhere() {
        playing(A);
        sync.tick();
        assertEquals(0, sync.getTargetIndex());

        playing(C);
        sync.tick();
        assertEquals(2, sync.getTargetIndex());
        assertTrue(sync.isAnimating());

        clock.advance(250L);
        sync.tick();
        assertEquals(2, sync.getSelectedIndex());
        assertFalse(sync.getPlayTimer().isArmed());
        clock.advance(2000L);
        sync.tick();
        verify(coordinator, never()).requestPlay(anyString());
    }

    @Test
    void shouldNotSyncWhileDragging() {
        playing(A);
        sync.tick();
        sync.onDragStart();

        playing(C);
        sync.tick();
        assertEquals(0, sync.getTargetIndex());

        sync.onDragEnd(0);
        clock.advance(250L);
        sync.tick();
        sync.tick();
        assertEquals(2, sync.getTargetIndex());
    }

    @Test
    void shouldCancelPlayTimerWhenDisconnected() {
        sync.onSelect(2);
        clock.advance(250L);
        sync.tick();
        assertTrue(sync.getPlayTimer().isArmed());

        connectionMonitor.recordFailure();
        connectionMonitor.recordFailure();
        connectionMonitor.recordFailure();
        clock.advance(1000L);
        sync.tick();

        assertFalse(sync.getPlayTimer().isArmed());
        verify(coordinator, never()).requestPlay(anyString());
    }

    @Test
    void shouldShowTempItemAndSyncToIt() {
        String foreign = "spotify:album:zzz";
        stateStore.replace(PlaybackSnapshot.builder().playing(true).contextUri(foreign).trackAlbum("Foreign").build());
        catalogService.updateTempItem(stateStore.current());

        sync.tick();

        assertEquals(4, sync.getTargetIndex());
        DeviceStateResponse state = sync.describe();
        assertEquals(5, state.getItems().size());
        assertTrue(state.getItems().get(4).isTemp());
        assertEquals("Foreign", state.getItems().get(4).getName());
    }

    @Test
    void shouldPauseWhenPlayingAndResumeWhenPaused() {
        playing(A);
        sync.tick();
        sync.onButton(ControlButton.PLAY_PAUSE);
        verify(client).pause();
        assertEquals(PendingAction.PAUSE, playStateTracker.getPendingAction());

        paused(A);
        clock.advance(400L);
        sync.onButton(ControlButton.PLAY_PAUSE);
        verify(autoPauseTimer).restoreVolumeIfNeeded();
        verify(client).resume();
        assertEquals(PendingAction.PLAY, playStateTracker.getPendingAction());
    }

    @Test
    void shouldPlaySelectedItemWhenNothingLoaded() {
        sync.onButton(ControlButton.PLAY_PAUSE);

        verify(coordinator).requestPlay(A);
        assertTrue(playStateTracker.displayPlaying(false));
    }

    @Test
    void shouldIgnorePlayPauseWhileDisconnected() {
        connectionMonitor.recordFailure();
        connectionMonitor.recordFailure();
        connectionMonitor.recordFailure();

        sync.onButton(ControlButton.PLAY_PAUSE);

        verify(coordinator, never()).requestPlay(anyString());
        verify(client, never()).pause();
    }

    @Test
    void shouldDebounceButtons() {
        sync.onButton(ControlButton.NEXT);
        clock.advance(100L);
        sync.onButton(ControlButton.NEXT);
        clock.advance(300L);
        sync.onButton(ControlButton.NEXT);

        verify(client, times(2)).next();
    }

    @Test
    void shouldForwardVolumeButton() {
        sync.onButton(ControlButton.VOLUME);

        verify(volumeArbiter).toggle();
    }

    @Test
    void shouldConsumeInputThatWakesTheScreen() {
        when(sleepManager.recordActivity()).thenReturn(true);

        sync.onSwipe(SwipeDirection.LEFT);

        assertEquals(0, sync.getTargetIndex());
    }

    @Test
    void shouldClampSelectionToCatalogBounds() {
        sync.onSwipe(SwipeDirection.RIGHT);
        assertEquals(0, sync.getTargetIndex());

        sync.onSelect(42);
        assertEquals(3, sync.getTargetIndex());
    }

    @Test
    void shouldShowLoadingWhileTimerArmed() {
        sync.onSelect(1);
        clock.advance(250L);
        sync.tick();

        assertTrue(sync.describe().isShowLoading());
        assertFalse(sync.describe().isSpinnerVisible());
        clock.advance(300L);
        sync.tick();
        assertTrue(sync.describe().isSpinnerVisible());
    }

    @Test
    void shouldNotPauseWhenLeavingCoverThatIsNotPlaying() {
        sync.onSelect(1);
        clock.advance(250L);
        sync.tick();
        sync.getPlayTimer().cancel();
        playing(A);

        sync.onSwipe(SwipeDirection.LEFT);

        verify(client, never()).pause();
        assertFalse(sync.getNavigationPause().isActive());
        assertEquals(2, sync.getTargetIndex());
    }

    @Test
    void shouldResumePausedContextWhateverIsSelected() {
        paused(A);
        sync.onSelect(2);

        sync.onButton(ControlButton.PLAY_PAUSE);

        verify(client).resume();
        verify(autoPauseTimer).restoreVolumeIfNeeded();
        verify(coordinator, never()).requestPlay(anyString());
    }

    @Test
    void shouldDeleteCoverAndPlayThePreviousOne() {
        sync.onSelect(2);
        clock.advance(250L);
        sync.tick();
        assertTrue(sync.getPlayTimer().isArmed());

        sync.onLongPress();
        assertEquals("3", sync.describe().getDeleteModeItemId());
        assertTrue(sync.confirmDelete());

        assertNull(sync.getDeleteModeItemId());
        assertEquals(3, catalogService.catalogItems().size());
        assertEquals(1, sync.getSelectedIndex());
        assertEquals(1, sync.getTargetIndex());
        assertFalse(sync.getPlayTimer().isArmed());
        verify(coordinator).requestPlay(B);
        clock.advance(1500L);
        sync.tick();
        verify(coordinator, never()).requestPlay(C);
    }

    @Test
    void shouldStayOnFirstCoverWhenDeletingIt() {
        sync.onLongPress();

        assertTrue(sync.confirmDelete());

        assertEquals(0, sync.getSelectedIndex());
        assertEquals(B, catalogService.catalogItems().get(0).getUri());
        verify(coordinator).requestPlay(B);
    }

    @Test
    void shouldCancelDeleteModeWhenCarouselMoves() {
        sync.onLongPress();
        assertEquals("1", sync.getDeleteModeItemId());

        sync.onSwipe(SwipeDirection.LEFT);

        assertNull(sync.getDeleteModeItemId());
        assertFalse(sync.confirmDelete());
        assertEquals(4, catalogService.catalogItems().size());
    }

    @Test
    void shouldNotArmDeleteModeOnTempItem() {
        String foreign = "spotify:album:zzz";
        stateStore.replace(PlaybackSnapshot.builder().playing(true).contextUri(foreign).trackAlbum("Foreign").build());
        catalogService.updateTempItem(stateStore.current());
        sync.tick();
        clock.advance(250L);
        sync.tick();
        assertEquals(4, sync.getSelectedIndex());

        sync.onLongPress();

        assertNull(sync.getDeleteModeItemId());
        assertFalse(sync.confirmDelete());
    }

    @Test
    void shouldSaveTempItemWithoutMovingSelection() {
        String foreign = "spotify:album:zzz";
        stateStore.replace(PlaybackSnapshot.builder().playing(true).contextUri(foreign).trackAlbum("Foreign").build());
        catalogService.updateTempItem(stateStore.current());
        sync.tick();
        clock.advance(250L);
        sync.tick();

        assertTrue(sync.saveTempItem());
        sync.tick();

        DeviceStateResponse state = sync.describe();
        assertEquals(5, state.getItems().size());
        assertFalse(state.getItems().get(4).isTemp());
        assertEquals("Foreign", state.getItems().get(4).getName());
        assertEquals(4, state.getSelectedIndex());
        assertFalse(sync.saveTempItem());
    }

    private void playing(String contextUri) {
        stateStore.replace(PlaybackSnapshot.builder().playing(true).contextUri(contextUri).build());
    }

    private void paused(String contextUri) {
        stateStore.replace(PlaybackSnapshot.builder().paused(true).contextUri(contextUri).build());
    }

    private AppCatalogProperties.Item catalogItem(String id, String uri, String name) {
        AppCatalogProperties.Item item = new AppCatalogProperties.Item();
        item.setId(id);
        item.setUri(uri);
        item.setName(name);
        item.setType(uri.contains("playlist") ? "playlist" : "album");
        return item;
    }
}
