package com.example.berry.application.service;

import com.example.berry.api.response.CatalogItemResponse;
import com.example.berry.api.response.DeviceStateResponse;
import com.example.berry.api.response.NowPlayingResponse;
import com.example.berry.common.config.AppPlaybackProperties;
import com.example.berry.common.config.AppUiProperties;
import com.example.berry.common.util.MonotonicClock;
import com.example.berry.domain.enumtype.ControlButton;
import com.example.berry.domain.enumtype.PendingAction;
import com.example.berry.domain.enumtype.SwipeDirection;
import com.example.berry.domain.model.CatalogItem;
import com.example.berry.domain.model.NavigationPause;
import com.example.berry.domain.model.PlayTimer;
import com.example.berry.domain.model.PlaybackSnapshot;
import com.example.berry.infrastructure.librespot.LibrespotClient;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Keeps the carousel selection and the player in step.
 *
 * <ul>
 *     <li>Resting on a new cover arms the play timer; it fires after the delay.</li>
 *     <li>Swiping away from the playing cover pauses; swiping back resumes.</li>
 *     <li>A context started elsewhere pulls the selection to its cover.</li>
 *     <li>A long press arms delete mode on a catalog cover; confirming deletes it, selects the
 *     previous cover and plays it.</li>
 * </ul>
 *
 * <p>Not thread-safe. Every method runs on the UI loop thread; the control surface posts its
 * input there.
 */
@Service
public class SelectionPlaybackSync {

    private static final Logger log = LoggerFactory.getLogger(SelectionPlaybackSync.class);

    private final CatalogService catalogService;
    private final PlaybackStateStore playbackStateStore;
    private final ConnectionMonitor connectionMonitor;
    private final PlayRequestCoordinator playRequestCoordinator;
    private final PlayStateTracker playStateTracker;
    private final VolumeOwnershipArbiter volumeOwnershipArbiter;
    private final AutoPauseTimer autoPauseTimer;
    private final ProgressTracker progressTracker;
    private final SleepManager sleepManager;
    private final LibrespotClient librespotClient;
    private final Executor commandExecutor;
    private final AppPlaybackProperties playbackProperties;
    private final AppUiProperties uiProperties;
    private final MonotonicClock clock;

    private final PlayTimer playTimer;
    private NavigationPause navigationPause = NavigationPause.inactive();
    // The pause issued on navigation has shown up in a poll.
    private boolean navigationPauseConfirmed;

    private int selectedIndex;
    private int targetIndex;
    private boolean settled = true;
    private long settleAt;
    private boolean dragging;
    private boolean syncedMove;
    private String lastSyncedContextUri;
    private long lastButtonAt = Long.MIN_VALUE;
    private String deleteModeItemId;

    public SelectionPlaybackSync(CatalogService catalogService,
                                 PlaybackStateStore playbackStateStore,
                                 ConnectionMonitor connectionMonitor,
                                 PlayRequestCoordinator playRequestCoordinator,
                                 PlayStateTracker playStateTracker,
                                 VolumeOwnershipArbiter volumeOwnershipArbiter,
                                 AutoPauseTimer autoPauseTimer,
                                 ProgressTracker progressTracker,
                                 SleepManager sleepManager,
                                 LibrespotClient librespotClient,
                                 @Qualifier("commandExecutor") Executor commandExecutor,
                                 AppPlaybackProperties playbackProperties,
                                 AppUiProperties uiProperties,
                                 MonotonicClock clock) {
        this.catalogService = catalogService;
        this.playbackStateStore = playbackStateStore;
        this.connectionMonitor = connectionMonitor;
        this.playRequestCoordinator = playRequestCoordinator;
        this.playStateTracker = playStateTracker;
        this.volumeOwnershipArbiter = volumeOwnershipArbiter;
        this.autoPauseTimer = autoPauseTimer;
        this.progressTracker = progressTracker;
        this.sleepManager = sleepManager;
        this.librespotClient = librespotClient;
        this.commandExecutor = commandExecutor;
        this.playbackProperties = playbackProperties;
        this.uiProperties = uiProperties;
        this.clock = clock;
        this.playTimer = new PlayTimer(playbackProperties.getPlayTimerDelayMs(), playbackProperties.getSyncCooldownMs());
    }

    public void onSwipe(SwipeDirection direction) {
        if (consumedByWake() || dragging) {
            return;
        }
        cancelDeleteMode();
        moveTo(targetIndex + direction.getStep());
    }

    public void onSelect(int index) {
        if (consumedByWake()) {
            return;
        }
        cancelDeleteMode();
        moveTo(index);
    }

    public void onDragStart() {
        if (consumedByWake()) {
            return;
        }
        cancelDeleteMode();
        dragging = true;
        playTimer.cancel();
    }

    public void onDragEnd(int index) {
        dragging = false;
        sleepManager.recordActivity();
        moveTo(index);
        if (settled) {
            startSettling();
        }
    }

    /**
     * The carousel animation reached its target.
     */
    public void onSettle() {
        if (!dragging && !settled) {
            settleAt = clock.nowMillis();
        }
    }

    public void onButton(ControlButton button) {
        if (consumedByWake()) {
            return;
        }
        long now = clock.nowMillis();
        if (lastButtonAt != Long.MIN_VALUE && now - lastButtonAt < playbackProperties.getButtonDebounceMs()) {
            log.debug("Button {} debounced", button);
            return;
        }
        lastButtonAt = now;
        cancelDeleteMode();
        switch (button) {
            case PLAY_PAUSE:
                togglePlay();
                break;
            case NEXT:
                if (connectionMonitor.isConnected()) {
                    sendAsync("next", librespotClient::next);
                }
                break;
            case PREV:
                if (connectionMonitor.isConnected()) {
                    sendAsync("prev", librespotClient::prev);
                }
                break;
            case VOLUME:
                volumeOwnershipArbiter.toggle();
                break;
            default:
                log.warn("Unknown button {}", button);
        }
    }

    /**
     * Arms delete mode on the selected cover. The temp item cannot be deleted.
     */
    public void onLongPress() {
        if (consumedByWake() || dragging) {
            return;
        }
        CatalogItem selected = selectedItem();
        if (selected == null || selected.isTemp()) {
            log.debug("Long press ignored, nothing deletable selected");
            return;
        }
        deleteModeItemId = selected.getId();
        log.info("Delete mode armed, id={} name={}", selected.getId(), selected.getName());
    }

    /**
     * Deletes the cover delete mode was armed on. The previous cover becomes the selection and
     * plays unless it is the temp item.
     *
     * @return true when an item was deleted
     */
    public boolean confirmDelete() {
        if (consumedByWake() || deleteModeItemId == null) {
            return false;
        }
        String id = deleteModeItemId;
        deleteModeItemId = null;
        int deletedIndex = indexOfId(catalogService.displayItems(), id);
        if (deletedIndex < 0 || !catalogService.deleteItem(id)) {
            return false;
        }
        List<CatalogItem> items = catalogService.displayItems();
        playTimer.cancel();
        syncedMove = false;
        settled = true;
        if (items.isEmpty()) {
            selectedIndex = 0;
            targetIndex = 0;
            return true;
        }
        int newIndex = Math.max(0, Math.min(deletedIndex - 1, items.size() - 1));
        selectedIndex = newIndex;
        targetIndex = newIndex;
        CatalogItem item = items.get(newIndex);
        if (!item.isTemp() && connectionMonitor.isConnected()) {
            log.info("PLAYBACK_EVENT event=play_after_delete contextUri={} name={}", item.getUri(), item.getName());
            navigationPause = NavigationPause.inactive();
            playStateTracker.setPending(PendingAction.PLAY);
            playRequestCoordinator.requestPlay(item.getUri());
        }
        return true;
    }

    /**
     * Adds the temp item to the catalog. It stays at the same carousel position.
     *
     * @return true when the item was saved
     */
    public boolean saveTempItem() {
        if (consumedByWake()) {
            return false;
        }
        cancelDeleteMode();
        return catalogService.saveTempItem() != null;
    }

    public void togglePlay() {
        if (!connectionMonitor.isConnected()) {
            log.info("Play/pause ignored, player disconnected");
            return;
        }
        PlaybackSnapshot snapshot = playbackStateStore.current();
        CatalogItem selected = selectedItem();
        navigationPause = NavigationPause.inactive();
        if (snapshot.isPlaying()) {
            playStateTracker.setPending(PendingAction.PAUSE);
            sendAsync("pause", librespotClient::pause);
            return;
        }
        if (snapshot.isPaused()) {
            autoPauseTimer.restoreVolumeIfNeeded();
            playStateTracker.setPending(PendingAction.PLAY);
            sendAsync("resume", librespotClient::resume);
            return;
        }
        if (selected != null) {
            playTimer.cancel();
            playStateTracker.setPending(PendingAction.PLAY);
            playRequestCoordinator.requestPlay(selected.getUri());
        }
    }

    public void tick() {
        long now = clock.nowMillis();
        List<CatalogItem> items = catalogService.displayItems();
        clampSelection(items.size());
        PlaybackSnapshot snapshot = playbackStateStore.current();
        boolean connected = connectionMonitor.isConnected();

        if (snapshot.isPlaying()) {
            playRequestCoordinator.markPlaybackStarted();
        }
        trackNavigationPause(snapshot);

        if (!settled && !dragging && now >= settleAt) {
            onSettled(items, snapshot);
        }

        if (playTimer.isArmed()) {
            if (!connected) {
                log.info("Play timer cancelled, player disconnected");
                playTimer.cancel();
            } else {
                CatalogItem fired = playTimer.poll(now);
                if (fired != null) {
                    log.info("PLAYBACK_EVENT event=play_timer_fired contextUri={} name={}", fired.getUri(), fired.getName());
                    navigationPause = NavigationPause.inactive();
                    playRequestCoordinator.requestPlay(fired.getUri());
                }
            }
        }

        syncToPlaying(items, snapshot, now);

        progressTracker.saveIfDue();
        sleepManager.check(snapshot.isPlaying());

        if (showLoading(snapshot)) {
            playStateTracker.startLoading();
        } else {
            playStateTracker.stopLoading();
        }
    }

    public boolean isAnimating() {
        return dragging || !settled;
    }

    public DeviceStateResponse describe() {
        PlaybackSnapshot snapshot = playbackStateStore.current();
        List<CatalogItemResponse> items = new ArrayList<>();
        for (CatalogItem item : catalogService.displayItems()) {
            items.add(new CatalogItemResponse(item.getId(), item.getUri(), item.getName(), item.getType(),
                    item.getArtist(), item.isTemp()));
        }
        NowPlayingResponse nowPlaying = new NowPlayingResponse(
                snapshot.isPlaying(),
                snapshot.isPaused(),
                snapshot.isStopped(),
                snapshot.getContextUri(),
                snapshot.getTrackUri(),
                snapshot.getTrackName(),
                snapshot.getTrackArtist(),
                snapshot.getTrackAlbum(),
                snapshot.getTrackCover(),
                snapshot.getPositionMs(),
                snapshot.getDurationMs(),
                snapshot.progress());
        return DeviceStateResponse.builder()
                .connected(connectionMonitor.isConnected())
                .sleeping(sleepManager.isSleeping())
                .nowPlaying(nowPlaying)
                .showLoading(showLoading(snapshot))
                .spinnerVisible(playStateTracker.isSpinnerVisible())
                .displayPlaying(playStateTracker.displayPlaying(snapshot.isPlaying()))
                .selectedIndex(selectedIndex)
                .targetIndex(targetIndex)
                .settled(settled)
                .dragging(dragging)
                .items(items)
                .volumeMode(volumeOwnershipArbiter.getMode().name())
                .volumeIcon(volumeOwnershipArbiter.getIcon())
                .navigationPausedContextUri(navigationPause.getPausedContextUri())
                .autoPauseRemainingMs(autoPauseTimer.remainingMillis())
                .deleteModeItemId(deleteModeItemId)
                .build();
    }

    public boolean showLoading(PlaybackSnapshot snapshot) {
        return navigationPause.isActive()
                || playTimer.isArmed()
                || playStateTracker.getPendingAction() == PendingAction.PLAY
                || (playRequestCoordinator.isInFlight() && !snapshot.isPlaying());
    }

    public int getSelectedIndex() {
        return selectedIndex;
    }

    public int getTargetIndex() {
        return targetIndex;
    }

    public NavigationPause getNavigationPause() {
        return navigationPause;
    }

    public PlayTimer getPlayTimer() {
        return playTimer;
    }

    public String getDeleteModeItemId() {
        return deleteModeItemId;
    }

    private boolean consumedByWake() {
        return sleepManager.recordActivity();
    }

    private void moveTo(int index) {
        List<CatalogItem> items = catalogService.displayItems();
        if (items.isEmpty()) {
            return;
        }
        int clamped = Math.max(0, Math.min(index, items.size() - 1));
        if (clamped == targetIndex) {
            return;
        }
        CatalogItem leaving = targetIndex < items.size() ? items.get(targetIndex) : null;
        targetIndex = clamped;
        syncedMove = false;
        startSettling();
        onSelectionChanged(leaving, items.get(clamped));
    }

    private void startSettling() {
        settled = false;
        settleAt = clock.nowMillis() + uiProperties.getSettleAnimationMs();
    }

    private void onSelectionChanged(CatalogItem leaving, CatalogItem item) {
        playTimer.cancel();
        if (!connectionMonitor.isConnected()) {
            return;
        }
        if (navigationPause.matches(item.getUri())) {
            log.info("PLAYBACK_EVENT event=navigation_resume contextUri={}", item.getUri());
            navigationPause = NavigationPause.inactive();
            autoPauseTimer.restoreVolumeIfNeeded();
            playStateTracker.setPending(PendingAction.PLAY);
            sendAsync("resume", librespotClient::resume);
            return;
        }
        PlaybackSnapshot snapshot = playbackStateStore.current();
        String playingContextUri = snapshot.getContextUri();
        // Only leaving the cover of what is playing pauses it.
        if (!navigationPause.isActive() && snapshot.isPlaying() && playingContextUri != null
                && leaving != null && leaving.hasUri(playingContextUri) && !item.hasUri(playingContextUri)) {
            log.info("PLAYBACK_EVENT event=navigation_pause contextUri={}", playingContextUri);
            navigationPause = NavigationPause.pausedFor(playingContextUri);
            navigationPauseConfirmed = false;
            playStateTracker.setPending(PendingAction.PAUSE);
            sendAsync("pause", librespotClient::pause);
        }
    }

    private void onSettled(List<CatalogItem> items, PlaybackSnapshot snapshot) {
        settled = true;
        boolean changed = selectedIndex != targetIndex;
        selectedIndex = targetIndex;
        if (syncedMove) {
            syncedMove = false;
            return;
        }
        CatalogItem item = selectedItem(items);
        if (item == null) {
            return;
        }
        if (navigationPause.matches(item.getUri())) {
            return;
        }
        boolean current = snapshot.isActive() && snapshot.isContext(item.getUri());
        if (changed && !item.isTemp() && !current) {
            playTimer.arm(item, clock.nowMillis());
            log.debug("Play timer armed, contextUri={}", item.getUri());
        }
        if (!playTimer.isArmed() && !playRequestCoordinator.isInFlight()) {
            navigationPause = NavigationPause.inactive();
        }
    }

    private void syncToPlaying(List<CatalogItem> items, PlaybackSnapshot snapshot, long now) {
        String contextUri = snapshot.getContextUri();
        if (contextUri == null || contextUri.equals(lastSyncedContextUri)) {
            return;
        }
        if (dragging || !settled || playTimer.isArmed() || playTimer.isInCooldown(now)) {
            return;
        }
        if (contextUri.equals(playTimer.getLastFiredUri())) {
            playTimer.clearLastFired();
            lastSyncedContextUri = contextUri;
            return;
        }
        int index = CatalogService.indexOf(items, contextUri);
        if (index < 0) {
            return;
        }
        lastSyncedContextUri = contextUri;
        if (index == targetIndex) {
            return;
        }
        log.info("PLAYBACK_EVENT event=sync_to_playing contextUri={} fromIndex={} toIndex={}",
                contextUri, targetIndex, index);
        targetIndex = index;
        syncedMove = true;
        startSettling();
    }

    private void trackNavigationPause(PlaybackSnapshot snapshot) {
        if (!navigationPause.isActive()) {
            return;
        }
        if (!snapshot.isPlaying()) {
            navigationPauseConfirmed = true;
        } else if (navigationPauseConfirmed || !navigationPause.matches(snapshot.getContextUri())) {
            log.debug("Navigation pause cleared, playback resumed, contextUri={}", snapshot.getContextUri());
            navigationPause = NavigationPause.inactive();
        }
    }

    private void cancelDeleteMode() {
        if (deleteModeItemId != null) {
            log.debug("Delete mode cancelled, id={}", deleteModeItemId);
            deleteModeItemId = null;
        }
    }

    private static int indexOfId(List<CatalogItem> items, String id) {
        for (int i = 0; i < items.size(); i++) {
            if (id.equals(items.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }

    private void clampSelection(int size) {
        int max = Math.max(0, size - 1);
        if (targetIndex > max) {
            targetIndex = max;
            startSettling();
        }
        if (selectedIndex > max) {
            selectedIndex = max;
        }
    }

    private CatalogItem selectedItem() {
        return selectedItem(catalogService.displayItems());
    }

    private CatalogItem selectedItem(List<CatalogItem> items) {
        if (selectedIndex < 0 || selectedIndex >= items.size()) {
            return null;
        }
        return items.get(selectedIndex);
    }

    private void sendAsync(String command, BooleanSupplier call) {
        try {
            commandExecutor.execute(() -> {
                if (!call.getAsBoolean()) {
                    log.warn("Player command failed, command={}", command);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Player command dropped, command={}", command);
        }
    }
}
