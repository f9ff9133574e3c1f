package com.example.berry.api.controller;

import com.example.berry.api.request.ButtonRequest;
import com.example.berry.api.request.DragRequest;
import com.example.berry.api.request.SelectRequest;
import com.example.berry.api.request.SwipeRequest;
import com.example.berry.api.response.ApiResponse;
import com.example.berry.api.response.DeviceStateResponse;
import com.example.berry.application.job.UiLoop;
import com.example.berry.application.service.SelectionPlaybackSync;
import com.example.berry.application.service.SleepManager;
import com.example.berry.common.exception.BusinessException;
import com.example.berry.domain.enumtype.ControlButton;
import com.example.berry.domain.enumtype.SwipeDirection;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Control surface for the gesture layer and the screen. Input is handed to the UI loop; the
 * response carries the state published after it was applied.
 */
@RestController
@RequestMapping("/api/v1/device")
public class DeviceController {

    private static final long INPUT_WAIT_MS = 1000L;

    private final UiLoop uiLoop;
    private final SelectionPlaybackSync selectionPlaybackSync;
    private final SleepManager sleepManager;

    public DeviceController(UiLoop uiLoop, SelectionPlaybackSync selectionPlaybackSync, SleepManager sleepManager) {
        this.uiLoop = uiLoop;
        this.selectionPlaybackSync = selectionPlaybackSync;
        this.sleepManager = sleepManager;
    }

    @GetMapping("/state")
    public ApiResponse<DeviceStateResponse> state() {
        return ApiResponse.success(uiLoop.currentState());
    }

    @PostMapping("/input/swipe")
    public ApiResponse<DeviceStateResponse> swipe(@Valid @RequestBody SwipeRequest request) {
        SwipeDirection direction = parseEnum(SwipeDirection.class, request.getDirection(), "direction");
        return ApiResponse.success(await(uiLoop.submit(() -> selectionPlaybackSync.onSwipe(direction))));
    }

    @PostMapping("/input/select")
    public ApiResponse<DeviceStateResponse> select(@Valid @RequestBody SelectRequest request) {
        int index = request.getIndex();
        return ApiResponse.success(await(uiLoop.submit(() -> selectionPlaybackSync.onSelect(index))));
    }

    @PostMapping("/input/settle")
    public ApiResponse<DeviceStateResponse> settle() {
        return ApiResponse.success(await(uiLoop.submit(selectionPlaybackSync::onSettle)));
    }

    @PostMapping("/input/drag")
    public ApiResponse<DeviceStateResponse> drag(@Valid @RequestBody DragRequest request) {
        if ("start".equalsIgnoreCase(request.getPhase())) {
            return ApiResponse.success(await(uiLoop.submit(selectionPlaybackSync::onDragStart)));
        }
        if (request.getTargetIndex() == null) {
            throw new BusinessException("400", "targetIndex is required when a drag ends");
        }
        int target = request.getTargetIndex();
        return ApiResponse.success(await(uiLoop.submit(() -> selectionPlaybackSync.onDragEnd(target))));
    }

    @PostMapping("/input/button")
    public ApiResponse<DeviceStateResponse> button(@Valid @RequestBody ButtonRequest request) {
        ControlButton button = parseEnum(ControlButton.class, request.getButton(), "button");
        return ApiResponse.success(await(uiLoop.submit(() -> selectionPlaybackSync.onButton(button))));
    }

    @PostMapping("/input/long-press")
    public ApiResponse<DeviceStateResponse> longPress() {
        return ApiResponse.success(await(uiLoop.submit(selectionPlaybackSync::onLongPress)));
    }

    @PostMapping("/input/delete")
    public ApiResponse<DeviceStateResponse> delete() {
        return ApiResponse.success(await(uiLoop.submit(() -> selectionPlaybackSync.confirmDelete())));
    }

    @PostMapping("/input/save-temp")
    public ApiResponse<DeviceStateResponse> saveTemp() {
        return ApiResponse.success(await(uiLoop.submit(() -> selectionPlaybackSync.saveTempItem())));
    }

    @PostMapping("/wake")
    public ApiResponse<DeviceStateResponse> wake() {
        sleepManager.wakeUp("external");
        return ApiResponse.success(uiLoop.currentState());
    }

    private DeviceStateResponse await(CompletableFuture<DeviceStateResponse> future) {
        try {
            return future.get(INPUT_WAIT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new BusinessException("503", "UI loop is not responding", "Retry shortly");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException("503", "Interrupted while waiting for the UI loop");
        } catch (ExecutionException e) {
            throw new BusinessException("500", "Input handling failed");
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new BusinessException("400", "Unsupported " + field + ": " + value);
        }
    }
}
