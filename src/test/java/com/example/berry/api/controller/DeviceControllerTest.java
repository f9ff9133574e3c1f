package com.example.berry.api.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

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
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeviceControllerTest {

    private UiLoop uiLoop;
    private SelectionPlaybackSync sync;
    private SleepManager sleepManager;
    private DeviceController controller;
    private DeviceStateResponse state;

    @BeforeEach
    void setUp() {
        uiLoop = mock(UiLoop.class);
        sync = mock(SelectionPlaybackSync.class);
        sleepManager = mock(SleepManager.class);
        controller = new DeviceController(uiLoop, sync, sleepManager);
        state = DeviceStateResponse.builder().connected(true).selectedIndex(1).build();
        when(uiLoop.currentState()).thenReturn(state);
        when(uiLoop.submit(any(Runnable.class))).thenAnswer(invocation -> {
            Runnable input = invocation.getArgument(0);
            input.run();
            return CompletableFuture.completedFuture(state);
        });
    }

    @Test
    void shouldReturnPublishedState() {
        ApiResponse<DeviceStateResponse> response = controller.state();

        assertTrue(response.isSuccess());
        assertSame(state, response.getData());
    }

    @Test
    void shouldForwardSwipeCaseInsensitively() {
        SwipeRequest request = new SwipeRequest();
        request.setDirection("Left");

        ApiResponse<DeviceStateResponse> response = controller.swipe(request);

        verify(sync).onSwipe(SwipeDirection.LEFT);
        assertSame(state, response.getData());
    }

    @Test
    void shouldForwardSelectAndSettle() {
        SelectRequest request = new SelectRequest();
        request.setIndex(3);

        controller.select(request);
        controller.settle();

        verify(sync).onSelect(3);
        verify(sync).onSettle();
    }

    @Test
    void shouldForwardDragPhases() {
        DragRequest start = new DragRequest();
        start.setPhase("start");
        DragRequest end = new DragRequest();
        end.setPhase("end");
        end.setTargetIndex(2);

        controller.drag(start);
        controller.drag(end);

        verify(sync).onDragStart();
        verify(sync).onDragEnd(2);
    }

    @Test
    void shouldRejectDragEndWithoutTarget() {
        DragRequest end = new DragRequest();
        end.setPhase("end");

        BusinessException ex = assertThrows(BusinessException.class, () -> controller.drag(end));

        assertEquals("400", ex.getCode());
        verify(uiLoop, never()).submit(any(Runnable.class));
    }

    @Test
    void shouldForwardButton() {
        ButtonRequest request = new ButtonRequest();
        request.setButton("play_pause");

        controller.button(request);

        verify(sync).onButton(ControlButton.PLAY_PAUSE);
    }

    @Test
    void shouldForwardCatalogEditingInput() {
        controller.longPress();
        controller.delete();
        controller.saveTemp();

        verify(sync).onLongPress();
        verify(sync).confirmDelete();
        verify(sync).saveTempItem();
    }

    @Test
    void shouldRejectUnknownButton() {
        ButtonRequest request = new ButtonRequest();
        request.setButton("eject");

        BusinessException ex = assertThrows(BusinessException.class, () -> controller.button(request));

        assertEquals("400", ex.getCode());
    }

    @Test
    void shouldReportUnresponsiveUiLoop() {
        when(uiLoop.submit(any(Runnable.class))).thenReturn(new CompletableFuture<>());

        BusinessException ex = assertThrows(BusinessException.class, () -> controller.settle());

        assertEquals("503", ex.getCode());
    }

    @Test
    void shouldWakeScreen() {
        controller.wake();

        verify(sleepManager).wakeUp("external");
    }
}
