package com.example.berry.infrastructure.librespot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.example.berry.application.event.RepollRequestedEvent;
import com.example.berry.common.config.AppLibrespotProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.web.socket.WebSocketSession;

class LibrespotEventListenerTest {

    private ApplicationEventPublisher publisher;
    private LibrespotEventListener listener;

    @BeforeEach
    void setUp() {
        publisher = mock(ApplicationEventPublisher.class);
        listener = new LibrespotEventListener(new AppLibrespotProperties(), new ObjectMapper(), publisher);
    }

    @Test
    void shouldRecordContextFromPlayingEvent() {
        listener.handlePayload("{\"type\":\"playing\",\"data\":{\"context_uri\":\"spotify:album:a\"}}");

        assertEquals("spotify:album:a", listener.lastContextUri());
        ArgumentCaptor<RepollRequestedEvent> event = ArgumentCaptor.forClass(RepollRequestedEvent.class);
        verify(publisher).publishEvent(event.capture());
        assertFalse(event.getValue().isResetConnection());
    }

    @Test
    void shouldRequestPollForOtherEventsWithoutTouchingContext() {
        listener.handlePayload("{\"type\":\"playing\",\"data\":{\"context_uri\":\"spotify:album:a\"}}");
        listener.handlePayload("{\"type\":\"volume\",\"data\":{\"value\":40}}");

        assertEquals("spotify:album:a", listener.lastContextUri());
        verify(publisher, times(2)).publishEvent(any(RepollRequestedEvent.class));
    }

    @Test
    void shouldClearContextWhenPlayingEventHasNone() {
        listener.handlePayload("{\"type\":\"playing\",\"data\":{\"context_uri\":\"spotify:album:a\"}}");
        listener.handlePayload("{\"type\":\"playing\",\"data\":{}}");

        assertNull(listener.lastContextUri());
    }

    @Test
    void shouldIgnoreMalformedPayload() {
        listener.handlePayload("not json at all");

        assertNull(listener.lastContextUri());
        verify(publisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void shouldResetConnectionOnlyWhenFeedReconnects() {
        WebSocketSession session = mock(WebSocketSession.class);

        listener.afterConnectionEstablished(session);
        verify(publisher, never()).publishEvent(any(Object.class));

        listener.afterConnectionEstablished(session);
        ArgumentCaptor<RepollRequestedEvent> event = ArgumentCaptor.forClass(RepollRequestedEvent.class);
        verify(publisher).publishEvent(event.capture());
        assertEquals("feed_reconnected", event.getValue().getReason());
    }
}
