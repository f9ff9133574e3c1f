package com.example.berry.infrastructure.librespot;

import com.example.berry.application.event.RepollRequestedEvent;
import com.example.berry.common.config.AppLibrespotProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Listens to the player's push event feed. Events only update the last known context and ask
 * for an early poll; the poll result stays the source of truth.
 */
@Component
public class LibrespotEventListener extends TextWebSocketHandler implements PlaybackContextSource {

    private static final Logger log = LoggerFactory.getLogger(LibrespotEventListener.class);

    private final AppLibrespotProperties properties;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final WebSocketClient webSocketClient = new StandardWebSocketClient();
    private final ScheduledExecutorService reconnectScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "event-feed-reconnect");
        thread.setDaemon(true);
        return thread;
    });

    private final AtomicReference<String> contextUri = new AtomicReference<>();
    private final AtomicReference<WebSocketSession> session = new AtomicReference<>();
    private volatile boolean running;
    private volatile boolean wasConnected;

    public LibrespotEventListener(AppLibrespotProperties properties,
                                  ObjectMapper objectMapper,
                                  ApplicationEventPublisher eventPublisher) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.eventPublisher = eventPublisher;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        running = true;
        log.info("Started event feed listener: {}", properties.getEventsUrl());
        connect();
    }

    @PreDestroy
    public void stop() {
        running = false;
        reconnectScheduler.shutdownNow();
        WebSocketSession current = session.getAndSet(null);
        if (current != null && current.isOpen()) {
            try {
                current.close();
            } catch (IOException e) {
                log.debug("Closing event feed session failed", e);
            }
        }
        log.info("Stopped event feed listener");
    }

    @Override
    public String lastContextUri() {
        return contextUri.get();
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession webSocketSession) {
        session.set(webSocketSession);
        if (wasConnected) {
            log.info("Event feed reconnected, refreshing state");
            eventPublisher.publishEvent(RepollRequestedEvent.feedReconnected(this));
        } else {
            log.debug("Event feed connected");
            wasConnected = true;
        }
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession webSocketSession, @NonNull TextMessage message) {
        handlePayload(message.getPayload());
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession webSocketSession, @NonNull Throwable exception) {
        log.debug("Event feed transport error: {}", exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession webSocketSession, @NonNull CloseStatus status) {
        session.compareAndSet(webSocketSession, null);
        if (wasConnected) {
            log.debug("Event feed disconnected, status={}", status);
        }
        scheduleReconnect();
    }

    void handlePayload(String payload) {
        try {
            JsonNode root = objectMapper.readTree(payload);
            String type = root.path("type").asText(null);
            if ("playing".equals(type)) {
                JsonNode uri = root.path("data").get("context_uri");
                contextUri.set(uri == null || !uri.isTextual() ? null : uri.asText());
                log.debug("Playing event, context={}", contextUri.get());
            }
            eventPublisher.publishEvent(RepollRequestedEvent.playerEvent(this));
        } catch (Exception e) {
            log.warn("Error parsing player event: {}", e.getMessage());
        }
    }

    private void connect() {
        if (!running) {
            return;
        }
        try {
            webSocketClient.doHandshake(this, properties.getEventsUrl()).addCallback(
                    result -> log.debug("Event feed handshake complete"),
                    failure -> {
                        log.debug("Event feed handshake failed: {}", failure.getMessage());
                        scheduleReconnect();
                    });
        } catch (RuntimeException e) {
            log.warn("Event feed connect error: {}", e.getMessage());
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        if (!running || reconnectScheduler.isShutdown()) {
            return;
        }
        reconnectScheduler.schedule(this::connect, properties.getEventReconnectDelayMs(), TimeUnit.MILLISECONDS);
    }
}
