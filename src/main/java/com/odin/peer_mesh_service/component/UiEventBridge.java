package com.odin.peer_mesh_service.component;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import jakarta.annotation.PreDestroy;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.odin.peer_mesh_service.constants.ApplicationConstants;
import com.odin.peer_mesh_service.dto.SessionError;
import com.odin.peer_mesh_service.dto.SessionSnapshot;
import com.odin.peer_mesh_service.service.UiSessionRegistryService;

import lombok.extern.slf4j.Slf4j;

/**
 * Pushes session events to every attached UI client. Sends happen on the
 * {@code ui-events} thread so socket I/O never runs on the control loop.
 */
@Slf4j
@Component
public class UiEventBridge implements SessionEventSink {

    private final UiSessionRegistryService uiSessions;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    public UiEventBridge(UiSessionRegistryService uiSessions, ObjectMapper objectMapper) {
        this.uiSessions = uiSessions;
        this.objectMapper = objectMapper;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ui-events");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void snapshotPublished(SessionSnapshot snapshot) {
        broadcast(snapshotEvent(snapshot));
    }

    @Override
    public void dataReceived(String fromPeerId, JsonNode message) {
        ObjectNode event = objectMapper.createObjectNode();
        event.put(ApplicationConstants.UI_FIELD_EVENT, ApplicationConstants.UI_EVENT_DATA);
        event.put("from", fromPeerId);
        event.set("data", message);
        broadcast(event);
    }

    @Override
    public void errorRaised(SessionError error) {
        ObjectNode event = objectMapper.valueToTree(error);
        event.put(ApplicationConstants.UI_FIELD_EVENT, ApplicationConstants.UI_EVENT_ERROR);
        broadcast(event);
    }

    /**
     * Sends one event to a single client, used right after it attaches.
     */
    public void sendTo(WebSocketSession session, JsonNode event) {
        String payload = serialize(event);
        if (payload != null) {
            executor.execute(() -> send(session, payload));
        }
    }

    public ObjectNode snapshotEvent(SessionSnapshot snapshot) {
        ObjectNode event = objectMapper.valueToTree(snapshot);
        event.put(ApplicationConstants.UI_FIELD_EVENT, ApplicationConstants.UI_EVENT_SNAPSHOT);
        return event;
    }

    private void broadcast(JsonNode event) {
        if (uiSessions.size() == 0) {
            return;
        }
        String payload = serialize(event);
        if (payload == null) {
            return;
        }
        executor.execute(() -> uiSessions.getSessions().forEach(session -> send(session, payload)));
    }

    private void send(WebSocketSession session, String payload) {
        if (!session.isOpen()) {
            uiSessions.removeSession(session);
            return;
        }
        try {
            session.sendMessage(new TextMessage(payload));
        } catch (IOException e) {
            log.warn("[UI] Could not push event to {}: {}", session.getId(), e.getMessage());
        }
    }

    private String serialize(JsonNode event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("[UI] Could not serialize {} event: {}", event.path(ApplicationConstants.UI_FIELD_EVENT).asText(),
                    e.getMessage(), e);
            return null;
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
