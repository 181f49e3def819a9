package com.odin.peer_mesh_service.utility;

import java.io.IOException;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.exception.ExceptionUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.odin.peer_mesh_service.component.UiEventBridge;
import com.odin.peer_mesh_service.constants.ApplicationConstants;
import com.odin.peer_mesh_service.enums.Topology;
import com.odin.peer_mesh_service.exception.RecordingException;
import com.odin.peer_mesh_service.service.PeerSessionService;
import com.odin.peer_mesh_service.service.UiSessionRegistryService;

import lombok.extern.slf4j.Slf4j;

/**
 * Event stream for the local UI. Pushes snapshots, forwarded peer data and
 * errors; accepts {@code {"action": ...}} commands that mirror the REST API.
 */
@Slf4j
@Component
public class SessionEventsWebSocketHandler implements WebSocketHandler {

    private final PeerSessionService peerSessionService;
    private final UiSessionRegistryService uiSessionRegistryService;
    private final UiEventBridge uiEventBridge;
    private final ObjectMapper objectMapper;

    public SessionEventsWebSocketHandler(PeerSessionService peerSessionService,
                                         UiSessionRegistryService uiSessionRegistryService,
                                         UiEventBridge uiEventBridge,
                                         ObjectMapper objectMapper) {
        this.peerSessionService = peerSessionService;
        this.uiSessionRegistryService = uiSessionRegistryService;
        this.uiEventBridge = uiEventBridge;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        uiSessionRegistryService.registerSession(session);
        uiEventBridge.sendTo(session, uiEventBridge.snapshotEvent(peerSessionService.getSnapshot()));
        log.info("[UI] Client {} attached to the event stream", session.getId());
    }

    @Override
    public void handleMessage(WebSocketSession session, WebSocketMessage<?> message) {
        String payload = message.getPayload().toString();
        String action = null;
        try {
            JsonNode command = objectMapper.readTree(payload);
            action = command.path(ApplicationConstants.UI_FIELD_ACTION).asText(null);
            if (StringUtils.isBlank(action)) {
                reply(session, error(null, "Command has no action"));
                return;
            }
            log.debug("[UI] Command {} from {}", action, session.getId());
            JsonNode result = execute(action, command);
            if (result != null) {
                reply(session, result);
            }
        } catch (IOException e) {
            log.warn("[UI] Unreadable command from {}: {}", session.getId(), e.getMessage());
            reply(session, error(action, "Unreadable command: " + ExceptionUtils.getRootCauseMessage(e)));
        } catch (RecordingException e) {
            reply(session, error(action, e.getMessage()));
        } catch (IllegalStateException | IllegalArgumentException e) {
            log.info("[UI] Command {} rejected: {}", action, e.getMessage());
            reply(session, error(action, e.getMessage()));
        }
    }

    private JsonNode execute(String action, JsonNode command) throws RecordingException {
        switch (action) {
            case "ping":
                return event("pong");
            case "snapshot":
                return uiEventBridge.snapshotEvent(peerSessionService.getSnapshot());
            case "join":
                peerSessionService.join(command.path("roomId").asText(null),
                        command.path("creator").asBoolean(false),
                        command.path("username").asText(null));
                return null;
            case "leave":
                peerSessionService.leave();
                return null;
            case "toggle-audio":
                peerSessionService.toggleAudio();
                return null;
            case "toggle-video":
                peerSessionService.toggleVideo();
                return null;
            case "start-screen-share":
                if (!peerSessionService.startScreenShare()) {
                    return error(action, "Screen share is not available right now");
                }
                return null;
            case "stop-screen-share":
                peerSessionService.stopScreenShare();
                return null;
            case "set-topology":
                peerSessionService.setTopology(Topology.fromValue(command.path("mode").asText(null)));
                return null;
            case "set-username":
                peerSessionService.setUsername(command.path("username").asText(null));
                return null;
            case "broadcast":
                int sent = peerSessionService.sendToAll(command.get("message"));
                ObjectNode ack = event("sent");
                ack.put("peers", sent);
                return ack;
            case "reconnect":
                peerSessionService.reconnectAll();
                return null;
            case "set-transitions":
                peerSessionService.setTransitionsEnabled(command.path("enabled").asBoolean(true));
                return null;
            case "start-recording":
                peerSessionService.startRecording();
                return null;
            case "stop-recording":
                ObjectNode saved = event("recording-saved");
                saved.put("file", peerSessionService.stopRecording().toString());
                return saved;
            default:
                return error(action, "Unknown action " + action);
        }
    }

    private ObjectNode event(String name) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(ApplicationConstants.UI_FIELD_EVENT, name);
        return node;
    }

    private ObjectNode error(String action, String message) {
        ObjectNode node = event(ApplicationConstants.UI_EVENT_ERROR);
        if (action != null) {
            node.put(ApplicationConstants.UI_FIELD_ACTION, action);
        }
        node.put("message", message);
        return node;
    }

    private void reply(WebSocketSession session, JsonNode event) {
        uiEventBridge.sendTo(session, event);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("[UI] Transport error on {}: {}", session.getId(), exception.getMessage(), exception);
        uiSessionRegistryService.removeSession(session);
        session.close(CloseStatus.SERVER_ERROR);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) {
        uiSessionRegistryService.removeSession(session);
        log.info("[UI] Client {} detached (status={})", session.getId(), closeStatus);
    }

    @Override
    public boolean supportsPartialMessages() {
        return false;
    }
}
