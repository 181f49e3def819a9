package com.odin.peer_mesh_service.service;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketSession;

import lombok.extern.slf4j.Slf4j;

/**
 * UI clients currently attached to the event stream.
 */
@Slf4j
@Service
public class UiSessionRegistryService {

    // websocket session id -> session
    private final Map<String, WebSocketSession> activeSessions = new ConcurrentHashMap<>();

    public void registerSession(WebSocketSession session) {
        if (session == null) return;
        activeSessions.put(session.getId(), session);
        log.info("Registered UI session {}", session.getId());
    }

    public void removeSession(WebSocketSession session) {
        if (session == null) return;
        if (activeSessions.remove(session.getId()) != null) {
            log.info("Removed UI session {}", session.getId());
        }
    }

    public Collection<WebSocketSession> getSessions() {
        return activeSessions.values();
    }

    public int size() {
        return activeSessions.size();
    }
}
