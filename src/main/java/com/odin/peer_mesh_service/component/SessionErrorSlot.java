package com.odin.peer_mesh_service.component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.springframework.stereotype.Component;

import com.odin.peer_mesh_service.dto.SessionError;
import com.odin.peer_mesh_service.enums.FailureReason;
import com.odin.peer_mesh_service.enums.SessionErrorCode;
import com.odin.peer_mesh_service.utility.ControlLoop;

import lombok.extern.slf4j.Slf4j;

/**
 * Single error slot surfaced to the UI. A new error replaces the previous one.
 */
@Slf4j
@Component
public class SessionErrorSlot {

    private final ControlLoop loop;
    private final List<Consumer<SessionError>> listeners = new CopyOnWriteArrayList<>();
    private volatile SessionError current;

    public SessionErrorSlot(ControlLoop loop) {
        this.loop = loop;
    }

    public void addListener(Consumer<SessionError> listener) {
        listeners.add(listener);
    }

    public SessionError raise(SessionErrorCode code, FailureReason reason, String peerId, String message) {
        SessionError error = SessionError.builder()
                .code(code)
                .reason(reason)
                .peerId(peerId)
                .message(message)
                .timestamp(loop.now())
                .build();
        current = error;
        log.warn("[ERROR] {} ({}) peer={} : {}", code, reason, peerId, message);
        for (Consumer<SessionError> listener : listeners) {
            listener.accept(error);
        }
        return error;
    }

    public SessionError get() {
        return current;
    }

    public void clear() {
        current = null;
    }
}
