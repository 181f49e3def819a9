package com.odin.peer_mesh_service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * Logs UI clients attaching to the session event stream.
 */
@Slf4j
public class WebSocketLoggingInterceptor implements HandshakeInterceptor {

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        log.info("[UI-HANDSHAKE] Event stream upgrade requested from {} ({})",
                request.getRemoteAddress(), request.getURI());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.error("[UI-HANDSHAKE] Event stream handshake failed for {}: {}",
                    request.getRemoteAddress(), exception.getMessage(), exception);
        } else {
            log.debug("[UI-HANDSHAKE] Event stream handshake completed for {}", request.getRemoteAddress());
        }
    }
}
