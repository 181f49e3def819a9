package com.odin.peer_mesh_service.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import com.odin.peer_mesh_service.constants.ApplicationConstants;
import com.odin.peer_mesh_service.utility.SessionEventsWebSocketHandler;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final String EVENTS_PATH = ApplicationConstants.API_VERSION + ApplicationConstants.SESSION
            + ApplicationConstants.EVENTS;

    private final SessionEventsWebSocketHandler sessionEventsWebSocketHandler;

    public WebSocketConfig(SessionEventsWebSocketHandler sessionEventsWebSocketHandler) {
        this.sessionEventsWebSocketHandler = sessionEventsWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(sessionEventsWebSocketHandler, EVENTS_PATH)
                .addInterceptors(new WebSocketLoggingInterceptor())
                .setAllowedOrigins("*");

        log.info("WebSocket handlers registered - Path: {}, Handler: SessionEventsWebSocketHandler", EVENTS_PATH);
    }

}
