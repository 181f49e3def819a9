package com.odin.peer_mesh_service.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.odin.peer_mesh_service.service.ScheduledTaskTable;
import com.odin.peer_mesh_service.service.impl.ExecutorControlLoop;
import com.odin.peer_mesh_service.transport.TransportAdapter;
import com.odin.peer_mesh_service.transport.local.LocalTransportHub;
import com.odin.peer_mesh_service.utility.ControlLoop;

import lombok.extern.slf4j.Slf4j;

/**
 * Control loop and transport wiring. The in-process hub is the only
 * transport shipped; a real WebRTC adapter replaces the
 * {@link TransportAdapter} bean.
 */
@Slf4j
@Configuration
public class TransportConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorControlLoop controlLoop() {
        log.info("Starting control loop thread peer-control");
        return new ExecutorControlLoop("peer-control");
    }

    @Bean
    public LocalTransportHub localTransportHub() {
        return new LocalTransportHub();
    }

    @Bean
    public TransportAdapter transportAdapter(LocalTransportHub hub, ControlLoop controlLoop) {
        log.info("Using in-process transport");
        return hub.createAdapter(controlLoop);
    }

    @Bean
    public ScheduledTaskTable scheduledTaskTable(ControlLoop controlLoop) {
        return new ScheduledTaskTable(controlLoop);
    }
}
