package com.odin.peer_mesh_service.utility;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.odin.peer_mesh_service.service.ReconnectionService;
import com.odin.peer_mesh_service.service.TopologyService;

import lombok.extern.slf4j.Slf4j;

/**
 * Periodic orchestrator work. Both jobs are handed to the control loop.
 */
@Slf4j
@Component
public class HeartbeatScheduler {

    private final ControlLoop loop;
    private final TopologyService topologyService;
    private final ReconnectionService reconnectionService;

    public HeartbeatScheduler(ControlLoop loop, TopologyService topologyService, ReconnectionService reconnectionService) {
        this.loop = loop;
        this.topologyService = topologyService;
        this.reconnectionService = reconnectionService;
    }

    // creator's authoritative membership list
    @Scheduled(fixedRateString = "${peer.session.peer-list-broadcast-interval-ms:10000}")
    public void broadcastPeerList() {
        log.debug("HeartbeatScheduler: peer-list broadcast");
        loop.execute(topologyService::broadcastPeerList);
    }

    @Scheduled(fixedRateString = "${peer.session.watchdog-interval-ms:1000}")
    public void checkStreams() {
        loop.execute(reconnectionService::checkStreams);
    }
}
