package com.odin.peer_mesh_service.service.handler;

import java.util.List;

import jakarta.annotation.PostConstruct;

import org.springframework.stereotype.Component;

import com.odin.peer_mesh_service.component.LocalSession;
import com.odin.peer_mesh_service.dto.signal.NewPeerMessage;
import com.odin.peer_mesh_service.dto.signal.PeerDisconnectMessage;
import com.odin.peer_mesh_service.dto.signal.PeerListMessage;
import com.odin.peer_mesh_service.dto.signal.RequestPeerListMessage;
import com.odin.peer_mesh_service.dto.signal.RequestUsernameMessage;
import com.odin.peer_mesh_service.dto.signal.UsernameMessage;
import com.odin.peer_mesh_service.service.ParticipantStoreService;
import com.odin.peer_mesh_service.service.PeerConnectionService;
import com.odin.peer_mesh_service.service.SignalMessageRouter;
import com.odin.peer_mesh_service.service.TopologyService;
import com.odin.peer_mesh_service.utility.PeerIds;

import lombok.extern.slf4j.Slf4j;

/**
 * Membership and naming: peer lists, new peers, departures and usernames.
 */
@Slf4j
@Component
public class PresenceSignalHandler extends SignalHandlerAdapter {

    private final LocalSession session;
    private final TopologyService topology;
    private final PeerConnectionService connections;
    private final ParticipantStoreService participants;
    private final SignalMessageRouter router;

    public PresenceSignalHandler(LocalSession session,
                                 TopologyService topology,
                                 PeerConnectionService connections,
                                 ParticipantStoreService participants,
                                 SignalMessageRouter router) {
        this.session = session;
        this.topology = topology;
        this.connections = connections;
        this.participants = participants;
        this.router = router;
    }

    @PostConstruct
    public void register() {
        router.addHandler(this);
    }

    @Override
    public void onPeerList(String fromPeerId, PeerListMessage message) {
        if (!PeerIds.isCreatorId(fromPeerId)) {
            log.warn("[PRESENCE] Ignoring peer list from non-creator {}", fromPeerId);
            return;
        }
        if (message.getPeers() == null) {
            return;
        }
        log.info("[PRESENCE] Peer list from {}: {}", fromPeerId, message.getPeers());
        topology.reconcile(message.getPeers());
    }

    @Override
    public void onRequestPeerList(String fromPeerId, RequestPeerListMessage message) {
        if (session.isCreator()) {
            topology.sendPeerListTo(fromPeerId);
        }
    }

    @Override
    public void onNewPeer(String fromPeerId, NewPeerMessage message) {
        String peerId = message.getPeerId();
        if (peerId == null || session.isSelf(peerId)) {
            return;
        }
        log.info("[PRESENCE] New peer {} announced by {}", peerId, fromPeerId);
        topology.reconcile(List.of(peerId));
    }

    @Override
    public void onPeerDisconnect(String fromPeerId, PeerDisconnectMessage message) {
        String peerId = message.getPeerId() != null ? message.getPeerId() : fromPeerId;
        if (session.isSelf(peerId)) {
            return;
        }
        connections.handlePeerDisconnection(peerId);
    }

    @Override
    public void onUsername(String fromPeerId, UsernameMessage message) {
        String peerId = message.getPeerId() != null ? message.getPeerId() : fromPeerId;
        if (session.isSelf(peerId)) {
            return;
        }
        participants.applyUsername(peerId, message.getUsername());
    }

    @Override
    public void onRequestUsername(String fromPeerId, RequestUsernameMessage message) {
        router.send(fromPeerId, new UsernameMessage(session.getUsername(), session.getSelfId()));
    }
}
