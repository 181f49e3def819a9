package com.odin.peer_mesh_service.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import jakarta.annotation.PostConstruct;

import org.springframework.stereotype.Service;

import com.odin.peer_mesh_service.component.LocalSession;
import com.odin.peer_mesh_service.config.PeerSessionProperties;
import com.odin.peer_mesh_service.dto.PeerConnection;
import com.odin.peer_mesh_service.dto.signal.NewPeerMessage;
import com.odin.peer_mesh_service.dto.signal.PeerListMessage;
import com.odin.peer_mesh_service.dto.signal.RequestPeerListMessage;
import com.odin.peer_mesh_service.enums.TaskPurpose;
import com.odin.peer_mesh_service.enums.Topology;

import lombok.extern.slf4j.Slf4j;

/**
 * Decides which peers this node holds direct connections to. The creator is
 * the only authority on room membership; everyone else reconciles against
 * the peer lists it sends.
 */
@Slf4j
@Service
public class TopologyService implements PeerLifecycleListener {

    private final LocalSession session;
    private final PeerConnectionService connections;
    private final ConnectionRegistryService registry;
    private final ParticipantStoreService participants;
    private final SignalMessageRouter router;
    private final ScheduledTaskTable tasks;
    private final PeerSessionProperties properties;

    public TopologyService(LocalSession session,
                           PeerConnectionService connections,
                           ConnectionRegistryService registry,
                           ParticipantStoreService participants,
                           SignalMessageRouter router,
                           ScheduledTaskTable tasks,
                           PeerSessionProperties properties) {
        this.session = session;
        this.connections = connections;
        this.registry = registry;
        this.participants = participants;
        this.router = router;
        this.tasks = tasks;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        connections.addLifecycleListener(this);
    }

    public boolean allowsDirectConnection(String peerId) {
        return session.getTopology().allowsDirectConnection(session.isCreator(), peerId);
    }

    /**
     * Brings the registry in line with the given member list under the
     * active topology. New connections are staggered; ids that are already
     * connected are left alone.
     */
    public void reconcile(Collection<String> peerIds) {
        if (!session.isOpen()) {
            return;
        }
        if (session.getTopology() == Topology.STAR && !session.isCreator()) {
            dropDisallowedPeers();
        }
        int index = 0;
        for (String peerId : peerIds) {
            if (peerId == null || session.isSelf(peerId) || !allowsDirectConnection(peerId)) {
                continue;
            }
            participants.ensure(peerId);
            if (registry.getMediaChannel(peerId) != null || tasks.isScheduled(peerId, TaskPurpose.ESTABLISH)) {
                continue;
            }
            long delay = index++ * properties.getEstablishStaggerMs();
            log.info("[TOPOLOGY] Scheduling connection to {} in {} ms", peerId, delay);
            tasks.schedule(peerId, TaskPurpose.ESTABLISH, delay, () -> {
                if (allowsDirectConnection(peerId)) {
                    connections.establishPeerConnection(peerId);
                }
            });
        }
    }

    public void setTopology(Topology mode) {
        Topology previous = session.getTopology();
        session.setTopology(mode);
        log.info("[TOPOLOGY] {} -> {}", previous, mode);
        if (session.isCreator() || !session.isOpen()) {
            return;
        }
        if (mode == Topology.STAR) {
            dropDisallowedPeers();
        } else if (previous == Topology.STAR) {
            requestPeerList();
        }
    }

    public void requestPeerList() {
        String creatorId = session.getCreatorId();
        if (creatorId == null || session.isCreator()) {
            return;
        }
        if (!router.send(creatorId, new RequestPeerListMessage(session.getSelfId()))) {
            log.warn("[TOPOLOGY] Creator {} not reachable, peer list not requested", creatorId);
        }
    }

    public List<String> currentMembers() {
        List<String> members = new ArrayList<>();
        members.add(session.getSelfId());
        registry.all().stream()
                .filter(PeerConnection::hasOpenControl)
                .map(PeerConnection::getPeerId)
                .forEach(members::add);
        return members;
    }

    public void sendPeerListTo(String peerId) {
        if (!session.isCreator()) {
            return;
        }
        router.send(peerId, new PeerListMessage(currentMembers()));
    }

    public void broadcastPeerList() {
        if (!session.isCreator() || !session.isOpen()) {
            return;
        }
        int sent = router.sendToAll(new PeerListMessage(currentMembers()));
        log.debug("[TOPOLOGY] Peer list broadcast to {} peers", sent);
    }

    @Override
    public void onControlOpened(String peerId) {
        if (!session.isCreator()) {
            return;
        }
        sendPeerListTo(peerId);
        router.sendToAllExcept(peerId, new NewPeerMessage(peerId));
    }

    private void dropDisallowedPeers() {
        for (String peerId : registry.peerIds()) {
            if (!allowsDirectConnection(peerId)) {
                connections.teardownPeer(peerId);
            }
        }
        for (String peerId : participants.ids()) {
            if (!allowsDirectConnection(peerId)) {
                participants.remove(peerId);
            }
        }
    }
}
