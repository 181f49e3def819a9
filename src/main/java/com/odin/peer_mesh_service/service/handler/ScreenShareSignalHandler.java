package com.odin.peer_mesh_service.service.handler;

import jakarta.annotation.PostConstruct;

import org.springframework.stereotype.Component;

import com.odin.peer_mesh_service.component.LocalSession;
import com.odin.peer_mesh_service.config.PeerSessionProperties;
import com.odin.peer_mesh_service.dto.Participant;
import com.odin.peer_mesh_service.dto.signal.RequestScreenStreamMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenShareRetryNeededMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenShareStartedMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenSharingStatusMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenSharingStreamMessage;
import com.odin.peer_mesh_service.dto.signal.StreamMetadataMessage;
import com.odin.peer_mesh_service.enums.TaskPurpose;
import com.odin.peer_mesh_service.service.ConnectionRegistryService;
import com.odin.peer_mesh_service.service.ParticipantStoreService;
import com.odin.peer_mesh_service.service.PeerConnectionService;
import com.odin.peer_mesh_service.service.ScheduledTaskTable;
import com.odin.peer_mesh_service.service.ScreenShareService;
import com.odin.peer_mesh_service.service.SignalMessageRouter;
import com.odin.peer_mesh_service.service.TopologyService;
import com.odin.peer_mesh_service.transport.MediaStream;

import lombok.extern.slf4j.Slf4j;

/**
 * Receiver side of screen sharing plus the sharer's answer to screen
 * refresh requests.
 */
@Slf4j
@Component
public class ScreenShareSignalHandler extends SignalHandlerAdapter {

    private final LocalSession session;
    private final ScreenShareService screenShare;
    private final PeerConnectionService connections;
    private final TopologyService topology;
    private final ConnectionRegistryService registry;
    private final ParticipantStoreService participants;
    private final SignalMessageRouter router;
    private final ScheduledTaskTable tasks;
    private final PeerSessionProperties properties;

    public ScreenShareSignalHandler(LocalSession session,
                                    ScreenShareService screenShare,
                                    PeerConnectionService connections,
                                    TopologyService topology,
                                    ConnectionRegistryService registry,
                                    ParticipantStoreService participants,
                                    SignalMessageRouter router,
                                    ScheduledTaskTable tasks,
                                    PeerSessionProperties properties) {
        this.session = session;
        this.screenShare = screenShare;
        this.connections = connections;
        this.topology = topology;
        this.registry = registry;
        this.participants = participants;
        this.router = router;
        this.tasks = tasks;
        this.properties = properties;
    }

    @PostConstruct
    public void register() {
        router.addHandler(this);
    }

    @Override
    public void onScreenSharingStatus(String fromPeerId, ScreenSharingStatusMessage message) {
        String peerId = subject(fromPeerId, message.getPeerId());
        if (session.isSelf(peerId)) {
            return;
        }
        boolean sharing = Boolean.TRUE.equals(message.getSharing());
        participants.applyScreenSharing(peerId, sharing);
        if (!sharing) {
            registry.setExpectScreen(peerId, false);
            registry.closeScreen(peerId);
            tasks.cancel(peerId, TaskPurpose.SCREEN_REFRESH);
        }
    }

    @Override
    public void onScreenSharingStream(String fromPeerId, ScreenSharingStreamMessage message) {
        String peerId = subject(fromPeerId, message.getPeerId());
        if (session.isSelf(peerId)) {
            return;
        }
        registry.setExpectScreen(peerId, true);
        participants.applyScreenSharing(peerId, true);
    }

    @Override
    public void onStreamMetadata(String fromPeerId, StreamMetadataMessage message) {
        String peerId = subject(fromPeerId, message.getPeerId());
        if (session.isSelf(peerId)) {
            return;
        }
        participants.applyStreamType(peerId, message.getStreamType());
    }

    @Override
    public void onScreenShareStarted(String fromPeerId, ScreenShareStartedMessage message) {
        String sharingPeerId = message.getSharingPeerId();
        if (sharingPeerId == null || session.isSelf(sharingPeerId)) {
            return;
        }
        if (!participants.contains(sharingPeerId)) {
            log.info("[SCREEN] Sharer {} unknown, connecting", sharingPeerId);
            tasks.schedule(sharingPeerId, TaskPurpose.SCREEN_CONNECT, properties.getScreenShareStartedConnectDelayMs(), () -> {
                if (topology.allowsDirectConnection(sharingPeerId)) {
                    connections.establishPeerConnection(sharingPeerId);
                }
            });
            return;
        }
        participants.applyScreenSharing(sharingPeerId, true);
        tasks.schedule(sharingPeerId, TaskPurpose.SCREEN_REFRESH, properties.getScreenShareStartedRefreshDelayMs(), () -> {
            Participant participant = participants.find(sharingPeerId).orElse(null);
            if (participant == null || !participant.isScreenSharing()) {
                return;
            }
            MediaStream screen = participant.getScreenStream();
            if (screen == null || !screen.hasLiveVideo()) {
                log.info("[SCREEN] No usable screen from {} yet, requesting it", sharingPeerId);
                router.send(sharingPeerId, new RequestScreenStreamMessage(session.getSelfId(), true));
            }
        });
    }

    @Override
    public void onScreenShareRetryNeeded(String fromPeerId, ScreenShareRetryNeededMessage message) {
        String sharingPeerId = subject(fromPeerId, message.getSharingPeerId());
        if (session.isSelf(sharingPeerId)) {
            return;
        }
        log.info("[SCREEN] Screen from {} needs a retry", sharingPeerId);
        registry.closeScreen(sharingPeerId);
        participants.clearScreenStream(sharingPeerId);
        if (connections.hasOpenControl(sharingPeerId)) {
            router.send(sharingPeerId, new RequestScreenStreamMessage(session.getSelfId(), true));
        } else if (topology.allowsDirectConnection(sharingPeerId)) {
            connections.establishPeerConnection(sharingPeerId);
        }
    }

    @Override
    public void onRequestScreenStream(String fromPeerId, RequestScreenStreamMessage message) {
        screenShare.respondToScreenRequest(fromPeerId, Boolean.TRUE.equals(message.getUrgent()));
    }

    private static String subject(String fromPeerId, String named) {
        return named != null ? named : fromPeerId;
    }
}
