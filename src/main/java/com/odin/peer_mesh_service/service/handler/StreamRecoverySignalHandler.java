package com.odin.peer_mesh_service.service.handler;

import jakarta.annotation.PostConstruct;

import org.springframework.stereotype.Component;

import com.odin.peer_mesh_service.component.LocalSession;
import com.odin.peer_mesh_service.config.PeerSessionProperties;
import com.odin.peer_mesh_service.dto.signal.CameraStreamRestoredMessage;
import com.odin.peer_mesh_service.dto.signal.CameraStreamSentMessage;
import com.odin.peer_mesh_service.dto.signal.ReconnectAfterScreenShareMessage;
import com.odin.peer_mesh_service.dto.signal.RequestFullReconnectMessage;
import com.odin.peer_mesh_service.dto.signal.RequestStreamUpdateMessage;
import com.odin.peer_mesh_service.enums.TaskPurpose;
import com.odin.peer_mesh_service.service.ConnectionRegistryService;
import com.odin.peer_mesh_service.service.LocalMediaService;
import com.odin.peer_mesh_service.service.ParticipantStoreService;
import com.odin.peer_mesh_service.service.PeerConnectionService;
import com.odin.peer_mesh_service.service.ReconnectionService;
import com.odin.peer_mesh_service.service.ScheduledTaskTable;
import com.odin.peer_mesh_service.service.SignalMessageRouter;

import lombok.extern.slf4j.Slf4j;

/**
 * Camera stream repair requested by peers: fresh camera calls, full
 * reconnects and the restore handshake after a screen share ends.
 */
@Slf4j
@Component
public class StreamRecoverySignalHandler extends SignalHandlerAdapter {

    private final LocalSession session;
    private final PeerConnectionService connections;
    private final ConnectionRegistryService registry;
    private final ParticipantStoreService participants;
    private final ReconnectionService reconnection;
    private final LocalMediaService localMedia;
    private final SignalMessageRouter router;
    private final ScheduledTaskTable tasks;
    private final PeerSessionProperties properties;

    public StreamRecoverySignalHandler(LocalSession session,
                                       PeerConnectionService connections,
                                       ConnectionRegistryService registry,
                                       ParticipantStoreService participants,
                                       ReconnectionService reconnection,
                                       LocalMediaService localMedia,
                                       SignalMessageRouter router,
                                       ScheduledTaskTable tasks,
                                       PeerSessionProperties properties) {
        this.session = session;
        this.connections = connections;
        this.registry = registry;
        this.participants = participants;
        this.reconnection = reconnection;
        this.localMedia = localMedia;
        this.router = router;
        this.tasks = tasks;
        this.properties = properties;
    }

    @PostConstruct
    public void register() {
        router.addHandler(this);
    }

    @Override
    public void onRequestStreamUpdate(String fromPeerId, RequestStreamUpdateMessage message) {
        boolean urgent = Boolean.TRUE.equals(message.getUrgent());
        long delay = urgent ? properties.getStreamUpdateUrgentDelayMs() : properties.getStreamUpdateDelayMs();
        log.info("[RECOVERY] {} asked for a fresh camera stream (urgent={}, forceRefresh={})",
                fromPeerId, urgent, message.getForceRefresh());
        registry.closeMedia(fromPeerId);
        tasks.schedule(fromPeerId, TaskPurpose.STREAM_UPDATE, delay, () -> {
            if (!session.isOpen()) {
                return;
            }
            localMedia.ensureLive();
            if (connections.callWithCamera(fromPeerId) != null) {
                router.send(fromPeerId, new CameraStreamSentMessage(session.getSelfId()));
            }
        });
    }

    @Override
    public void onCameraStreamRestored(String fromPeerId, CameraStreamRestoredMessage message) {
        String peerId = message.getPeerId() != null ? message.getPeerId() : fromPeerId;
        if (session.isSelf(peerId)) {
            return;
        }
        log.info("[RECOVERY] {} restored its camera, requesting a fresh stream", peerId);
        participants.applyScreenSharing(peerId, false);
        participants.clearCameraStream(peerId);
        router.send(peerId, new RequestStreamUpdateMessage(session.getSelfId(), true, true));
        reconnection.awaitCameraRestore(peerId);
    }

    @Override
    public void onReconnectAfterScreenShare(String fromPeerId, ReconnectAfterScreenShareMessage message) {
        String peerId = message.getPeerId() != null ? message.getPeerId() : fromPeerId;
        if (session.isSelf(peerId)) {
            return;
        }
        tasks.schedule(peerId, TaskPurpose.RECONNECT_AFTER_SCREEN_SHARE, properties.getReconnectAfterScreenShareDelayMs(), () -> {
            if (!session.isOpen()) {
                return;
            }
            log.info("[RECOVERY] Re-calling {} with camera after its screen share", peerId);
            connections.callWithCamera(peerId);
        });
    }

    @Override
    public void onRequestFullReconnect(String fromPeerId, RequestFullReconnectMessage message) {
        log.info("[RECOVERY] {} requested a full reconnect", fromPeerId);
        registry.closeMedia(fromPeerId);
        tasks.schedule(fromPeerId, TaskPurpose.FULL_RECONNECT, properties.getFullReconnectDelayMs(), () -> {
            if (session.isOpen()) {
                connections.callWithCamera(fromPeerId);
            }
        });
    }

    @Override
    public void onCameraStreamSent(String fromPeerId, CameraStreamSentMessage message) {
        log.debug("[RECOVERY] {} sent a fresh camera stream", fromPeerId);
    }
}
