package com.odin.peer_mesh_service.service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

import jakarta.annotation.PostConstruct;

import org.springframework.stereotype.Service;

import com.odin.peer_mesh_service.component.LocalSession;
import com.odin.peer_mesh_service.component.MediaDeviceProvider;
import com.odin.peer_mesh_service.component.SessionChangeNotifier;
import com.odin.peer_mesh_service.component.SessionErrorSlot;
import com.odin.peer_mesh_service.config.PeerSessionProperties;
import com.odin.peer_mesh_service.dto.PeerConnection;
import com.odin.peer_mesh_service.dto.signal.CameraStreamRestoredMessage;
import com.odin.peer_mesh_service.dto.signal.ReconnectAfterScreenShareMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenShareConfirmedMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenShareRetryNeededMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenShareStartedMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenSharingStatusMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenSharingStreamMessage;
import com.odin.peer_mesh_service.dto.signal.StreamMetadataMessage;
import com.odin.peer_mesh_service.enums.FailureReason;
import com.odin.peer_mesh_service.enums.SessionErrorCode;
import com.odin.peer_mesh_service.enums.StreamType;
import com.odin.peer_mesh_service.enums.TaskPurpose;
import com.odin.peer_mesh_service.exception.MediaAccessException;
import com.odin.peer_mesh_service.transport.MediaStream;
import com.odin.peer_mesh_service.utility.ControlLoop;

import lombok.extern.slf4j.Slf4j;

/**
 * Local screen sharing. The screen travels on a second media channel per
 * peer; primary camera channels are never replaced while sharing. Stopping
 * closes only the screen channels and then repairs every camera channel.
 */
@Slf4j
@Service
public class ScreenShareService implements PeerLifecycleListener {

    private static final String SCREEN_CONTENT_HINT = "detail";

    private final LocalSession session;
    private final PeerConnectionService connections;
    private final ConnectionRegistryService registry;
    private final ParticipantStoreService participants;
    private final SignalMessageRouter router;
    private final ScheduledTaskTable tasks;
    private final MediaDeviceProvider devices;
    private final SessionErrorSlot errors;
    private final ControlLoop loop;
    private final SessionChangeNotifier notifier;
    private final PeerSessionProperties properties;

    private boolean starting;

    public ScreenShareService(LocalSession session,
                              PeerConnectionService connections,
                              ConnectionRegistryService registry,
                              ParticipantStoreService participants,
                              SignalMessageRouter router,
                              ScheduledTaskTable tasks,
                              MediaDeviceProvider devices,
                              SessionErrorSlot errors,
                              ControlLoop loop,
                              SessionChangeNotifier notifier,
                              PeerSessionProperties properties) {
        this.session = session;
        this.connections = connections;
        this.registry = registry;
        this.participants = participants;
        this.router = router;
        this.tasks = tasks;
        this.devices = devices;
        this.errors = errors;
        this.loop = loop;
        this.notifier = notifier;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        connections.addLifecycleListener(this);
    }

    /**
     * Sharing is offered only while nobody else is flagged as sharing. Two
     * peers starting at the same moment can still both share.
     */
    public boolean canStartScreenShare() {
        return session.isOpen() && !session.isScreenSharing() && !starting && !participants.isAnyoneSharing();
    }

    /**
     * @return false when the share was refused outright
     */
    public boolean startScreenShare() {
        if (!canStartScreenShare()) {
            log.info("[SCREEN] Screen share refused (sharing={}, others sharing={})",
                    session.isScreenSharing(), participants.sharingIds());
            return false;
        }
        starting = true;
        log.info("[SCREEN] Requesting display media");
        devices.openDisplayMedia().whenComplete((stream, error) ->
                loop.execute(() -> onDisplayMedia(stream, error)));
        return true;
    }

    private void onDisplayMedia(MediaStream stream, Throwable error) {
        starting = false;
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            FailureReason reason = cause instanceof MediaAccessException
                    ? ((MediaAccessException) cause).getReason()
                    : FailureReason.NOT_ALLOWED;
            log.warn("[SCREEN] Display media unavailable: {}", cause.getMessage());
            errors.raise(SessionErrorCode.SCREEN_SHARE_FAILED, reason, null, cause.getMessage());
            notifyState();
            return;
        }
        if (!session.isOpen()) {
            stream.stop();
            return;
        }
        stream.getVideoTracks().forEach(track -> {
            track.setContentHint(SCREEN_CONTENT_HINT);
            // the user can end the capture from outside the app
            track.onEnded(() -> loop.execute(this::stopScreenShare));
        });
        session.setScreenStream(stream);
        log.info("[SCREEN] Screen share started");
        router.sendToAll(new ScreenSharingStatusMessage(session.getSelfId(), true, StreamType.SCREEN));
        notifyState();
        tasks.schedule(session.getSelfId(), TaskPurpose.SCREEN_SHARE_BEGIN, properties.getScreenStatusDelayMs(),
                this::openScreenChannels);
    }

    private void openScreenChannels() {
        if (!session.isScreenSharing()) {
            return;
        }
        List<String> peers = connectedPeers();
        log.info("[SCREEN] Sending screen to {} peers", peers.size());
        for (int i = 0; i < peers.size(); i++) {
            String peerId = peers.get(i);
            tasks.schedule(peerId, TaskPurpose.SCREEN_CHANNEL, i * properties.getScreenChannelStaggerMs(),
                    () -> sendScreenTo(peerId));
        }
    }

    private void sendScreenTo(String peerId) {
        MediaStream screen = session.getScreenStream();
        if (screen == null || !screen.isActive() || !connections.hasOpenControl(peerId)) {
            return;
        }
        router.send(peerId, new ScreenSharingStreamMessage(session.getSelfId()));
        connections.callWithScreen(peerId, screen);
        router.send(peerId, new ScreenShareStartedMessage(session.getSelfId()));
    }

    public void stopScreenShare() {
        MediaStream screen = session.getScreenStream();
        if (screen == null) {
            return;
        }
        log.info("[SCREEN] Stopping screen share");
        session.setScreenStream(null);
        screen.stop();
        tasks.cancel(session.getSelfId(), TaskPurpose.SCREEN_SHARE_BEGIN);
        registry.peerIds().forEach(peerId -> {
            tasks.cancel(peerId, TaskPurpose.SCREEN_CHANNEL);
            tasks.cancel(peerId, TaskPurpose.LATE_JOINER_SCREEN);
            tasks.cancel(peerId, TaskPurpose.SCREEN_RETRY);
        });
        router.sendToAll(new ScreenSharingStatusMessage(session.getSelfId(), false, StreamType.CAMERA));
        registry.closeAllScreenChannels();
        notifyState();
        tasks.schedule(session.getSelfId(), TaskPurpose.CAMERA_RESTORE, properties.getCameraRestoreDelayMs(),
                this::restoreCameraChannels);
    }

    private void restoreCameraChannels() {
        if (!session.isOpen()) {
            return;
        }
        Set<String> known = new LinkedHashSet<>(registry.peerIds());
        known.addAll(participants.ids());
        known.remove(session.getSelfId());
        List<String> peers = List.copyOf(known);
        log.info("[SCREEN] Repairing camera channels with {} peers", peers.size());
        for (int i = 0; i < peers.size(); i++) {
            String peerId = peers.get(i);
            tasks.schedule(peerId, TaskPurpose.CAMERA_REPAIR, i * properties.getCameraRepairStaggerMs(),
                    () -> repairCamera(peerId));
        }
        router.sendToAll(new CameraStreamRestoredMessage(session.getSelfId()));
    }

    private void repairCamera(String peerId) {
        if (!session.isOpen() || !session.getTopology().allowsDirectConnection(session.isCreator(), peerId)) {
            return;
        }
        if (registry.getMediaChannel(peerId) == null) {
            connections.establishPeerConnection(peerId);
        } else {
            router.send(peerId, new ReconnectAfterScreenShareMessage(session.getSelfId()));
        }
    }

    /**
     * A receiver asked for a fresh screen stream.
     */
    public void respondToScreenRequest(String peerId, boolean urgent) {
        MediaStream screen = session.getScreenStream();
        if (screen == null || !screen.isActive()) {
            log.debug("[SCREEN] {} asked for the screen but nothing is shared", peerId);
            return;
        }
        log.info("[SCREEN] Refreshing screen channel to {} (urgent={})", peerId, urgent);
        tasks.cancel(peerId, TaskPurpose.SCREEN_RETRY);
        router.send(peerId, new ScreenSharingStreamMessage(session.getSelfId()));
        connections.callWithScreen(peerId, screen);
        router.send(peerId, new ScreenShareConfirmedMessage(session.getSelfId()));
    }

    @Override
    public void onControlOpened(String peerId) {
        if (!session.isScreenSharing()) {
            return;
        }
        log.info("[SCREEN] Late joiner {}, sending sharing status", peerId);
        router.send(peerId, new ScreenSharingStatusMessage(session.getSelfId(), true, StreamType.SCREEN));
        tasks.schedule(peerId, TaskPurpose.LATE_JOINER_SCREEN, properties.getLateJoinerScreenDelayMs(), () -> {
            if (registry.getScreenChannel(peerId) != null) {
                return;
            }
            sendScreenTo(peerId);
            router.send(peerId, new StreamMetadataMessage(session.getSelfId(), StreamType.SCREEN));
        });
    }

    @Override
    public void onOutboundScreenLost(String peerId) {
        if (!session.isScreenSharing()) {
            return;
        }
        tasks.schedule(peerId, TaskPurpose.SCREEN_RETRY, properties.getScreenChannelStaggerMs(), () -> {
            if (session.isScreenSharing() && registry.getScreenChannel(peerId) == null
                    && connections.hasOpenControl(peerId)) {
                log.info("[SCREEN] Screen channel to {} dropped, asking it to retry", peerId);
                router.send(peerId, new ScreenShareRetryNeededMessage(session.getSelfId()));
            }
        });
    }

    private List<String> connectedPeers() {
        return registry.all().stream()
                .filter(PeerConnection::hasOpenControl)
                .map(PeerConnection::getPeerId)
                .collect(Collectors.toList());
    }

    private void notifyState() {
        notifier.changed();
    }
}
