package com.odin.peer_mesh_service.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import jakarta.annotation.PostConstruct;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.exception.ExceptionUtils;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.odin.peer_mesh_service.component.LocalSession;
import com.odin.peer_mesh_service.component.SessionChangeNotifier;
import com.odin.peer_mesh_service.component.SessionErrorSlot;
import com.odin.peer_mesh_service.component.SessionEventSink;
import com.odin.peer_mesh_service.component.SessionSnapshotHolder;
import com.odin.peer_mesh_service.constants.ApplicationConstants;
import com.odin.peer_mesh_service.dto.SessionSnapshot;
import com.odin.peer_mesh_service.dto.signal.PeerDisconnectMessage;
import com.odin.peer_mesh_service.dto.signal.SignalMessage;
import com.odin.peer_mesh_service.dto.signal.UsernameMessage;
import com.odin.peer_mesh_service.enums.FailureReason;
import com.odin.peer_mesh_service.enums.SessionErrorCode;
import com.odin.peer_mesh_service.enums.SessionErrorKind;
import com.odin.peer_mesh_service.enums.Topology;
import com.odin.peer_mesh_service.exception.MediaAccessException;
import com.odin.peer_mesh_service.exception.RecordingException;
import com.odin.peer_mesh_service.transport.ControlChannel;
import com.odin.peer_mesh_service.transport.MediaChannel;
import com.odin.peer_mesh_service.transport.SessionHandle;
import com.odin.peer_mesh_service.transport.TransportAdapter;
import com.odin.peer_mesh_service.transport.TransportListener;
import com.odin.peer_mesh_service.utility.ControlLoop;
import com.odin.peer_mesh_service.utility.PeerIds;
import com.odin.peer_mesh_service.utility.SignalCodec;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the UI layer. Every call is carried over to the control
 * loop; the caller waits for the result. State changes are published as
 * snapshots to the {@link SessionEventSink}, coalesced per loop turn.
 */
@Slf4j
@Service
public class PeerSessionService implements TransportListener {

    private static final long CALL_TIMEOUT_SECONDS = 10;

    private final LocalSession session;
    private final TransportAdapter transport;
    private final LocalMediaService media;
    private final PeerConnectionService connections;
    private final ConnectionRegistryService registry;
    private final ParticipantStoreService participants;
    private final TopologyService topology;
    private final ReconnectionService reconnection;
    private final ScreenShareService screenShare;
    private final RecordingService recording;
    private final SignalMessageRouter router;
    private final SignalCodec codec;
    private final ScheduledTaskTable tasks;
    private final SessionErrorSlot errors;
    private final SessionChangeNotifier notifier;
    private final SessionSnapshotHolder snapshots;
    private final SessionEventSink sink;
    private final ControlLoop loop;

    private final AtomicBoolean publishPending = new AtomicBoolean();

    public PeerSessionService(LocalSession session,
                              TransportAdapter transport,
                              LocalMediaService media,
                              PeerConnectionService connections,
                              ConnectionRegistryService registry,
                              ParticipantStoreService participants,
                              TopologyService topology,
                              ReconnectionService reconnection,
                              ScreenShareService screenShare,
                              RecordingService recording,
                              SignalMessageRouter router,
                              SignalCodec codec,
                              ScheduledTaskTable tasks,
                              SessionErrorSlot errors,
                              SessionChangeNotifier notifier,
                              SessionSnapshotHolder snapshots,
                              SessionEventSink sink,
                              ControlLoop loop) {
        this.session = session;
        this.transport = transport;
        this.media = media;
        this.connections = connections;
        this.registry = registry;
        this.participants = participants;
        this.topology = topology;
        this.reconnection = reconnection;
        this.screenShare = screenShare;
        this.recording = recording;
        this.router = router;
        this.codec = codec;
        this.tasks = tasks;
        this.errors = errors;
        this.notifier = notifier;
        this.snapshots = snapshots;
        this.sink = sink;
        this.loop = loop;
    }

    @PostConstruct
    public void init() {
        participants.addChangeListener(this::requestPublish);
        notifier.addListener(this::requestPublish);
        errors.addListener(error -> {
            sink.errorRaised(error);
            requestPublish();
        });
    }

    // ---- UI calls ------------------------------------------------------

    public SessionSnapshot join(String roomId, boolean creator, String username) {
        if (StringUtils.isBlank(roomId)) {
            throw new IllegalArgumentException("roomId is required");
        }
        return onLoop(() -> {
            if (session.isJoined()) {
                throw new IllegalStateException("Already in room " + session.getRoomId());
            }
            errors.clear();
            session.setRoomId(roomId.trim());
            session.setCreator(creator);
            session.setUsername(StringUtils.defaultIfBlank(username, ApplicationConstants.DEFAULT_USERNAME));
            try {
                media.acquire();
            } catch (MediaAccessException e) {
                log.error("[JOIN] No usable capture device: {}", e.getMessage());
                session.reset();
                errors.raise(SessionErrorCode.MEDIA_UNAVAILABLE, e.getReason(), null, e.getMessage());
                return publishNow();
            }
            String selfId = creator ? PeerIds.creatorId(session.getRoomId()) : PeerIds.joinerId(session.getRoomId(), loop.now());
            session.setSelfId(selfId);
            session.setJoined(true);
            loop.setContextId(selfId);
            log.info("[JOIN] Registering as {} in room {} (creator={})", selfId, session.getRoomId(), creator);
            session.setSessionHandle(transport.registerSelf(selfId, this));
            return publishNow();
        });
    }

    public SessionSnapshot leave() {
        return onLoop(() -> {
            requireJoined();
            log.info("[LEAVE] Leaving room {}", session.getRoomId());
            if (session.isOpen()) {
                router.sendToAll(new PeerDisconnectMessage(session.getSelfId()));
            }
            teardown();
            return publishNow();
        });
    }

    public SessionSnapshot getSnapshot() {
        return snapshots.get();
    }

    public boolean toggleAudio() {
        return onLoop(() -> {
            requireJoined();
            boolean enabled = media.toggleAudio();
            requestPublish();
            return enabled;
        });
    }

    public boolean toggleVideo() {
        return onLoop(() -> {
            requireJoined();
            boolean enabled = media.toggleVideo();
            requestPublish();
            return enabled;
        });
    }

    public boolean startScreenShare() {
        return onLoop(() -> {
            requireOpen();
            return screenShare.startScreenShare();
        });
    }

    public void stopScreenShare() {
        onLoop(() -> {
            requireOpen();
            screenShare.stopScreenShare();
            return null;
        });
    }

    public void setTopology(Topology mode) {
        if (mode == null) {
            throw new IllegalArgumentException("topology is required");
        }
        onLoop(() -> {
            topology.setTopology(mode);
            requestPublish();
            return null;
        });
    }

    /**
     * Sends an application message to every open control channel.
     *
     * @return number of peers the message was handed to
     */
    public int sendToAll(JsonNode message) {
        if (message == null || !message.isObject() || !message.hasNonNull(ApplicationConstants.FIELD_TYPE)) {
            throw new IllegalArgumentException("message must be a JSON object with a type");
        }
        SignalMessage decoded;
        try {
            decoded = codec.fromNode(message);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed " + message.get(ApplicationConstants.FIELD_TYPE).asText()
                    + " message: " + ExceptionUtils.getRootCauseMessage(e), e);
        }
        return onLoop(() -> {
            requireOpen();
            return router.sendToAll(decoded);
        });
    }

    public void setUsername(String username) {
        if (StringUtils.isBlank(username)) {
            throw new IllegalArgumentException("username is required");
        }
        onLoop(() -> {
            session.setUsername(username.trim());
            if (session.isOpen()) {
                router.sendToAll(new UsernameMessage(session.getUsername(), session.getSelfId()));
            }
            requestPublish();
            return null;
        });
    }

    /**
     * Re-synchronises membership with the creator.
     */
    public void reconnectAll() {
        onLoop(() -> {
            requireOpen();
            if (session.isCreator()) {
                topology.broadcastPeerList();
            } else if (!connections.hasOpenControl(session.getCreatorId())) {
                reconnection.startJoin(session.getCreatorId());
            } else {
                topology.requestPeerList();
            }
            return null;
        });
    }

    public void setTransitionsEnabled(boolean enabled) {
        onLoop(() -> {
            session.setTransitionsEnabled(enabled);
            requestPublish();
            return null;
        });
    }

    public void startRecording() throws RecordingException {
        RecordingException failure = onLoop(() -> {
            requireOpen();
            try {
                recording.startRecording();
                return null;
            } catch (RecordingException e) {
                errors.raise(SessionErrorCode.RECORDING_FAILED, e.getReason(), null, e.getMessage());
                return e;
            }
        });
        if (failure != null) {
            throw failure;
        }
    }

    public Path stopRecording() throws RecordingException {
        RecordingResult result = onLoop(() -> {
            try {
                return new RecordingResult(recording.stopRecording(), null);
            } catch (RecordingException e) {
                errors.raise(SessionErrorCode.RECORDING_FAILED, e.getReason(), null, e.getMessage());
                return new RecordingResult(null, e);
            }
        });
        if (result.failure != null) {
            throw result.failure;
        }
        return result.file;
    }

    // ---- transport events ----------------------------------------------

    @Override
    public void onOpen(String selfId) {
        if (!session.isJoined() || !selfId.equals(session.getSelfId())) {
            return;
        }
        session.setOpen(true);
        log.info("[JOIN] Session open as {}", selfId);
        if (!session.isCreator()) {
            reconnection.startJoin(session.getCreatorId());
        }
        requestPublish();
    }

    @Override
    public void onIncomingControlChannel(ControlChannel channel) {
        if (!session.isOpen()) {
            channel.close();
            return;
        }
        connections.acceptControlChannel(channel);
    }

    @Override
    public void onIncomingMediaChannel(MediaChannel channel) {
        if (!session.isOpen()) {
            channel.close();
            return;
        }
        connections.acceptMediaChannel(channel);
    }

    @Override
    public void onSessionError(SessionErrorKind kind, String peerId, String detail) {
        switch (kind) {
            case UNAVAILABLE_ID:
                log.error("[JOIN] Id {} is already taken", peerId);
                teardown();
                errors.raise(SessionErrorCode.ROOM_TAKEN, FailureReason.NOT_ALLOWED, peerId,
                        "A room host with id " + peerId + " already exists");
                break;
            case PEER_UNAVAILABLE:
                log.warn("[CONNECT] Peer {} is not registered", peerId);
                reconnection.onPeerUnavailable(peerId);
                break;
            case NETWORK:
            case SESSION_CLOSED:
            default:
                errors.raise(SessionErrorCode.TRANSPORT_ERROR, FailureReason.CONNECTION_FAILED, peerId,
                        StringUtils.defaultIfBlank(detail, kind.name()));
                break;
        }
    }

    // ---- internals -----------------------------------------------------

    private void teardown() {
        recording.discard();
        reconnection.reset();
        tasks.cancelEverything();
        registry.clear();
        participants.clear();
        SessionHandle handle = session.getSessionHandle();
        if (handle != null) {
            handle.destroy();
        }
        media.release();
        session.reset();
        loop.setContextId(null);
    }

    private void requireJoined() {
        if (!session.isJoined()) {
            throw new IllegalStateException("Not in a room");
        }
    }

    private void requireOpen() {
        if (!session.isOpen()) {
            throw new IllegalStateException("Session is not connected");
        }
    }

    private void requestPublish() {
        if (publishPending.compareAndSet(false, true)) {
            loop.execute(this::publishNow);
        }
    }

    private SessionSnapshot publishNow() {
        publishPending.set(false);
        SessionSnapshot snapshot = SessionSnapshot.builder()
                .selfId(session.getSelfId())
                .roomId(session.getRoomId())
                .username(session.getUsername())
                .creator(session.isCreator())
                .joined(session.isJoined())
                .topology(session.getTopology())
                .audioEnabled(session.isAudioEnabled())
                .videoEnabled(session.isVideoEnabled())
                .audioOnly(session.isAudioOnly())
                .screenSharing(session.isScreenSharing())
                .canStartScreenShare(screenShare.canStartScreenShare())
                .recording(recording.isRecording())
                .remoteRecording(session.isRemoteRecording())
                .transitionsEnabled(session.isTransitionsEnabled())
                .participants(participants.snapshot())
                .error(errors.get())
                .localStream(session.getLocalStream())
                .screenStream(session.getScreenStream())
                .build();
        snapshots.set(snapshot);
        sink.snapshotPublished(snapshot);
        return snapshot;
    }

    private <T> T onLoop(Supplier<T> action) {
        if (loop.inLoop()) {
            return action.get();
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        loop.execute(() -> {
            try {
                result.complete(action.get());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        try {
            return result.get(CALL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException(ExceptionUtils.getRootCauseMessage(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the control loop", e);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Control loop did not answer within " + CALL_TIMEOUT_SECONDS + " s", e);
        }
    }

    private static final class RecordingResult {
        private final Path file;
        private final RecordingException failure;

        private RecordingResult(Path file, RecordingException failure) {
            this.file = file;
            this.failure = failure;
        }
    }
}
