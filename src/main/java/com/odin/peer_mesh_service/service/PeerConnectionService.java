package com.odin.peer_mesh_service.service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.springframework.stereotype.Service;

import com.odin.peer_mesh_service.component.LocalSession;
import com.odin.peer_mesh_service.config.PeerSessionProperties;
import com.odin.peer_mesh_service.constants.ApplicationConstants;
import com.odin.peer_mesh_service.dto.signal.UsernameMessage;
import com.odin.peer_mesh_service.enums.StreamType;
import com.odin.peer_mesh_service.enums.TaskPurpose;
import com.odin.peer_mesh_service.enums.TransitionState;
import com.odin.peer_mesh_service.transport.ControlChannel;
import com.odin.peer_mesh_service.transport.ControlChannelListener;
import com.odin.peer_mesh_service.transport.MediaChannel;
import com.odin.peer_mesh_service.transport.MediaChannelListener;
import com.odin.peer_mesh_service.transport.MediaChannelOptions;
import com.odin.peer_mesh_service.transport.MediaStream;
import com.odin.peer_mesh_service.transport.TransportAdapter;

import lombok.extern.slf4j.Slf4j;

/**
 * Opens, accepts and tears down the channels to each peer and keeps the
 * connection registry in step with them. Every channel callback checks the
 * generation it was installed with and ignores events of channels that have
 * since been replaced.
 */
@Slf4j
@Service
public class PeerConnectionService {

    private final TransportAdapter transport;
    private final ConnectionRegistryService registry;
    private final ParticipantStoreService participants;
    private final SignalMessageRouter router;
    private final ScheduledTaskTable tasks;
    private final LocalSession session;
    private final PeerSessionProperties properties;

    private final List<PeerLifecycleListener> listeners = new CopyOnWriteArrayList<>();

    public PeerConnectionService(TransportAdapter transport,
                                 ConnectionRegistryService registry,
                                 ParticipantStoreService participants,
                                 SignalMessageRouter router,
                                 ScheduledTaskTable tasks,
                                 LocalSession session,
                                 PeerSessionProperties properties) {
        this.transport = transport;
        this.registry = registry;
        this.participants = participants;
        this.router = router;
        this.tasks = tasks;
        this.session = session;
        this.properties = properties;
    }

    public void addLifecycleListener(PeerLifecycleListener listener) {
        listeners.add(listener);
    }

    /**
     * Makes sure a control channel and a primary media channel to the peer
     * exist. Does nothing when a media channel is already in place.
     */
    public void establishPeerConnection(String peerId) {
        if (!session.isOpen() || session.isSelf(peerId) || peerId == null) {
            return;
        }
        if (registry.getMediaChannel(peerId) != null) {
            log.debug("[CONNECT] Media channel to {} already present, skipping", peerId);
            return;
        }
        log.info("[CONNECT] Establishing connection to {}", peerId);
        ensureControlChannel(peerId);
        callWithCamera(peerId);
        participants.setTransition(peerId, TransitionState.CONNECTING);
    }

    public ControlChannel ensureControlChannel(String peerId) {
        ControlChannel existing = registry.getControlChannel(peerId);
        if (existing != null) {
            return existing;
        }
        ControlChannel channel = transport.openControlChannel(peerId);
        attachControl(channel);
        return channel;
    }

    public boolean hasOpenControl(String peerId) {
        ControlChannel channel = registry.getControlChannel(peerId);
        return channel != null && channel.isOpen();
    }

    /**
     * Closes the current primary media channel to the peer, if any, and
     * calls it again with the local camera stream.
     */
    public MediaChannel callWithCamera(String peerId) {
        MediaStream local = session.getLocalStream();
        if (local == null) {
            log.warn("[CONNECT] No local stream, cannot call {}", peerId);
            return null;
        }
        registry.closeMedia(peerId);
        MediaChannel channel = transport.openMediaChannel(peerId, local, MediaChannelOptions.builder()
                .username(session.getUsername())
                .streamType(StreamType.CAMERA)
                .build());
        long generation = attachPrimaryMedia(channel);
        tasks.schedule(peerId, TaskPurpose.CONNECT_TIMEOUT, properties.getConnectTimeoutMs(),
                () -> onConnectTimeout(peerId, channel, generation));
        return channel;
    }

    /**
     * Opens a screen overlay channel to the peer. The primary channel is
     * left alone.
     */
    public MediaChannel callWithScreen(String peerId, MediaStream screenStream) {
        registry.closeScreen(peerId);
        MediaChannel channel = transport.openMediaChannel(peerId, screenStream, MediaChannelOptions.builder()
                .username(session.getUsername())
                .streamType(StreamType.SCREEN)
                .build());
        attachScreenMedia(channel);
        return channel;
    }

    public void acceptControlChannel(ControlChannel channel) {
        String peerId = channel.getPeerId();
        if (!session.getTopology().allowsDirectConnection(session.isCreator(), peerId)) {
            log.info("[CONNECT] Rejecting control channel from {} under {} topology", peerId, session.getTopology());
            channel.close();
            return;
        }
        ControlChannel existing = registry.getControlChannel(peerId);
        if (existing != null && existing.isOutbound() && !existing.isOpen() && winsGlare(peerId)) {
            log.info("[CONNECT] Control glare with {}, keeping own channel", peerId);
            channel.close();
            return;
        }
        log.info("[CONNECT] Accepted control channel from {}", peerId);
        attachControl(channel);
    }

    public void acceptMediaChannel(MediaChannel channel) {
        String peerId = channel.getPeerId();
        if (!session.getTopology().allowsDirectConnection(session.isCreator(), peerId)) {
            log.info("[CONNECT] Rejecting media channel from {} under {} topology", peerId, session.getTopology());
            channel.close();
            return;
        }
        Map<String, String> metadata = channel.getMetadata();
        String callerName = metadata.get(ApplicationConstants.METADATA_USERNAME);
        if (callerName != null) {
            participants.applyUsername(peerId, callerName);
        }
        // untagged calls count as screen content after a screen-sharing-stream notice
        String streamType = metadata.get(ApplicationConstants.METADATA_STREAM_TYPE);
        boolean screen = streamType != null
                ? StreamType.SCREEN.getValue().equals(streamType)
                : registry.isExpectingScreen(peerId);
        if (screen) {
            log.info("[SCREEN] Incoming screen channel from {}", peerId);
            registry.setExpectScreen(peerId, false);
            attachScreenMedia(channel);
            channel.answer(null);
            return;
        }

        MediaChannel existing = registry.getMediaChannel(peerId);
        if (existing != null && existing.isOutbound() && existing.getRemoteStream() == null && winsGlare(peerId)) {
            log.info("[CONNECT] Media glare with {}, keeping own call", peerId);
            channel.close();
            return;
        }
        log.info("[CONNECT] Answering call from {}", peerId);
        tasks.cancel(peerId, TaskPurpose.CONNECT_TIMEOUT);
        attachPrimaryMedia(channel);
        channel.answer(session.getLocalStream());
        ensureControlChannel(peerId);
    }

    /**
     * The peer left or its control channel went away: drop every channel and
     * let the participant fade out.
     */
    public void handlePeerDisconnection(String peerId) {
        if (session.isSelf(peerId)) {
            return;
        }
        log.info("[DISCONNECT] Peer {} disconnected", peerId);
        tasks.cancelAll(peerId);
        registry.remove(peerId);
        participants.beginRemoval(peerId);
        fire(l -> l.onPeerRemoved(peerId));
    }

    /**
     * Drops the peer at once, used when topology policy no longer allows it.
     */
    public void teardownPeer(String peerId) {
        log.info("[TOPOLOGY] Tearing down connection to {}", peerId);
        tasks.cancelAll(peerId);
        registry.remove(peerId);
        participants.remove(peerId);
        fire(l -> l.onPeerRemoved(peerId));
    }

    private boolean winsGlare(String peerId) {
        String self = session.getSelfId();
        return self != null && self.compareTo(peerId) < 0;
    }

    private void attachControl(ControlChannel channel) {
        String peerId = channel.getPeerId();
        long generation = registry.replaceControl(peerId, channel);
        channel.setListener(new ControlChannelListener() {
            private boolean opened;

            @Override
            public void onOpen(ControlChannel ch) {
                if (!registry.isCurrentControl(peerId, generation)) {
                    return;
                }
                opened = true;
                log.info("[CONNECT] Control channel to {} open", peerId);
                registry.touch(peerId);
                router.send(ch, new UsernameMessage(session.getUsername(), session.getSelfId()));
                fire(l -> l.onControlOpened(peerId));
            }

            @Override
            public void onMessage(ControlChannel ch, String payload) {
                router.dispatch(peerId, payload);
            }

            @Override
            public void onClose(ControlChannel ch) {
                if (!registry.detachControl(peerId, generation)) {
                    return;
                }
                if (!opened) {
                    // a failed attempt or a lost glare race, not a departure
                    log.info("[CONNECT] Control channel to {} closed before opening", peerId);
                    return;
                }
                log.info("[CONNECT] Control channel to {} closed", peerId);
                fire(l -> l.onControlClosed(peerId));
            }

            @Override
            public void onError(ControlChannel ch, Throwable error) {
                log.warn("[CONNECT] Control channel to {} failed: {}", peerId, error.getMessage());
            }
        });
    }

    private long attachPrimaryMedia(MediaChannel channel) {
        String peerId = channel.getPeerId();
        long generation = registry.replaceMedia(peerId, channel);
        channel.setListener(new MediaChannelListener() {
            @Override
            public void onStream(MediaChannel ch, MediaStream remoteStream) {
                if (!registry.isCurrentMedia(peerId, generation)) {
                    return;
                }
                log.info("[CONNECT] Camera stream from {} ({})", peerId, remoteStream.describeTracks());
                tasks.cancel(peerId, TaskPurpose.CONNECT_TIMEOUT);
                registry.touch(peerId);
                participants.setCameraStream(peerId, remoteStream);
                fire(l -> l.onMediaStream(peerId));
            }

            @Override
            public void onClose(MediaChannel ch) {
                if (!registry.detachMedia(peerId, generation)) {
                    return;
                }
                log.info("[CONNECT] Media channel to {} closed", peerId);
                tasks.cancel(peerId, TaskPurpose.CONNECT_TIMEOUT);
                fire(l -> l.onMediaLost(peerId));
            }

            @Override
            public void onError(MediaChannel ch, Throwable error) {
                log.warn("[CONNECT] Media channel to {} failed: {}", peerId, error.getMessage());
            }
        });
        return generation;
    }

    private void attachScreenMedia(MediaChannel channel) {
        String peerId = channel.getPeerId();
        long generation = registry.replaceScreen(peerId, channel);
        channel.setListener(new MediaChannelListener() {
            @Override
            public void onStream(MediaChannel ch, MediaStream remoteStream) {
                if (!registry.isCurrentScreen(peerId, generation) || ch.isOutbound()) {
                    return;
                }
                log.info("[SCREEN] Screen stream from {}", peerId);
                registry.touch(peerId);
                participants.setScreenStream(peerId, remoteStream);
                fire(l -> l.onScreenStream(peerId));
            }

            @Override
            public void onClose(MediaChannel ch) {
                if (!registry.detachScreen(peerId, generation)) {
                    return;
                }
                log.info("[SCREEN] Screen channel with {} closed", peerId);
                if (ch.isOutbound()) {
                    fire(l -> l.onOutboundScreenLost(peerId));
                } else {
                    participants.clearScreenStream(peerId);
                    fire(l -> l.onScreenLost(peerId));
                }
            }

            @Override
            public void onError(MediaChannel ch, Throwable error) {
                log.warn("[SCREEN] Screen channel with {} failed: {}", peerId, error.getMessage());
            }
        });
    }

    private void onConnectTimeout(String peerId, MediaChannel channel, long generation) {
        if (!registry.isCurrentMedia(peerId, generation) || channel.getRemoteStream() != null) {
            return;
        }
        log.warn("[CONNECT] Call to {} timed out after {} ms", peerId, properties.getConnectTimeoutMs());
        registry.closeMedia(peerId);
        fire(l -> l.onMediaFailed(peerId));
    }

    private void fire(Consumer<PeerLifecycleListener> event) {
        for (PeerLifecycleListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.error("Lifecycle listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
