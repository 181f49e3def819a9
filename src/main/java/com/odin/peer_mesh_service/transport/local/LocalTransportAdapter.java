package com.odin.peer_mesh_service.transport.local;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import com.odin.peer_mesh_service.enums.SessionErrorKind;
import com.odin.peer_mesh_service.transport.ControlChannel;
import com.odin.peer_mesh_service.transport.MediaChannel;
import com.odin.peer_mesh_service.transport.MediaChannelOptions;
import com.odin.peer_mesh_service.transport.MediaStream;
import com.odin.peer_mesh_service.transport.SessionHandle;
import com.odin.peer_mesh_service.transport.TransportAdapter;
import com.odin.peer_mesh_service.transport.TransportListener;
import com.odin.peer_mesh_service.utility.ControlLoop;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * One node's view of a {@link LocalTransportHub}. All events for the node are
 * delivered through its control loop.
 */
@Slf4j
public class LocalTransportAdapter implements TransportAdapter {

    private final LocalTransportHub hub;
    @Getter
    private final ControlLoop loop;
    private final Set<LocalControlChannel> controlChannels = ConcurrentHashMap.newKeySet();
    private final Set<LocalMediaChannel> mediaChannels = ConcurrentHashMap.newKeySet();

    private volatile String selfId;
    private volatile TransportListener listener;

    LocalTransportAdapter(LocalTransportHub hub, ControlLoop loop) {
        this.hub = hub;
        this.loop = loop;
    }

    @Override
    public SessionHandle registerSelf(String peerId, TransportListener listener) {
        this.listener = listener;
        if (!hub.register(peerId, this)) {
            loop.execute(() -> listener.onSessionError(SessionErrorKind.UNAVAILABLE_ID, peerId,
                    "ID \"" + peerId + "\" is taken"));
            return new Handle(peerId, false);
        }
        this.selfId = peerId;
        loop.execute(() -> listener.onOpen(peerId));
        return new Handle(peerId, true);
    }

    @Override
    public ControlChannel openControlChannel(String peerId) {
        requireRegistered();
        String channelId = hub.nextChannelId("dc");
        LocalControlChannel local = new LocalControlChannel(channelId, this, peerId, true);
        controlChannels.add(local);

        LocalTransportAdapter remote = hub.find(peerId);
        if (remote == null) {
            log.warn("[HUB] Could not connect to peer {}", peerId);
            loop.execute(() -> {
                notifyError(SessionErrorKind.PEER_UNAVAILABLE, peerId, "Could not connect to peer " + peerId);
                local.fail(new IllegalStateException("Peer " + peerId + " unavailable"));
            });
            return local;
        }
        if (!hub.isPassable(selfId, peerId)) {
            log.info("[HUB] Control channel {} to {} pending, direct path blocked", channelId, peerId);
            return local;
        }
        LocalControlChannel inbound = new LocalControlChannel(channelId, remote, selfId, false);
        local.pair(inbound);
        inbound.pair(local);
        remote.controlChannels.add(inbound);
        remote.loop.execute(() -> {
            remote.deliverIncomingControl(inbound);
            remote.loop.execute(inbound::markOpen);
        });
        loop.execute(() -> loop.execute(local::markOpen));
        return local;
    }

    @Override
    public MediaChannel openMediaChannel(String peerId, MediaStream localStream, MediaChannelOptions options) {
        requireRegistered();
        String channelId = hub.nextChannelId("mc");
        LocalMediaChannel local = new LocalMediaChannel(channelId, this, peerId, true,
                options == null ? null : options.toMetadata());
        local.setLocalStream(localStream);
        mediaChannels.add(local);

        LocalTransportAdapter remote = hub.find(peerId);
        if (remote == null) {
            log.warn("[HUB] Could not call peer {}", peerId);
            loop.execute(() -> {
                notifyError(SessionErrorKind.PEER_UNAVAILABLE, peerId, "Could not connect to peer " + peerId);
                local.fail(new IllegalStateException("Peer " + peerId + " unavailable"));
            });
            return local;
        }
        if (!hub.isPassable(selfId, peerId)) {
            log.info("[HUB] Media channel {} to {} pending, direct path blocked", channelId, peerId);
            return local;
        }
        LocalMediaChannel inbound = new LocalMediaChannel(channelId, remote, selfId, false, local.getMetadata());
        local.pair(inbound);
        inbound.pair(local);
        remote.mediaChannels.add(inbound);
        remote.loop.execute(() -> remote.deliverIncomingMedia(inbound));
        return local;
    }

    @Override
    public void restartSession(String peerId) {
        requireRegistered();
        hub.countRestart(selfId, peerId);
        log.info("[HUB] Session restart {} -> {}", selfId, peerId);
    }

    @Override
    public void forceRelay(String peerId) {
        requireRegistered();
        hub.forceRelay(selfId, peerId);
        log.info("[HUB] Relay forced {} -> {}", selfId, peerId);
    }

    public String getSelfId() {
        return selfId;
    }

    public List<ControlChannel> openControlChannelsTo(String peerId) {
        return controlChannels.stream()
                .filter(c -> c.getPeerId().equals(peerId) && c.isOpen())
                .collect(Collectors.toList());
    }

    public List<MediaChannel> openMediaChannelsTo(String peerId) {
        return mediaChannels.stream()
                .filter(c -> c.getPeerId().equals(peerId) && c.isOpen())
                .collect(Collectors.toList());
    }

    void closeChannelsTo(String peerId) {
        controlChannels.stream().filter(c -> c.getPeerId().equals(peerId)).forEach(LocalControlChannel::close);
        mediaChannels.stream().filter(c -> c.getPeerId().equals(peerId)).forEach(LocalMediaChannel::close);
    }

    void forget(LocalControlChannel channel) {
        controlChannels.remove(channel);
    }

    void forget(LocalMediaChannel channel) {
        mediaChannels.remove(channel);
    }

    private void deliverIncomingControl(LocalControlChannel channel) {
        TransportListener current = listener;
        if (current == null || selfId == null) {
            channel.close();
            return;
        }
        current.onIncomingControlChannel(channel);
    }

    private void deliverIncomingMedia(LocalMediaChannel channel) {
        TransportListener current = listener;
        if (current == null || selfId == null) {
            channel.close();
            return;
        }
        current.onIncomingMediaChannel(channel);
    }

    private void notifyError(SessionErrorKind kind, String peerId, String detail) {
        TransportListener current = listener;
        if (current != null) {
            current.onSessionError(kind, peerId, detail);
        }
    }

    private void requireRegistered() {
        if (selfId == null) {
            throw new IllegalStateException("Transport session is not registered");
        }
    }

    private void destroy() {
        String id = selfId;
        if (id == null) {
            return;
        }
        controlChannels.forEach(LocalControlChannel::close);
        mediaChannels.forEach(LocalMediaChannel::close);
        hub.unregister(id, this);
        selfId = null;
        listener = null;
    }

    private final class Handle implements SessionHandle {

        private final String peerId;
        private volatile boolean open;

        private Handle(String peerId, boolean open) {
            this.peerId = peerId;
            this.open = open;
        }

        @Override
        public String getPeerId() {
            return peerId;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void destroy() {
            if (!open) {
                return;
            }
            open = false;
            LocalTransportAdapter.this.destroy();
        }
    }
}
