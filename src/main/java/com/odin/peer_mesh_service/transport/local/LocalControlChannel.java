package com.odin.peer_mesh_service.transport.local;

import com.odin.peer_mesh_service.transport.ControlChannel;
import com.odin.peer_mesh_service.transport.ControlChannelListener;

import lombok.extern.slf4j.Slf4j;

@Slf4j
class LocalControlChannel implements ControlChannel {

    private final String channelId;
    private final LocalTransportAdapter owner;
    private final String peerId;
    private final boolean outbound;

    private volatile LocalControlChannel remote;
    private volatile ControlChannelListener listener;
    private volatile boolean open;
    private volatile boolean closed;

    LocalControlChannel(String channelId, LocalTransportAdapter owner, String peerId, boolean outbound) {
        this.channelId = channelId;
        this.owner = owner;
        this.peerId = peerId;
        this.outbound = outbound;
    }

    void pair(LocalControlChannel remote) {
        this.remote = remote;
    }

    void markOpen() {
        if (closed || open) {
            return;
        }
        open = true;
        ControlChannelListener current = listener;
        if (current != null) {
            current.onOpen(this);
        }
    }

    void fail(Throwable error) {
        if (closed) {
            return;
        }
        ControlChannelListener current = listener;
        if (current != null) {
            current.onError(this, error);
        }
        close();
    }

    @Override
    public String getChannelId() {
        return channelId;
    }

    @Override
    public String getPeerId() {
        return peerId;
    }

    @Override
    public boolean isOutbound() {
        return outbound;
    }

    @Override
    public boolean isOpen() {
        return open && !closed;
    }

    @Override
    public void send(String payload) {
        if (!isOpen()) {
            log.warn("[HUB] Dropping message on closed channel {} to {}", channelId, peerId);
            return;
        }
        LocalControlChannel target = remote;
        if (target == null) {
            return;
        }
        target.owner.getLoop().execute(() -> target.receive(payload));
    }

    private void receive(String payload) {
        if (closed) {
            return;
        }
        ControlChannelListener current = listener;
        if (current != null) {
            current.onMessage(this, payload);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        open = false;
        owner.forget(this);
        owner.getLoop().execute(() -> {
            ControlChannelListener current = listener;
            if (current != null) {
                current.onClose(this);
            }
        });
        // the far end closes after anything already queued to it
        LocalControlChannel target = remote;
        if (target != null) {
            target.owner.getLoop().execute(target::close);
        }
    }

    @Override
    public void setListener(ControlChannelListener listener) {
        this.listener = listener;
    }

    @Override
    public String toString() {
        return "ControlChannel[" + channelId + " -> " + peerId + "]";
    }
}
