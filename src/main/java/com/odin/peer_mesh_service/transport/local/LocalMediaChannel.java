package com.odin.peer_mesh_service.transport.local;

import java.util.Collections;
import java.util.Map;

import com.odin.peer_mesh_service.transport.MediaChannel;
import com.odin.peer_mesh_service.transport.MediaChannelListener;
import com.odin.peer_mesh_service.transport.MediaStream;


class LocalMediaChannel implements MediaChannel {

    private final String channelId;
    private final LocalTransportAdapter owner;
    private final String peerId;
    private final boolean outbound;
    private final Map<String, String> metadata;

    private volatile LocalMediaChannel remote;
    private volatile MediaChannelListener listener;
    private volatile MediaStream localStream;
    private volatile MediaStream remoteStream;
    private volatile boolean answered;
    private volatile boolean closed;

    LocalMediaChannel(String channelId, LocalTransportAdapter owner, String peerId, boolean outbound,
                      Map<String, String> metadata) {
        this.channelId = channelId;
        this.owner = owner;
        this.peerId = peerId;
        this.outbound = outbound;
        this.metadata = metadata == null ? Collections.emptyMap() : Map.copyOf(metadata);
    }

    void pair(LocalMediaChannel remote) {
        this.remote = remote;
    }

    void setLocalStream(MediaStream localStream) {
        this.localStream = localStream;
    }

    void fail(Throwable error) {
        if (closed) {
            return;
        }
        MediaChannelListener current = listener;
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
    public Map<String, String> getMetadata() {
        return metadata;
    }

    @Override
    public MediaStream getLocalStream() {
        return localStream;
    }

    @Override
    public MediaStream getRemoteStream() {
        return remoteStream;
    }

    @Override
    public boolean isOpen() {
        return answered && !closed;
    }

    @Override
    public void answer(MediaStream stream) {
        if (outbound) {
            throw new IllegalStateException("Outbound media channel cannot be answered locally");
        }
        if (closed || answered) {
            return;
        }
        LocalMediaChannel caller = remote;
        if (caller == null || caller.closed) {
            close();
            return;
        }
        this.localStream = stream;
        this.answered = true;
        caller.answered = true;

        MediaStream offered = caller.localStream;
        if (offered != null) {
            owner.getLoop().execute(() -> deliverStream(offered));
        }
        if (stream != null) {
            caller.owner.getLoop().execute(() -> caller.deliverStream(stream));
        }
    }

    private void deliverStream(MediaStream stream) {
        if (closed) {
            return;
        }
        this.remoteStream = stream;
        MediaChannelListener current = listener;
        if (current != null) {
            current.onStream(this, stream);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        owner.forget(this);
        owner.getLoop().execute(() -> {
            MediaChannelListener current = listener;
            if (current != null) {
                current.onClose(this);
            }
        });
        // the far end closes after anything already queued to it
        LocalMediaChannel target = remote;
        if (target != null) {
            target.owner.getLoop().execute(target::close);
        }
    }

    @Override
    public void setListener(MediaChannelListener listener) {
        this.listener = listener;
    }

    @Override
    public String toString() {
        return "MediaChannel[" + channelId + " -> " + peerId + " " + metadata + "]";
    }
}
