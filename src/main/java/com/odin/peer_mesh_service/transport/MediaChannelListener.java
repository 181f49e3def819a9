package com.odin.peer_mesh_service.transport;

public interface MediaChannelListener {

    void onStream(MediaChannel channel, MediaStream remoteStream);

    void onClose(MediaChannel channel);

    void onError(MediaChannel channel, Throwable error);
}
