package com.odin.peer_mesh_service.transport;

public interface ControlChannelListener {

    void onOpen(ControlChannel channel);

    void onMessage(ControlChannel channel, String payload);

    void onClose(ControlChannel channel);

    void onError(ControlChannel channel, Throwable error);
}
