package com.odin.peer_mesh_service.transport;

/**
 * Ordered, reliable signaling channel to one peer. Messages are delivered in
 * send order; events reach the listener on the owning node's control loop.
 */
public interface ControlChannel {

    String getChannelId();

    String getPeerId();

    /**
     * True when the local node initiated this channel.
     */
    boolean isOutbound();

    boolean isOpen();

    void send(String payload);

    void close();

    void setListener(ControlChannelListener listener);
}
