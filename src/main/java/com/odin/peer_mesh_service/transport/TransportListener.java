package com.odin.peer_mesh_service.transport;

import com.odin.peer_mesh_service.enums.SessionErrorKind;

/**
 * Events emitted by a {@link TransportAdapter}. Invoked on the control loop.
 */
public interface TransportListener {

    void onOpen(String selfId);

    void onIncomingControlChannel(ControlChannel channel);

    void onIncomingMediaChannel(MediaChannel channel);

    /**
     * @param peerId the remote peer the error concerns, or the local id for
     *               registration errors
     */
    void onSessionError(SessionErrorKind kind, String peerId, String detail);
}
