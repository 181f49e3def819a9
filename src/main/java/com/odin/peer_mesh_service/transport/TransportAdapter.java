package com.odin.peer_mesh_service.transport;

/**
 * Boundary to the WebRTC-capable transport. NAT traversal, ICE/SDP and relay
 * negotiation happen behind this interface and are opaque to the orchestrator.
 */
public interface TransportAdapter {

    /**
     * Registers the local peer id. {@link TransportListener#onOpen} follows on
     * success, {@link TransportListener#onSessionError} otherwise.
     */
    SessionHandle registerSelf(String peerId, TransportListener listener);

    ControlChannel openControlChannel(String peerId);

    MediaChannel openMediaChannel(String peerId, MediaStream localStream, MediaChannelOptions options);

    /**
     * Asks the transport to renegotiate (ICE restart) every session with the peer.
     */
    void restartSession(String peerId);

    /**
     * Restricts future negotiation with the peer to relayed candidates.
     */
    void forceRelay(String peerId);
}
