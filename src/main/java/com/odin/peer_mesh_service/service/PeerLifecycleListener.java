package com.odin.peer_mesh_service.service;

/**
 * Connection lifecycle events raised by {@link PeerConnectionService}, all
 * on the control loop. Defaults are no-ops.
 */
public interface PeerLifecycleListener {

    default void onControlOpened(String peerId) {
    }

    default void onControlClosed(String peerId) {
    }

    /**
     * A primary (camera) stream arrived from the peer.
     */
    default void onMediaStream(String peerId) {
    }

    /**
     * The current primary media channel closed or errored after being opened.
     */
    default void onMediaLost(String peerId) {
    }

    /**
     * An outbound primary media channel did not deliver a stream in time.
     */
    default void onMediaFailed(String peerId) {
    }

    default void onScreenStream(String peerId) {
    }

    default void onScreenLost(String peerId) {
    }

    /**
     * A screen channel this node opened while sharing went away.
     */
    default void onOutboundScreenLost(String peerId) {
    }

    default void onPeerRemoved(String peerId) {
    }
}
