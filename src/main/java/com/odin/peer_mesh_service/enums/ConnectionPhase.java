package com.odin.peer_mesh_service.enums;

/**
 * Per-peer state of the reconnection engine:
 * IDLE -> CONNECTING -> CONNECTED, with RECONNECTING re-entered from CONNECTED.
 */
public enum ConnectionPhase {
    IDLE,
    CONNECTING,
    CONNECTED,
    RECONNECTING
}
