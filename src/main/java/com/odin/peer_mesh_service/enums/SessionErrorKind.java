package com.odin.peer_mesh_service.enums;

/**
 * Error kinds reported by the transport through {@code sessionError}.
 */
public enum SessionErrorKind {
    PEER_UNAVAILABLE,
    UNAVAILABLE_ID,
    NETWORK,
    SESSION_CLOSED
}
