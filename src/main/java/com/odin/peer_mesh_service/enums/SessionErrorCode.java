package com.odin.peer_mesh_service.enums;

/**
 * Codes placed in the caller-visible error slot.
 */
public enum SessionErrorCode {
    MEDIA_UNAVAILABLE,
    HOST_UNREACHABLE,
    ROOM_TAKEN,
    TRANSPORT_ERROR,
    PEER_UNREACHABLE,
    SCREEN_SHARE_FAILED,
    RECORDING_FAILED
}
