package com.odin.peer_mesh_service.enums;

/**
 * Second half of the key of a scheduled task; the first half is the peer id.
 */
public enum TaskPurpose {
    JOIN_RETRY,
    ESTABLISH,
    CONNECT_TIMEOUT,
    RECONNECT,
    TRANSITION,
    REMOVAL,
    CAMERA_RESTORE_RETRY,
    STREAM_UPDATE,
    FULL_RECONNECT,
    SCREEN_CHANNEL,
    SCREEN_REFRESH,
    SCREEN_SHARE_BEGIN,
    SCREEN_RETRY,
    SCREEN_CONNECT,
    LATE_JOINER_SCREEN,
    CAMERA_REPAIR,
    CAMERA_RESTORE,
    RECONNECT_AFTER_SCREEN_SHARE
}
