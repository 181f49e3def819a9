package com.odin.peer_mesh_service.enums;

public enum FailureReason {
    HOST_NOT_FOUND,
    CONNECTION_FAILED,
    PERMISSION_DENIED,
    DEVICE_NOT_FOUND,
    RETRIES_EXHAUSTED,
    NOT_ALLOWED,
    NO_PARTICIPANTS,
    NO_STREAMS,
    EMPTY_OUTPUT,
    IO_ERROR
}
