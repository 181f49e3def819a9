package com.odin.peer_mesh_service.exception;

import com.odin.peer_mesh_service.enums.FailureReason;

import lombok.Getter;

@Getter
public class RecordingException extends Exception {

    private final FailureReason reason;

    public RecordingException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RecordingException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
