package com.odin.peer_mesh_service.exception;

import com.odin.peer_mesh_service.enums.FailureReason;

import lombok.Getter;

/**
 * Thrown when a capture device cannot be opened.
 */
@Getter
public class MediaAccessException extends Exception {

    private final FailureReason reason;

    public MediaAccessException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
