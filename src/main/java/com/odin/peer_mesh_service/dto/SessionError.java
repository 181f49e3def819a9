package com.odin.peer_mesh_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.odin.peer_mesh_service.enums.FailureReason;
import com.odin.peer_mesh_service.enums.SessionErrorCode;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionError {

    SessionErrorCode code;
    FailureReason reason;
    String message;
    String peerId;
    long timestamp;
}
