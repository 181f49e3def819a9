package com.odin.peer_mesh_service.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.odin.peer_mesh_service.enums.StreamType;
import com.odin.peer_mesh_service.enums.TransitionState;
import com.odin.peer_mesh_service.transport.MediaStream;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParticipantSnapshot {

    String id;
    String username;
    boolean creator;
    StreamType streamType;
    boolean screenSharing;
    TransitionState transition;
    boolean hasStream;
    boolean streamActive;

    @JsonIgnore
    MediaStream stream;

    @JsonIgnore
    MediaStream cameraStream;
}
