package com.odin.peer_mesh_service.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.odin.peer_mesh_service.enums.Topology;
import com.odin.peer_mesh_service.transport.MediaStream;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable view of the whole session, published after every state change.
 * The UI and the recorder read only this.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionSnapshot {

    String selfId;
    String roomId;
    String username;
    boolean creator;
    boolean joined;
    Topology topology;
    boolean audioEnabled;
    boolean videoEnabled;
    boolean audioOnly;
    boolean screenSharing;
    boolean canStartScreenShare;
    boolean recording;
    boolean remoteRecording;
    boolean transitionsEnabled;
    List<ParticipantSnapshot> participants;
    SessionError error;

    @JsonIgnore
    MediaStream localStream;
    @JsonIgnore
    MediaStream screenStream;

    public static SessionSnapshot empty() {
        return SessionSnapshot.builder()
                .topology(Topology.MESH)
                .audioEnabled(true)
                .videoEnabled(true)
                .canStartScreenShare(false)
                .transitionsEnabled(true)
                .participants(List.of())
                .build();
    }
}
