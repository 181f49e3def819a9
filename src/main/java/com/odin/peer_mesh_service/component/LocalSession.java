package com.odin.peer_mesh_service.component;

import org.springframework.stereotype.Component;

import com.odin.peer_mesh_service.constants.ApplicationConstants;
import com.odin.peer_mesh_service.enums.Topology;
import com.odin.peer_mesh_service.transport.MediaStream;
import com.odin.peer_mesh_service.transport.SessionHandle;
import com.odin.peer_mesh_service.utility.PeerIds;

import lombok.Getter;
import lombok.Setter;

/**
 * State of the local participant. Written on the control loop, fields are
 * volatile so request threads can read them.
 */
@Getter
@Setter
@Component
public class LocalSession {

    private volatile String selfId;
    private volatile String roomId;
    private volatile boolean creator;
    private volatile String username = ApplicationConstants.DEFAULT_USERNAME;
    private volatile Topology topology = Topology.MESH;
    private volatile MediaStream localStream;
    private volatile MediaStream screenStream;
    private volatile SessionHandle sessionHandle;
    private volatile boolean joined;
    private volatile boolean open;
    private volatile boolean audioOnly;
    private volatile boolean transitionsEnabled = true;
    private volatile boolean remoteRecording;

    public String getCreatorId() {
        return roomId == null ? null : PeerIds.creatorId(roomId);
    }

    public boolean isSelf(String peerId) {
        return peerId != null && peerId.equals(selfId);
    }

    public boolean isScreenSharing() {
        MediaStream screen = screenStream;
        return screen != null && screen.isActive();
    }

    public boolean isAudioEnabled() {
        MediaStream stream = localStream;
        return stream != null && stream.getAudioTracks().stream().anyMatch(t -> t.isEnabled());
    }

    public boolean isVideoEnabled() {
        MediaStream stream = localStream;
        return stream != null && stream.getVideoTracks().stream().anyMatch(t -> t.isEnabled());
    }

    public void reset() {
        selfId = null;
        roomId = null;
        creator = false;
        topology = Topology.MESH;
        localStream = null;
        screenStream = null;
        sessionHandle = null;
        joined = false;
        open = false;
        audioOnly = false;
        remoteRecording = false;
    }
}
