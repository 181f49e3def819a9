package com.odin.peer_mesh_service.dto;

import com.odin.peer_mesh_service.constants.ApplicationConstants;
import com.odin.peer_mesh_service.enums.StreamType;
import com.odin.peer_mesh_service.enums.TransitionState;
import com.odin.peer_mesh_service.transport.MediaStream;
import com.odin.peer_mesh_service.utility.PeerIds;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Mutable participant entity. Owned by the participant store and only
 * modified on the control loop. Streams are references to transport-owned
 * objects.
 */
@Getter
@Setter
@ToString
public class Participant {

    private final String id;
    private final boolean creator;
    private String username = ApplicationConstants.DEFAULT_USERNAME;
    @ToString.Exclude
    private MediaStream cameraStream;
    @ToString.Exclude
    private MediaStream screenStream;
    private StreamType streamType = StreamType.CAMERA;
    private boolean screenSharing;
    private TransitionState transition;

    public Participant(String id) {
        this.id = id;
        this.creator = PeerIds.isCreatorId(id);
    }

    /**
     * The stream a viewer should render: the screen while this participant
     * shares and its screen has arrived, the camera otherwise.
     */
    public MediaStream getStream() {
        if (screenSharing && screenStream != null) {
            return screenStream;
        }
        return cameraStream;
    }

    public ParticipantSnapshot toSnapshot() {
        MediaStream stream = getStream();
        return ParticipantSnapshot.builder()
                .id(id)
                .username(username)
                .creator(creator)
                .streamType(streamType)
                .screenSharing(screenSharing)
                .transition(transition)
                .hasStream(stream != null)
                .streamActive(stream != null && stream.isActive())
                .stream(stream)
                .cameraStream(cameraStream)
                .build();
    }
}
