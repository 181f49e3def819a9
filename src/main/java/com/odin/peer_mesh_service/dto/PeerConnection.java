package com.odin.peer_mesh_service.dto;

import com.odin.peer_mesh_service.transport.ControlChannel;
import com.odin.peer_mesh_service.transport.MediaChannel;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Registry record for one remote peer. Each channel slot carries the
 * generation it was installed with so that late events of a replaced channel
 * can be told apart from events of the current one.
 */
@Getter
@Setter
@ToString
public class PeerConnection {

    private final String peerId;

    @ToString.Exclude
    private ControlChannel controlChannel;
    private long controlGeneration;

    @ToString.Exclude
    private MediaChannel mediaChannel;
    private long mediaGeneration;

    @ToString.Exclude
    private MediaChannel screenMediaChannel;
    private long screenGeneration;

    private long lastSeenAt;

    // Set by screen-sharing-stream: the next inbound call from this peer carries a screen
    private boolean expectScreen;

    public PeerConnection(String peerId) {
        this.peerId = peerId;
    }

    public boolean hasOpenControl() {
        return controlChannel != null && controlChannel.isOpen();
    }

    public boolean hasOpenMedia() {
        return mediaChannel != null && mediaChannel.isOpen();
    }

    public boolean isEmpty() {
        return controlChannel == null && mediaChannel == null && screenMediaChannel == null;
    }
}
