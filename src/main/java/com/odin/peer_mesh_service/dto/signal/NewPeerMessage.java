package com.odin.peer_mesh_service.dto.signal;

import com.odin.peer_mesh_service.constants.ApplicationConstants;
import com.odin.peer_mesh_service.service.handler.SignalHandler;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class NewPeerMessage extends SignalMessage {

    private String peerId;

    @Override
    public String getType() {
        return ApplicationConstants.MESSAGE_TYPE_NEW_PEER;
    }

    @Override
    public void accept(SignalHandler handler, String fromPeerId) {
        handler.onNewPeer(fromPeerId, this);
    }
}
