package com.odin.peer_mesh_service.dto.signal;

import java.util.List;

import com.odin.peer_mesh_service.constants.ApplicationConstants;
import com.odin.peer_mesh_service.service.handler.SignalHandler;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Authoritative member list, sent only by the creator.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class PeerListMessage extends SignalMessage {

    private List<String> peers;

    @Override
    public String getType() {
        return ApplicationConstants.MESSAGE_TYPE_PEER_LIST;
    }

    @Override
    public void accept(SignalHandler handler, String fromPeerId) {
        handler.onPeerList(fromPeerId, this);
    }
}
