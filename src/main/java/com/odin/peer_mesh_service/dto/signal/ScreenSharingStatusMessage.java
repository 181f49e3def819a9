package com.odin.peer_mesh_service.dto.signal;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.odin.peer_mesh_service.constants.ApplicationConstants;
import com.odin.peer_mesh_service.enums.StreamType;
import com.odin.peer_mesh_service.service.handler.SignalHandler;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class ScreenSharingStatusMessage extends SignalMessage {

    private String peerId;
    @JsonProperty("isSharing")
    private Boolean sharing;
    private StreamType streamType;

    @Override
    public String getType() {
        return ApplicationConstants.MESSAGE_TYPE_SCREEN_SHARING_STATUS;
    }

    @Override
    public void accept(SignalHandler handler, String fromPeerId) {
        handler.onScreenSharingStatus(fromPeerId, this);
    }
}
