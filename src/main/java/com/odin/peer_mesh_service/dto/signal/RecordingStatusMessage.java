package com.odin.peer_mesh_service.dto.signal;

import com.fasterxml.jackson.annotation.JsonProperty;
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
public class RecordingStatusMessage extends SignalMessage {

    @JsonProperty("isRecording")
    private Boolean recording;
    private String host;

    @Override
    public String getType() {
        return ApplicationConstants.MESSAGE_TYPE_RECORDING_STATUS;
    }

    @Override
    public void accept(SignalHandler handler, String fromPeerId) {
        handler.onRecordingStatus(fromPeerId, this);
    }
}
