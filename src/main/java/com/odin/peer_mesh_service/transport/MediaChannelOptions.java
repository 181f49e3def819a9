package com.odin.peer_mesh_service.transport;

import com.odin.peer_mesh_service.constants.ApplicationConstants;
import com.odin.peer_mesh_service.enums.StreamType;

import lombok.Builder;
import lombok.Value;

import java.util.HashMap;
import java.util.Map;

@Value
@Builder
public class MediaChannelOptions {

    String username;
    StreamType streamType;

    public Map<String, String> toMetadata() {
        Map<String, String> metadata = new HashMap<>();
        if (username != null) {
            metadata.put(ApplicationConstants.METADATA_USERNAME, username);
        }
        if (streamType != null) {
            metadata.put(ApplicationConstants.METADATA_STREAM_TYPE, streamType.getValue());
        }
        return metadata;
    }
}
