package com.odin.peer_mesh_service.dto.signal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.odin.peer_mesh_service.service.handler.SignalHandler;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A message of a type the orchestrator does not know. Kept as raw JSON and
 * handed to the application layer.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class ApplicationDataMessage extends SignalMessage {

    private final String type;

    @JsonIgnore
    private final JsonNode payload;

    public ApplicationDataMessage(String type, JsonNode payload) {
        this.type = type;
        this.payload = payload;
    }

    @Override
    public void accept(SignalHandler handler, String fromPeerId) {
        handler.onApplicationData(fromPeerId, this);
    }
}
