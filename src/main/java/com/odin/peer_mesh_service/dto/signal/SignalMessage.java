package com.odin.peer_mesh_service.dto.signal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.odin.peer_mesh_service.service.handler.SignalHandler;

import lombok.Getter;
import lombok.Setter;

/**
 * Envelope of every control-channel message. Subclasses are the closed set
 * of message types; {@link #accept} routes a decoded message to the matching
 * {@link SignalHandler} method.
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class SignalMessage {

    private Long timestamp;

    @JsonProperty(value = "type", access = JsonProperty.Access.READ_ONLY)
    public abstract String getType();

    public abstract void accept(SignalHandler handler, String fromPeerId);
}
