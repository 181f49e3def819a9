package com.odin.peer_mesh_service.enums;

import com.fasterxml.jackson.annotation.JsonValue;

// UI animation hint only
public enum TransitionState {

    CONNECTING("connecting"),
    CONNECTED("connected"),
    DISCONNECTING("disconnecting"),
    RECONNECTING("reconnecting");

    private final String value;

    TransitionState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
