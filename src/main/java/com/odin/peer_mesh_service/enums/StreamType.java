package com.odin.peer_mesh_service.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of content a media channel carries. Also names the two media channel
 * slots a connection has: the primary camera channel and the screen overlay.
 */
public enum StreamType {

    CAMERA("camera"),
    SCREEN("screen");

    private final String value;

    StreamType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static StreamType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (StreamType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown stream type: " + value);
    }
}
