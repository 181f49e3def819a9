package com.odin.peer_mesh_service.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.odin.peer_mesh_service.utility.PeerIds;

/**
 * Process-wide connection policy. In {@link #MESH} every participant holds a
 * direct connection to every other one; in {@link #STAR} non-creator nodes
 * only connect to the room creator.
 */
public enum Topology {

    MESH("mesh"),
    STAR("star");

    private final String value;

    Topology(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Topology fromValue(String value) {
        for (Topology topology : values()) {
            if (topology.value.equalsIgnoreCase(value)) {
                return topology;
            }
        }
        throw new IllegalArgumentException("Unknown topology: " + value);
    }

    /**
     * Whether a node may hold a direct connection to {@code peerId} under
     * this policy.
     */
    public boolean allowsDirectConnection(boolean selfIsCreator, String peerId) {
        return this == MESH || selfIsCreator || PeerIds.isCreatorId(peerId);
    }
}
