package com.odin.peer_mesh_service.utility;

import com.odin.peer_mesh_service.constants.ApplicationConstants;

/**
 * Peer id conventions: the room creator registers as {@code <room>-creator},
 * everyone else as {@code <room>-<epochMillis>}.
 */
public final class PeerIds {

    private PeerIds() {
    }

    public static String creatorId(String roomId) {
        return roomId + ApplicationConstants.CREATOR_SUFFIX;
    }

    public static String joinerId(String roomId, long epochMillis) {
        return roomId + "-" + epochMillis;
    }

    public static boolean isCreatorId(String peerId) {
        return peerId != null && peerId.endsWith(ApplicationConstants.CREATOR_SUFFIX);
    }
}
