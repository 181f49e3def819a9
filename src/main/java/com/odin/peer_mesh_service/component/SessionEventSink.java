package com.odin.peer_mesh_service.component;

import com.fasterxml.jackson.databind.JsonNode;
import com.odin.peer_mesh_service.dto.SessionError;
import com.odin.peer_mesh_service.dto.SessionSnapshot;

/**
 * Receiver of everything the orchestrator reports to the application layer.
 */
public interface SessionEventSink {

    void snapshotPublished(SessionSnapshot snapshot);

    /**
     * A control message the orchestrator does not consume itself.
     */
    void dataReceived(String fromPeerId, JsonNode message);

    void errorRaised(SessionError error);
}
