package com.odin.peer_mesh_service.support;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.odin.peer_mesh_service.component.SessionEventSink;
import com.odin.peer_mesh_service.dto.SessionError;
import com.odin.peer_mesh_service.dto.SessionSnapshot;

/**
 * Keeps every event a node publishes.
 */
public class RecordingEventSink implements SessionEventSink {

    public final List<SessionSnapshot> snapshots = new ArrayList<>();
    public final List<JsonNode> data = new ArrayList<>();
    public final List<String> dataSenders = new ArrayList<>();
    public final List<SessionError> errors = new ArrayList<>();

    @Override
    public void snapshotPublished(SessionSnapshot snapshot) {
        snapshots.add(snapshot);
    }

    @Override
    public void dataReceived(String fromPeerId, JsonNode message) {
        dataSenders.add(fromPeerId);
        data.add(message);
    }

    @Override
    public void errorRaised(SessionError error) {
        errors.add(error);
    }

    public SessionSnapshot lastSnapshot() {
        return snapshots.isEmpty() ? null : snapshots.get(snapshots.size() - 1);
    }
}
