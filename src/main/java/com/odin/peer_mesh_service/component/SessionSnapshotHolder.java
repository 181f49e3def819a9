package com.odin.peer_mesh_service.component;

import org.springframework.stereotype.Component;

import com.odin.peer_mesh_service.dto.SessionSnapshot;

/**
 * Last published snapshot. Written by the control loop, read from any thread.
 */
@Component
public class SessionSnapshotHolder {

    private volatile SessionSnapshot current = SessionSnapshot.empty();

    public SessionSnapshot get() {
        return current;
    }

    public void set(SessionSnapshot snapshot) {
        this.current = snapshot;
    }
}
