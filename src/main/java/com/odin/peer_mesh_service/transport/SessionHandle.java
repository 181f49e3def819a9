package com.odin.peer_mesh_service.transport;

public interface SessionHandle {

    String getPeerId();

    boolean isOpen();

    void destroy();
}
