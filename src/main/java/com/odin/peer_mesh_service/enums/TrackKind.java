package com.odin.peer_mesh_service.enums;

public enum TrackKind {
    AUDIO,
    VIDEO
}
