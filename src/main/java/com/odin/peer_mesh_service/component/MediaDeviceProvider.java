package com.odin.peer_mesh_service.component;

import java.util.concurrent.CompletableFuture;

import com.odin.peer_mesh_service.exception.MediaAccessException;
import com.odin.peer_mesh_service.transport.MediaStream;

/**
 * Access to local capture devices.
 */
public interface MediaDeviceProvider {

    MediaStream openUserMedia(boolean video, boolean audio) throws MediaAccessException;

    /**
     * Asks the user to pick a display surface. Completes exceptionally with a
     * {@link MediaAccessException} when the user declines.
     */
    CompletableFuture<MediaStream> openDisplayMedia();
}
