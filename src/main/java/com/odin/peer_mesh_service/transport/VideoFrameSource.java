package com.odin.peer_mesh_service.transport;

import java.awt.image.BufferedImage;

/**
 * Supplies the most recent decoded frame of a video track. Called from the
 * recording render thread, implementations must be thread-safe.
 */
@FunctionalInterface
public interface VideoFrameSource {

    BufferedImage currentFrame();
}
