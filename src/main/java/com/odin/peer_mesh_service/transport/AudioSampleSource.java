package com.odin.peer_mesh_service.transport;

/**
 * Pulls mono PCM samples in the range [-1, 1] from an audio track.
 */
@FunctionalInterface
public interface AudioSampleSource {

    float[] read(int sampleCount, int sampleRate);
}
