package com.odin.peer_mesh_service.component;

import org.springframework.stereotype.Component;

import com.odin.peer_mesh_service.transport.AudioSampleSource;
import com.odin.peer_mesh_service.transport.MediaStream;
import com.odin.peer_mesh_service.transport.MediaTrack;

/**
 * Pulls the audio of one stream for the recorder. Each stream becomes its
 * own input and ffmpeg mixes them.
 */
@Component
public class AudioTrackReader {

    /**
     * Samples of the first live, enabled audio track; silence when the
     * stream has none.
     */
    public float[] read(MediaStream stream, int sampleCount, int sampleRate) {
        float[] samples = new float[sampleCount];
        if (stream == null) {
            return samples;
        }
        for (MediaTrack track : stream.getAudioTracks()) {
            AudioSampleSource source = track.getSampleSource();
            if (source == null || !track.isLive() || !track.isEnabled()) {
                continue;
            }
            float[] read = source.read(sampleCount, sampleRate);
            System.arraycopy(read, 0, samples, 0, Math.min(read.length, sampleCount));
            break;
        }
        return samples;
    }

    /**
     * 16-bit signed little-endian PCM, clipped to [-1, 1].
     */
    public byte[] toPcm16(float[] samples) {
        byte[] pcm = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            float clipped = Math.max(-1.0f, Math.min(1.0f, samples[i]));
            short value = (short) (clipped * 32767);
            pcm[i * 2] = (byte) (value & 0xFF);
            pcm[i * 2 + 1] = (byte) ((value >> 8) & 0xFF);
        }
        return pcm;
    }
}
