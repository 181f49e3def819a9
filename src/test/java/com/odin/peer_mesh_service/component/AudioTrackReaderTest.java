package com.odin.peer_mesh_service.component;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.odin.peer_mesh_service.transport.MediaStream;
import com.odin.peer_mesh_service.transport.MediaTrack;

class AudioTrackReaderTest {

    private final AudioTrackReader reader = new AudioTrackReader();

    @Test
    void readsFirstLiveTrack() {
        MediaTrack muted = track("muted", 0.5f);
        muted.setEnabled(false);
        MediaTrack ended = track("ended", 0.75f);
        ended.stop();
        MediaStream stream = new MediaStream("camera", List.of(muted, ended, track("live", -0.25f)));

        assertThat(reader.read(stream, 3, 48000)).containsExactly(-0.25f, -0.25f, -0.25f);
    }

    @Test
    void missingAudioIsSilence() {
        MediaTrack muted = track("muted", 0.5f);
        muted.setEnabled(false);

        assertThat(reader.read(null, 2, 48000)).containsExactly(0f, 0f);
        assertThat(reader.read(new MediaStream("muted", List.of(muted)), 2, 48000)).containsExactly(0f, 0f);
    }

    @Test
    void pcmIsClippedLittleEndian() {
        byte[] pcm = reader.toPcm16(new float[] {1.5f, -1.0f, 0.0f});

        assertThat(pcm).containsExactly(
                (byte) 0xFF, (byte) 0x7F,
                (byte) 0x01, (byte) 0x80,
                0, 0);
    }

    private static MediaTrack track(String id, float level) {
        return MediaTrack.audio(id + "-audio", (count, rate) -> {
            float[] samples = new float[count];
            Arrays.fill(samples, level);
            return samples;
        });
    }
}
