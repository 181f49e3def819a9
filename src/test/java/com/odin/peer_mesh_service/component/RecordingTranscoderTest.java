package com.odin.peer_mesh_service.component;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.odin.peer_mesh_service.config.PeerSessionProperties;

class RecordingTranscoderTest {

    @TempDir
    Path workDir;

    private RecordingTranscoder transcoder;

    @BeforeEach
    void setUp() {
        transcoder = new RecordingTranscoder(mock(FFmpegProvider.class), new PeerSessionProperties());
    }

    @Test
    void chunkCommandMixesEverySource() throws Exception {
        RecordingChunk chunk = new RecordingChunk(workDir.resolve("chunk-00001"), 3200, 48000);
        Map<String, byte[]> pcm = new LinkedHashMap<>();
        pcm.put("local", new byte[6400]);
        pcm.put("peer-b", new byte[6400]);
        chunk.addFrame(new BufferedImage(32, 18, BufferedImage.TYPE_INT_RGB), pcm);
        chunk.finish();

        String command = String.join(" ", transcoder.chunkCommand(chunk, workDir.resolve("segment-00001.webm")).build());

        assertThat(command)
                .contains("-framerate 15")
                .contains("frame-%05d.jpg")
                .contains("audio-00.wav", "audio-01.wav")
                .contains("[1:a][2:a]amix=inputs=2:duration=longest[mix]")
                .contains("-map 0:v", "-map [mix]")
                .contains("libvpx", "libopus")
                .endsWith("segment-00001.webm");
        assertThat(command.indexOf("-framerate")).isLessThan(command.indexOf("-i "));
    }

    @Test
    void chunkWithoutAudioIsRejected() throws Exception {
        RecordingChunk chunk = new RecordingChunk(workDir.resolve("chunk-00001"), 3200, 48000);

        assertThatThrownBy(() -> transcoder.chunkCommand(chunk, workDir.resolve("segment-00001.webm")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concatCopiesStreams() {
        String command = String.join(" ",
                transcoder.concatCommand(workDir.resolve("segments.txt"), workDir.resolve("out.webm")).build());

        assertThat(command)
                .contains("-f concat")
                .contains("-safe 0")
                .contains("segments.txt")
                .endsWith("out.webm");
    }
}
