package com.odin.peer_mesh_service.component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.springframework.stereotype.Component;

import com.odin.peer_mesh_service.config.PeerSessionProperties;

import lombok.extern.slf4j.Slf4j;
import net.bramp.ffmpeg.builder.FFmpegBuilder;

/**
 * Runs ffmpeg for the recorder: each chunk is encoded into a segment with
 * its audio sources mixed by {@code amix}, and the segments are joined into
 * the final file without re-encoding.
 */
@Slf4j
@Component
public class RecordingTranscoder {

    private final FFmpegProvider ffmpeg;
    private final PeerSessionProperties.Recording settings;

    public RecordingTranscoder(FFmpegProvider ffmpeg, PeerSessionProperties properties) {
        this.ffmpeg = ffmpeg;
        this.settings = properties.getRecording();
    }

    public void encodeChunk(RecordingChunk chunk, Path segment) throws IOException {
        run(chunkCommand(chunk, segment));
    }

    /**
     * Joins the segments in order into {@code target}. The segment list is
     * written to {@code listFile} for ffmpeg's concat reader.
     */
    public void concat(List<Path> segments, Path listFile, Path target) throws IOException {
        String list = segments.stream()
                .map(segment -> "file '" + segment.toAbsolutePath().toString().replace("'", "'\\''") + "'")
                .collect(Collectors.joining("\n", "", "\n"));
        Files.write(listFile, list.getBytes(StandardCharsets.UTF_8));
        run(concatCommand(listFile, target));
    }

    public FFmpegBuilder chunkCommand(RecordingChunk chunk, Path segment) {
        List<Path> audioFiles = chunk.getAudioFiles();
        if (audioFiles.isEmpty()) {
            throw new IllegalArgumentException("Chunk " + chunk.getDir() + " has no audio");
        }
        FFmpegBuilder builder = new FFmpegBuilder()
                .overrideOutputFiles(true)
                .addExtraArgs("-framerate", String.valueOf(settings.getFrameRate()))
                .setInput(chunk.getFramePattern().toString());
        audioFiles.forEach(file -> builder.addInput(file.toString()));

        String inputs = IntStream.rangeClosed(1, audioFiles.size())
                .mapToObj(i -> "[" + i + ":a]")
                .collect(Collectors.joining());
        builder.setComplexFilter(String.format("%samix=inputs=%d:duration=longest[mix]", inputs, audioFiles.size()));

        return builder.addOutput(segment.toString())
                .setFormat(settings.getContainer())
                .setVideoCodec(settings.getVideoCodec())
                .setVideoPixelFormat("yuv420p")
                .setAudioCodec(settings.getAudioCodec())
                .setAudioSampleRate(settings.getSampleRate())
                .setAudioChannels(1)
                .addExtraArgs("-map", "0:v", "-map", "[mix]")
                .done();
    }

    public FFmpegBuilder concatCommand(Path listFile, Path target) {
        return new FFmpegBuilder()
                .overrideOutputFiles(true)
                .setFormat("concat")
                .addExtraArgs("-safe", "0")
                .setInput(listFile.toString())
                .addOutput(target.toString())
                .setFormat(settings.getContainer())
                .setVideoCodec("copy")
                .setAudioCodec("copy")
                .done();
    }

    private void run(FFmpegBuilder builder) throws IOException {
        log.debug("[RECORDING] ffmpeg {}", builder.build());
        try {
            ffmpeg.getExecutor().createJob(builder).run();
        } catch (RuntimeException e) {
            throw new IOException("ffmpeg failed: " + e.getMessage(), e);
        }
    }
}
