package com.odin.peer_mesh_service.component;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.imageio.ImageIO;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;

import org.springframework.util.FileSystemUtils;

/**
 * One chunk of a recording spooled to its own directory: numbered JPEG
 * frames, and once finished one WAV file per audio source. Not thread-safe.
 */
public class RecordingChunk {

    private static final String FRAME_PATTERN = "frame-%05d.jpg";

    private final Path dir;
    private final int samplesPerFrame;
    private final int sampleRate;
    private final Map<String, ByteArrayOutputStream> audio = new LinkedHashMap<>();
    private final List<Path> audioFiles = new ArrayList<>();
    private int frames;

    public RecordingChunk(Path dir, int samplesPerFrame, int sampleRate) throws IOException {
        this.dir = Files.createDirectories(dir);
        this.samplesPerFrame = samplesPerFrame;
        this.sampleRate = sampleRate;
    }

    /**
     * Adds a frame and the audio each source produced during it. A source
     * first heard mid-chunk is padded with silence so all sources stay aligned.
     */
    public void addFrame(BufferedImage image, Map<String, byte[]> pcmBySource) throws IOException {
        Path file = dir.resolve(String.format(FRAME_PATTERN, frames + 1));
        if (!ImageIO.write(image, "jpg", file.toFile())) {
            throw new IOException("No JPEG writer for " + file);
        }
        long expected = (long) frames * samplesPerFrame * 2;
        for (Map.Entry<String, byte[]> entry : pcmBySource.entrySet()) {
            ByteArrayOutputStream track = audio.computeIfAbsent(entry.getKey(), k -> new ByteArrayOutputStream());
            int missing = (int) (expected - track.size());
            if (missing > 0) {
                track.write(new byte[missing], 0, missing);
            }
            track.writeBytes(entry.getValue());
        }
        frames++;
    }

    /**
     * Writes the spooled audio as WAV files and returns them.
     */
    public List<Path> finish() throws IOException {
        AudioFormat format = new AudioFormat(sampleRate, 16, 1, true, false);
        for (ByteArrayOutputStream track : audio.values()) {
            byte[] pcm = track.toByteArray();
            Path file = dir.resolve(String.format("audio-%02d.wav", audioFiles.size()));
            try (AudioInputStream in = new AudioInputStream(new ByteArrayInputStream(pcm), format, pcm.length / 2)) {
                AudioSystem.write(in, AudioFileFormat.Type.WAVE, file.toFile());
            }
            audioFiles.add(file);
        }
        audio.clear();
        return getAudioFiles();
    }

    public void delete() throws IOException {
        FileSystemUtils.deleteRecursively(dir);
    }

    /**
     * printf-style pattern of the frame files, as ffmpeg's image reader expects.
     */
    public Path getFramePattern() {
        return dir.resolve(FRAME_PATTERN);
    }

    public Path getDir() {
        return dir;
    }

    public int getFrames() {
        return frames;
    }

    public List<Path> getAudioFiles() {
        return List.copyOf(audioFiles);
    }
}
