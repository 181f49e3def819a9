package com.odin.peer_mesh_service.component;

import java.io.IOException;

import org.springframework.stereotype.Component;

import com.odin.peer_mesh_service.config.PeerSessionProperties;

import lombok.extern.slf4j.Slf4j;
import net.bramp.ffmpeg.FFmpeg;
import net.bramp.ffmpeg.FFmpegExecutor;

/**
 * Locates the ffmpeg binary the first time a recording needs it, so the
 * service starts on hosts without ffmpeg and only recording fails there.
 */
@Slf4j
@Component
public class FFmpegProvider {

    private final String ffmpegPath;

    private FFmpegExecutor executor;

    public FFmpegProvider(PeerSessionProperties properties) {
        this.ffmpegPath = properties.getRecording().getFfmpegPath();
    }

    public synchronized FFmpegExecutor getExecutor() throws IOException {
        if (executor == null) {
            FFmpeg ffmpeg = new FFmpeg(ffmpegPath);
            log.info("[RECORDING] Using {}", ffmpeg.version());
            executor = new FFmpegExecutor(ffmpeg);
        }
        return executor;
    }
}
