package com.odin.peer_mesh_service.service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;

import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import com.odin.peer_mesh_service.component.AudioTrackReader;
import com.odin.peer_mesh_service.component.FrameCompositor;
import com.odin.peer_mesh_service.component.LocalSession;
import com.odin.peer_mesh_service.component.RecordingChunk;
import com.odin.peer_mesh_service.component.RecordingTranscoder;
import com.odin.peer_mesh_service.component.SessionChangeNotifier;
import com.odin.peer_mesh_service.component.SessionSnapshotHolder;
import com.odin.peer_mesh_service.config.PeerSessionProperties;
import com.odin.peer_mesh_service.dto.ParticipantSnapshot;
import com.odin.peer_mesh_service.dto.SessionSnapshot;
import com.odin.peer_mesh_service.dto.signal.RecordingStatusMessage;
import com.odin.peer_mesh_service.enums.FailureReason;
import com.odin.peer_mesh_service.exception.RecordingException;
import com.odin.peer_mesh_service.transport.MediaStream;
import com.odin.peer_mesh_service.utility.ControlLoop;

import lombok.extern.slf4j.Slf4j;

/**
 * Records the call into a single file. Frames and audio are produced on a
 * dedicated render thread from the published snapshot only and spooled to a
 * work directory under the output directory. Each closed chunk is encoded by
 * ffmpeg on an encode thread; stopping joins the segments into one file and
 * deletes the work directory.
 */
@Slf4j
@Service
public class RecordingService {

    private static final String LOCAL_SOURCE = "local";
    private static final String SCREEN_SOURCE_SUFFIX = "-screen";

    private final LocalSession session;
    private final ParticipantStoreService participants;
    private final SessionSnapshotHolder snapshots;
    private final FrameCompositor compositor;
    private final AudioTrackReader audio;
    private final RecordingTranscoder transcoder;
    private final SignalMessageRouter router;
    private final SessionChangeNotifier notifier;
    private final ControlLoop loop;
    private final PeerSessionProperties.Recording settings;

    private volatile ActiveRecording active;

    public RecordingService(LocalSession session,
                            ParticipantStoreService participants,
                            SessionSnapshotHolder snapshots,
                            FrameCompositor compositor,
                            AudioTrackReader audio,
                            RecordingTranscoder transcoder,
                            SignalMessageRouter router,
                            SessionChangeNotifier notifier,
                            ControlLoop loop,
                            PeerSessionProperties properties) {
        this.session = session;
        this.participants = participants;
        this.snapshots = snapshots;
        this.compositor = compositor;
        this.audio = audio;
        this.transcoder = transcoder;
        this.router = router;
        this.notifier = notifier;
        this.loop = loop;
        this.settings = properties.getRecording();
    }

    public boolean isRecording() {
        return active != null;
    }

    public void startRecording() throws RecordingException {
        if (!session.isCreator()) {
            throw new RecordingException(FailureReason.NOT_ALLOWED, "Only the room creator can record");
        }
        if (active != null) {
            throw new RecordingException(FailureReason.NOT_ALLOWED, "A recording is already in progress");
        }
        if (participants.size() == 0) {
            throw new RecordingException(FailureReason.NO_PARTICIPANTS, "Nobody else is in the room");
        }
        if (session.getLocalStream() == null) {
            throw new RecordingException(FailureReason.NO_STREAMS, "No local stream to record");
        }

        long startedAt = loop.now();
        Path workDir = Paths.get(settings.getOutputDir(), ".recording-" + session.getRoomId() + "-" + startedAt);
        try {
            Files.createDirectories(workDir);
        } catch (IOException e) {
            throw new RecordingException(FailureReason.IO_ERROR, "Could not create " + workDir, e);
        }
        ActiveRecording recording = new ActiveRecording(startedAt, workDir);
        active = recording;

        long framePeriodMs = Math.max(1, 1000L / Math.max(1, settings.getFrameRate()));
        recording.renderer.scheduleAtFixedRate(this::captureFrame, framePeriodMs, framePeriodMs, TimeUnit.MILLISECONDS);
        log.info("[RECORDING] Started at {} ({}x{} @ {} fps)", startedAt,
                settings.getWidth(), settings.getHeight(), settings.getFrameRate());
        router.sendToAll(new RecordingStatusMessage(true, session.getUsername()));
        notifier.changed();
    }

    /**
     * Renders one frame and its share of every source's audio into the
     * current chunk. Runs on the render thread.
     */
    public void captureFrame() {
        ActiveRecording recording = active;
        if (recording == null) {
            return;
        }
        SessionSnapshot snapshot = snapshots.get();
        long now = loop.now();
        long elapsed = now - recording.startedAt;
        try {
            BufferedImage frame = compositor.render(snapshot, elapsed);
            recording.append(frame, audioSources(snapshot, samplesPerFrame()), now);
        } catch (IOException | RuntimeException e) {
            log.error("[RECORDING] Frame at {} ms failed: {}", elapsed, e.getMessage(), e);
        }
    }

    /**
     * Stops rendering, waits for the pending chunks and joins them into one
     * file in the output directory.
     *
     * @return the written file
     * @throws RecordingException when nothing is recording, the output is too
     *                            small to be a usable recording or cannot be written
     */
    public Path stopRecording() throws RecordingException {
        ActiveRecording recording = active;
        if (recording == null) {
            throw new RecordingException(FailureReason.NOT_ALLOWED, "No recording in progress");
        }
        active = null;
        recording.halt();
        router.sendToAll(new RecordingStatusMessage(false, session.getUsername()));
        notifier.changed();

        try {
            List<Path> segments = recording.encodedSegments();
            long size = 0;
            for (Path segment : segments) {
                size += Files.size(segment);
            }
            log.info("[RECORDING] Stopped after {} ms, {} segments, {} bytes",
                    loop.now() - recording.startedAt, segments.size(), size);
            if (size < settings.getMinBytes()) {
                throw new RecordingException(FailureReason.EMPTY_OUTPUT,
                        "Recording produced only " + size + " bytes");
            }
            Path target = Paths.get(settings.getOutputDir(),
                    "recording-" + session.getRoomId() + "-" + recording.startedAt + "." + settings.getContainer());
            transcoder.concat(segments, recording.workDir.resolve("segments.txt"), target);
            log.info("[RECORDING] Saved {}", target.toAbsolutePath());
            return target;
        } catch (IOException e) {
            throw new RecordingException(FailureReason.IO_ERROR, "Could not write recording: " + e.getMessage(), e);
        } finally {
            recording.deleteWorkDir();
        }
    }

    /**
     * Drops a running recording without writing it, used when leaving.
     */
    public void discard() {
        ActiveRecording recording = active;
        if (recording == null) {
            return;
        }
        active = null;
        recording.halt();
        recording.deleteWorkDir();
        log.info("[RECORDING] Discarded");
        notifier.changed();
    }

    @PreDestroy
    public void shutdown() {
        discard();
    }

    private int samplesPerFrame() {
        return settings.getSampleRate() / Math.max(1, settings.getFrameRate());
    }

    private Map<String, byte[]> audioSources(SessionSnapshot snapshot, int sampleCount) {
        Map<String, byte[]> sources = new LinkedHashMap<>();
        sources.put(LOCAL_SOURCE, pcm(snapshot.getLocalStream(), sampleCount));
        for (ParticipantSnapshot participant : snapshot.getParticipants()) {
            if (participant.getCameraStream() != null) {
                sources.put(participant.getId(), pcm(participant.getCameraStream(), sampleCount));
            }
            MediaStream shown = participant.getStream();
            if (shown != null && shown != participant.getCameraStream()) {
                sources.put(participant.getId() + SCREEN_SOURCE_SUFFIX, pcm(shown, sampleCount));
            }
        }
        return sources;
    }

    private byte[] pcm(MediaStream stream, int sampleCount) {
        return audio.toPcm16(audio.read(stream, sampleCount, settings.getSampleRate()));
    }

    private final class ActiveRecording {

        private final long startedAt;
        private final Path workDir;
        private final ScheduledExecutorService renderer;
        private final ExecutorService encoder;
        private final List<Path> segments = new ArrayList<>();
        private RecordingChunk current;
        private long lastFlushAt;

        private ActiveRecording(long startedAt, Path workDir) {
            this.startedAt = startedAt;
            this.workDir = workDir;
            this.lastFlushAt = startedAt;
            this.renderer = Executors.newSingleThreadScheduledExecutor(daemon("recording-render"));
            this.encoder = Executors.newSingleThreadExecutor(daemon("recording-encode"));
        }

        private synchronized void append(BufferedImage frame, Map<String, byte[]> pcm, long now) throws IOException {
            if (current == null) {
                current = new RecordingChunk(workDir.resolve(String.format("chunk-%05d", segments.size() + 1)),
                        samplesPerFrame(), settings.getSampleRate());
            }
            current.addFrame(frame, pcm);
            if (now - lastFlushAt >= settings.getChunkIntervalMs()) {
                closeChunk();
                lastFlushAt = now;
            }
        }

        private synchronized void closeChunk() {
            RecordingChunk chunk = current;
            current = null;
            if (chunk == null || chunk.getFrames() == 0) {
                return;
            }
            Path segment = workDir.resolve(String.format("segment-%05d.%s", segments.size() + 1, settings.getContainer()));
            segments.add(segment);
            encoder.execute(() -> encode(chunk, segment));
        }

        private void encode(RecordingChunk chunk, Path segment) {
            try {
                chunk.finish();
                transcoder.encodeChunk(chunk, segment);
                chunk.delete();
                log.debug("[RECORDING] Encoded {} frames into {}", chunk.getFrames(), segment.getFileName());
            } catch (IOException | RuntimeException e) {
                log.error("[RECORDING] Encoding {} failed: {}", chunk.getDir().getFileName(), e.getMessage(), e);
            }
        }

        private synchronized List<Path> encodedSegments() {
            List<Path> encoded = new ArrayList<>();
            for (Path segment : segments) {
                if (Files.exists(segment)) {
                    encoded.add(segment);
                }
            }
            return encoded;
        }

        /**
         * Stops rendering, closes the last chunk and waits for every chunk to
         * be encoded.
         */
        private void halt() {
            renderer.shutdownNow();
            try {
                if (!renderer.awaitTermination(2, TimeUnit.SECONDS)) {
                    log.warn("[RECORDING] Render thread did not stop in time");
                }
                closeChunk();
                encoder.shutdown();
                if (!encoder.awaitTermination(settings.getEncodeTimeoutMs(), TimeUnit.MILLISECONDS)) {
                    log.warn("[RECORDING] Encoding did not finish within {} ms", settings.getEncodeTimeoutMs());
                    encoder.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                encoder.shutdownNow();
                log.warn("[RECORDING] Interrupted while stopping the recording threads");
            }
        }

        private void deleteWorkDir() {
            try {
                FileSystemUtils.deleteRecursively(workDir);
            } catch (IOException e) {
                log.warn("[RECORDING] Could not delete {}: {}", workDir, e.getMessage());
            }
        }
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }
}
