package com.odin.peer_mesh_service.component;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.odin.peer_mesh_service.enums.FailureReason;
import com.odin.peer_mesh_service.exception.MediaAccessException;
import com.odin.peer_mesh_service.transport.AudioSampleSource;
import com.odin.peer_mesh_service.transport.MediaStream;
import com.odin.peer_mesh_service.transport.MediaTrack;

import lombok.extern.slf4j.Slf4j;

/**
 * Generates test-pattern video and a sine tone in place of real capture
 * devices. Device availability is switchable for degraded-mode runs.
 */
@Slf4j
@Component
public class SyntheticMediaDeviceProvider implements MediaDeviceProvider {

    private static final int FRAME_WIDTH = 320;
    private static final int FRAME_HEIGHT = 180;

    private final AtomicLong sequence = new AtomicLong();

    private volatile boolean cameraAvailable;
    private volatile boolean microphoneAvailable;
    private volatile boolean displayAvailable;

    public SyntheticMediaDeviceProvider(@Value("${peer.media.camera-available:true}") boolean cameraAvailable,
                                        @Value("${peer.media.microphone-available:true}") boolean microphoneAvailable,
                                        @Value("${peer.media.display-available:true}") boolean displayAvailable) {
        this.cameraAvailable = cameraAvailable;
        this.microphoneAvailable = microphoneAvailable;
        this.displayAvailable = displayAvailable;
    }

    public void setCameraAvailable(boolean cameraAvailable) {
        this.cameraAvailable = cameraAvailable;
    }

    public void setMicrophoneAvailable(boolean microphoneAvailable) {
        this.microphoneAvailable = microphoneAvailable;
    }

    public void setDisplayAvailable(boolean displayAvailable) {
        this.displayAvailable = displayAvailable;
    }

    @Override
    public MediaStream openUserMedia(boolean video, boolean audio) throws MediaAccessException {
        if (video && !cameraAvailable) {
            throw new MediaAccessException(FailureReason.DEVICE_NOT_FOUND, "Requested camera not found");
        }
        if (audio && !microphoneAvailable) {
            throw new MediaAccessException(FailureReason.DEVICE_NOT_FOUND, "Requested microphone not found");
        }
        long id = sequence.incrementAndGet();
        List<MediaTrack> tracks = new ArrayList<>();
        if (audio) {
            tracks.add(MediaTrack.audio("mic-" + id, toneSource(440.0)));
        }
        if (video) {
            BufferedImage frame = patternFrame(new Color(40, 90, 160), "CAM " + id);
            tracks.add(MediaTrack.video("cam-" + id, () -> frame));
        }
        log.info("Opened synthetic user media {} (video={}, audio={})", id, video, audio);
        return new MediaStream("user-" + id, tracks);
    }

    @Override
    public CompletableFuture<MediaStream> openDisplayMedia() {
        if (!displayAvailable) {
            return CompletableFuture.failedFuture(
                    new MediaAccessException(FailureReason.PERMISSION_DENIED, "Permission denied by user"));
        }
        long id = sequence.incrementAndGet();
        BufferedImage frame = patternFrame(new Color(30, 120, 60), "SCREEN " + id);
        MediaTrack track = MediaTrack.video("display-" + id, () -> frame);
        log.info("Opened synthetic display media {}", id);
        return CompletableFuture.completedFuture(new MediaStream("display-" + id, List.of(track)));
    }

    private static BufferedImage patternFrame(Color background, String label) {
        BufferedImage image = new BufferedImage(FRAME_WIDTH, FRAME_HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(background);
            g.fillRect(0, 0, FRAME_WIDTH, FRAME_HEIGHT);
            // stripe position varies per stream
            g.setColor(Color.WHITE);
            int offset = Math.floorMod(label.hashCode(), FRAME_WIDTH / 2);
            g.fillRect(offset, FRAME_HEIGHT / 3, FRAME_WIDTH / 4, FRAME_HEIGHT / 3);
        } finally {
            g.dispose();
        }
        return image;
    }

    private static AudioSampleSource toneSource(double frequency) {
        AtomicLong position = new AtomicLong();
        return (count, sampleRate) -> {
            float[] samples = new float[count];
            long start = position.getAndAdd(count);
            for (int i = 0; i < count; i++) {
                samples[i] = (float) (0.2 * Math.sin(2 * Math.PI * frequency * (start + i) / sampleRate));
            }
            return samples;
        };
    }
}
