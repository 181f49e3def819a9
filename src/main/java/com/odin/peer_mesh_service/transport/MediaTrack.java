package com.odin.peer_mesh_service.transport;

import com.odin.peer_mesh_service.enums.TrackKind;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One audio or video track. {@code live} mirrors the ready state of a
 * platform track, {@code enabled} the mute switch.
 */
@Slf4j
@Getter
public class MediaTrack {

    private final String id;
    private final TrackKind kind;
    private final VideoFrameSource frameSource;
    private final AudioSampleSource sampleSource;

    private volatile boolean enabled = true;
    private volatile boolean live = true;
    private volatile String contentHint;

    private final List<Runnable> endedListeners = new CopyOnWriteArrayList<>();

    private MediaTrack(String id, TrackKind kind, VideoFrameSource frameSource, AudioSampleSource sampleSource) {
        this.id = id;
        this.kind = kind;
        this.frameSource = frameSource;
        this.sampleSource = sampleSource;
    }

    public static MediaTrack video(String id, VideoFrameSource frameSource) {
        return new MediaTrack(id, TrackKind.VIDEO, frameSource, null);
    }

    public static MediaTrack audio(String id, AudioSampleSource sampleSource) {
        return new MediaTrack(id, TrackKind.AUDIO, null, sampleSource);
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public void setContentHint(String contentHint) {
        this.contentHint = contentHint;
    }

    public boolean isVideo() {
        return kind == TrackKind.VIDEO;
    }

    public boolean isAudio() {
        return kind == TrackKind.AUDIO;
    }

    public void onEnded(Runnable listener) {
        endedListeners.add(listener);
    }

    public void stop() {
        if (!live) {
            return;
        }
        live = false;
        for (Runnable listener : endedListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.error("Track {} ended-listener failed: {}", id, e.getMessage(), e);
            }
        }
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + (live ? "live" : "ended") + ":" + (enabled ? "enabled" : "disabled");
    }
}
