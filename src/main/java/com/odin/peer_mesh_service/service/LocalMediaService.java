package com.odin.peer_mesh_service.service;

import org.springframework.stereotype.Service;

import com.odin.peer_mesh_service.component.LocalSession;
import com.odin.peer_mesh_service.component.MediaDeviceProvider;
import com.odin.peer_mesh_service.exception.MediaAccessException;
import com.odin.peer_mesh_service.transport.MediaStream;
import com.odin.peer_mesh_service.transport.MediaTrack;

import lombok.extern.slf4j.Slf4j;

/**
 * Owns the local camera/microphone stream: acquisition with audio-only
 * fallback, refresh when the camera died, and the mute toggles.
 */
@Slf4j
@Service
public class LocalMediaService {

    private final MediaDeviceProvider devices;
    private final LocalSession session;

    public LocalMediaService(MediaDeviceProvider devices, LocalSession session) {
        this.devices = devices;
        this.session = session;
    }

    /**
     * Opens camera and microphone, falling back to microphone only.
     *
     * @throws MediaAccessException when not even audio can be opened
     */
    public MediaStream acquire() throws MediaAccessException {
        try {
            MediaStream stream = devices.openUserMedia(true, true);
            session.setAudioOnly(false);
            session.setLocalStream(stream);
            return stream;
        } catch (MediaAccessException e) {
            log.warn("[MEDIA] Camera and microphone unavailable ({}), trying audio only", e.getMessage());
        }
        MediaStream stream = devices.openUserMedia(false, true);
        session.setAudioOnly(true);
        session.setLocalStream(stream);
        return stream;
    }

    /**
     * Re-acquires the local stream when its video is no longer live. Keeps
     * the previous mute state.
     */
    public MediaStream ensureLive() {
        MediaStream current = session.getLocalStream();
        if (current != null && (current.hasLiveVideo() || session.isAudioOnly() || !session.isVideoEnabled())) {
            return current;
        }
        boolean audioEnabled = current == null || session.isAudioEnabled();
        try {
            MediaStream fresh = session.isAudioOnly() ? devices.openUserMedia(false, true) : devices.openUserMedia(true, true);
            fresh.getAudioTracks().forEach(t -> t.setEnabled(audioEnabled));
            session.setLocalStream(fresh);
            if (current != null) {
                current.stop();
            }
            log.info("[MEDIA] Local stream refreshed");
            return fresh;
        } catch (MediaAccessException e) {
            log.warn("[MEDIA] Could not refresh local stream: {}", e.getMessage());
            return current;
        }
    }

    public boolean toggleAudio() {
        return toggle(session.getLocalStream(), true);
    }

    public boolean toggleVideo() {
        return toggle(session.getLocalStream(), false);
    }

    private boolean toggle(MediaStream stream, boolean audio) {
        if (stream == null) {
            return false;
        }
        boolean enabled = false;
        for (MediaTrack track : audio ? stream.getAudioTracks() : stream.getVideoTracks()) {
            track.setEnabled(!track.isEnabled());
            enabled = track.isEnabled();
        }
        log.info("[MEDIA] {} {}", audio ? "Audio" : "Video", enabled ? "enabled" : "disabled");
        return enabled;
    }

    public void release() {
        MediaStream local = session.getLocalStream();
        if (local != null) {
            local.stop();
        }
        MediaStream screen = session.getScreenStream();
        if (screen != null) {
            screen.stop();
        }
    }
}
