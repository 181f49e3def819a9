package com.odin.peer_mesh_service.transport;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A bundle of tracks. Instances are owned by the transport or the device
 * provider; everyone else only holds references.
 */
@Getter
public class MediaStream {

    private final String id;
    private final List<MediaTrack> tracks;

    public MediaStream(String id, List<MediaTrack> tracks) {
        this.id = id;
        this.tracks = List.copyOf(tracks);
    }

    public List<MediaTrack> getAudioTracks() {
        return tracks.stream().filter(MediaTrack::isAudio).collect(Collectors.toList());
    }

    public List<MediaTrack> getVideoTracks() {
        return tracks.stream().filter(MediaTrack::isVideo).collect(Collectors.toList());
    }

    /**
     * A stream is active while at least one of its tracks is live.
     */
    public boolean isActive() {
        return tracks.stream().anyMatch(MediaTrack::isLive);
    }

    public boolean hasLiveVideo() {
        return tracks.stream().anyMatch(t -> t.isVideo() && t.isLive() && t.isEnabled());
    }

    public boolean hasLiveTrack() {
        return tracks.stream().anyMatch(t -> t.isLive() && t.isEnabled());
    }

    public void stop() {
        tracks.forEach(MediaTrack::stop);
    }

    public String describeTracks() {
        return tracks.stream().map(MediaTrack::toString).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return "MediaStream[" + id + "]";
    }
}
