package com.odin.peer_mesh_service.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.odin.peer_mesh_service.dto.PeerConnection;
import com.odin.peer_mesh_service.transport.ControlChannel;
import com.odin.peer_mesh_service.transport.MediaChannel;
import com.odin.peer_mesh_service.utility.ControlLoop;

import lombok.extern.slf4j.Slf4j;

/**
 * Source of truth for live channels, at most one control, one primary media
 * and one screen media channel per peer. Replacing a channel installs the new
 * one before closing the old so a close event of the old channel always finds
 * a newer generation in place. Only used from the control loop.
 */
@Slf4j
@Service
public class ConnectionRegistryService {

    private final ControlLoop loop;
    private final Map<String, PeerConnection> connections = new LinkedHashMap<>();
    private long generationSequence;

    public ConnectionRegistryService(ControlLoop loop) {
        this.loop = loop;
    }

    public Optional<PeerConnection> find(String peerId) {
        return Optional.ofNullable(connections.get(peerId));
    }

    public boolean contains(String peerId) {
        return connections.containsKey(peerId);
    }

    public List<String> peerIds() {
        return new ArrayList<>(connections.keySet());
    }

    public List<PeerConnection> all() {
        return new ArrayList<>(connections.values());
    }

    public List<ControlChannel> openControlChannels() {
        return connections.values().stream()
                .map(PeerConnection::getControlChannel)
                .filter(c -> c != null && c.isOpen())
                .collect(Collectors.toList());
    }

    public ControlChannel getControlChannel(String peerId) {
        PeerConnection connection = connections.get(peerId);
        return connection == null ? null : connection.getControlChannel();
    }

    public MediaChannel getMediaChannel(String peerId) {
        PeerConnection connection = connections.get(peerId);
        return connection == null ? null : connection.getMediaChannel();
    }

    public MediaChannel getScreenChannel(String peerId) {
        PeerConnection connection = connections.get(peerId);
        return connection == null ? null : connection.getScreenMediaChannel();
    }

    public long replaceControl(String peerId, ControlChannel channel) {
        PeerConnection connection = getOrCreate(peerId);
        ControlChannel old = connection.getControlChannel();
        long generation = ++generationSequence;
        connection.setControlChannel(channel);
        connection.setControlGeneration(generation);
        closeReplaced(old, channel);
        return generation;
    }

    public long replaceMedia(String peerId, MediaChannel channel) {
        PeerConnection connection = getOrCreate(peerId);
        MediaChannel old = connection.getMediaChannel();
        long generation = ++generationSequence;
        connection.setMediaChannel(channel);
        connection.setMediaGeneration(generation);
        closeReplaced(old, channel);
        return generation;
    }

    public long replaceScreen(String peerId, MediaChannel channel) {
        PeerConnection connection = getOrCreate(peerId);
        MediaChannel old = connection.getScreenMediaChannel();
        long generation = ++generationSequence;
        connection.setScreenMediaChannel(channel);
        connection.setScreenGeneration(generation);
        closeReplaced(old, channel);
        return generation;
    }

    public boolean isCurrentControl(String peerId, long generation) {
        PeerConnection connection = connections.get(peerId);
        return connection != null && connection.getControlChannel() != null
                && connection.getControlGeneration() == generation;
    }

    public boolean isCurrentMedia(String peerId, long generation) {
        PeerConnection connection = connections.get(peerId);
        return connection != null && connection.getMediaChannel() != null
                && connection.getMediaGeneration() == generation;
    }

    public boolean isCurrentScreen(String peerId, long generation) {
        PeerConnection connection = connections.get(peerId);
        return connection != null && connection.getScreenMediaChannel() != null
                && connection.getScreenGeneration() == generation;
    }

    /**
     * Clears the control slot if it still holds the given generation.
     *
     * @return true when the slot was current and has been cleared
     */
    public boolean detachControl(String peerId, long generation) {
        if (!isCurrentControl(peerId, generation)) {
            return false;
        }
        connections.get(peerId).setControlChannel(null);
        dropIfEmpty(peerId);
        return true;
    }

    public boolean detachMedia(String peerId, long generation) {
        if (!isCurrentMedia(peerId, generation)) {
            return false;
        }
        PeerConnection connection = connections.get(peerId);
        connection.setMediaChannel(null);
        connection.setMediaGeneration(++generationSequence);
        dropIfEmpty(peerId);
        return true;
    }

    public boolean detachScreen(String peerId, long generation) {
        if (!isCurrentScreen(peerId, generation)) {
            return false;
        }
        PeerConnection connection = connections.get(peerId);
        connection.setScreenMediaChannel(null);
        connection.setScreenGeneration(++generationSequence);
        dropIfEmpty(peerId);
        return true;
    }

    public void closeControl(String peerId) {
        PeerConnection connection = connections.get(peerId);
        if (connection == null || connection.getControlChannel() == null) {
            return;
        }
        ControlChannel channel = connection.getControlChannel();
        connection.setControlChannel(null);
        connection.setControlGeneration(++generationSequence);
        channel.close();
    }

    /**
     * Closes and forgets the primary media channel of a peer.
     */
    public void closeMedia(String peerId) {
        PeerConnection connection = connections.get(peerId);
        if (connection == null || connection.getMediaChannel() == null) {
            return;
        }
        MediaChannel channel = connection.getMediaChannel();
        connection.setMediaChannel(null);
        connection.setMediaGeneration(++generationSequence);
        channel.close();
    }

    public void closeScreen(String peerId) {
        PeerConnection connection = connections.get(peerId);
        if (connection == null || connection.getScreenMediaChannel() == null) {
            return;
        }
        MediaChannel channel = connection.getScreenMediaChannel();
        connection.setScreenMediaChannel(null);
        connection.setScreenGeneration(++generationSequence);
        channel.close();
    }

    public void closeAllScreenChannels() {
        connections.keySet().forEach(this::closeScreen);
    }

    public void setExpectScreen(String peerId, boolean expectScreen) {
        getOrCreate(peerId).setExpectScreen(expectScreen);
    }

    public boolean isExpectingScreen(String peerId) {
        PeerConnection connection = connections.get(peerId);
        return connection != null && connection.isExpectScreen();
    }

    public void touch(String peerId) {
        PeerConnection connection = connections.get(peerId);
        if (connection != null) {
            connection.setLastSeenAt(loop.now());
        }
    }

    /**
     * Removes the peer, closing every channel it still holds.
     */
    public void remove(String peerId) {
        PeerConnection connection = connections.remove(peerId);
        if (connection == null) {
            return;
        }
        log.info("[REGISTRY] Removing connection record for {}", peerId);
        if (connection.getControlChannel() != null) {
            connection.getControlChannel().close();
        }
        if (connection.getMediaChannel() != null) {
            connection.getMediaChannel().close();
        }
        if (connection.getScreenMediaChannel() != null) {
            connection.getScreenMediaChannel().close();
        }
    }

    public void clear() {
        peerIds().forEach(this::remove);
    }

    private PeerConnection getOrCreate(String peerId) {
        return connections.computeIfAbsent(peerId, id -> {
            PeerConnection connection = new PeerConnection(id);
            connection.setLastSeenAt(loop.now());
            return connection;
        });
    }

    private void dropIfEmpty(String peerId) {
        PeerConnection connection = connections.get(peerId);
        if (connection != null && connection.isEmpty() && !connection.isExpectScreen()) {
            connections.remove(peerId);
        }
    }

    private static void closeReplaced(Object old, Object replacement) {
        if (old == null || old == replacement) {
            return;
        }
        if (old instanceof ControlChannel) {
            ((ControlChannel) old).close();
        } else if (old instanceof MediaChannel) {
            ((MediaChannel) old).close();
        }
    }
}
