package com.odin.peer_mesh_service.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.odin.peer_mesh_service.component.LocalSession;
import com.odin.peer_mesh_service.config.PeerSessionProperties;
import com.odin.peer_mesh_service.dto.Participant;
import com.odin.peer_mesh_service.dto.ParticipantSnapshot;
import com.odin.peer_mesh_service.enums.StreamType;
import com.odin.peer_mesh_service.enums.TaskPurpose;
import com.odin.peer_mesh_service.enums.TransitionState;
import com.odin.peer_mesh_service.transport.MediaStream;

import lombok.extern.slf4j.Slf4j;

/**
 * Participants in arrival order. Mutated on the control loop only; readers
 * on other threads use {@link #snapshot()}, which is rebuilt after every change.
 */
@Slf4j
@Service
public class ParticipantStoreService {

    private final LocalSession session;
    private final ScheduledTaskTable tasks;
    private final PeerSessionProperties properties;

    private final Map<String, Participant> participants = new LinkedHashMap<>();
    // usernames that arrived before the participant itself
    private final Map<String, String> pendingUsernames = new HashMap<>();
    private final List<Runnable> changeListeners = new CopyOnWriteArrayList<>();

    private volatile List<ParticipantSnapshot> published = List.of();

    public ParticipantStoreService(LocalSession session, ScheduledTaskTable tasks, PeerSessionProperties properties) {
        this.session = session;
        this.tasks = tasks;
        this.properties = properties;
    }

    public void addChangeListener(Runnable listener) {
        changeListeners.add(listener);
    }

    public List<ParticipantSnapshot> snapshot() {
        return published;
    }

    public Optional<Participant> find(String peerId) {
        return Optional.ofNullable(participants.get(peerId));
    }

    public boolean contains(String peerId) {
        return participants.containsKey(peerId);
    }

    public List<String> ids() {
        return new ArrayList<>(participants.keySet());
    }

    public int size() {
        return participants.size();
    }

    /**
     * Returns the participant, creating it if this is the first time the id
     * is heard of.
     */
    public Participant ensure(String peerId) {
        Participant existing = participants.get(peerId);
        if (existing != null) {
            return existing;
        }
        Participant participant = new Participant(peerId);
        String pending = pendingUsernames.remove(peerId);
        if (pending != null) {
            participant.setUsername(pending);
        }
        participants.put(peerId, participant);
        log.info("[PARTICIPANT] Added {} ({})", peerId, participant.getUsername());
        changed();
        return participant;
    }

    /**
     * A first stream starts the connecting hint; a stream from a peer that
     * was being removed brings it straight back to connected.
     */
    public void setCameraStream(String peerId, MediaStream stream) {
        boolean arriving = !participants.containsKey(peerId);
        Participant participant = ensure(peerId);
        tasks.cancel(peerId, TaskPurpose.REMOVAL);
        if (participant.getCameraStream() != stream) {
            participant.setCameraStream(stream);
            changed();
        }
        if (arriving) {
            setTransition(peerId, TransitionState.CONNECTING);
        } else if (participant.getTransition() == TransitionState.DISCONNECTING) {
            setTransition(peerId, TransitionState.CONNECTED);
        }
    }

    public void setScreenStream(String peerId, MediaStream stream) {
        boolean arriving = !participants.containsKey(peerId);
        Participant participant = ensure(peerId);
        tasks.cancel(peerId, TaskPurpose.REMOVAL);
        participant.setScreenStream(stream);
        participant.setScreenSharing(true);
        participant.setStreamType(StreamType.SCREEN);
        changed();
        if (arriving) {
            setTransition(peerId, TransitionState.CONNECTING);
        }
    }

    public void clearCameraStream(String peerId) {
        Participant participant = participants.get(peerId);
        if (participant == null || participant.getCameraStream() == null) {
            return;
        }
        participant.setCameraStream(null);
        changed();
    }

    public void clearScreenStream(String peerId) {
        Participant participant = participants.get(peerId);
        if (participant == null || participant.getScreenStream() == null) {
            return;
        }
        participant.setScreenStream(null);
        changed();
    }

    /**
     * Last write wins. Names for unknown ids are kept until the participant
     * appears.
     */
    public void applyUsername(String peerId, String username) {
        if (username == null || username.isBlank()) {
            return;
        }
        Participant participant = participants.get(peerId);
        if (participant == null) {
            pendingUsernames.put(peerId, username);
            return;
        }
        if (username.equals(participant.getUsername())) {
            return;
        }
        participant.setUsername(username);
        changed();
    }

    /**
     * Ignored for ids that are not participants yet; their screen channel
     * sets the flag when it arrives.
     */
    public void applyScreenSharing(String peerId, boolean sharing) {
        Participant participant = participants.get(peerId);
        if (participant == null) {
            log.debug("[PARTICIPANT] Screen flag for unknown {} ignored", peerId);
            return;
        }
        StreamType type = sharing ? StreamType.SCREEN : StreamType.CAMERA;
        if (participant.isScreenSharing() == sharing && participant.getStreamType() == type) {
            return;
        }
        participant.setScreenSharing(sharing);
        participant.setStreamType(type);
        if (!sharing) {
            participant.setScreenStream(null);
        }
        log.info("[PARTICIPANT] {} screen sharing -> {}", peerId, sharing);
        changed();
    }

    public void applyStreamType(String peerId, StreamType type) {
        if (type == null) {
            return;
        }
        applyScreenSharing(peerId, type == StreamType.SCREEN);
    }

    public void setTransition(String peerId, TransitionState state) {
        Participant participant = participants.get(peerId);
        if (participant == null || !session.isTransitionsEnabled()) {
            return;
        }
        participant.setTransition(state);
        changed();
        if (state == TransitionState.CONNECTING || state == TransitionState.RECONNECTING) {
            tasks.schedule(peerId, TaskPurpose.TRANSITION, properties.getTransitionDelayMs(),
                    () -> setTransition(peerId, TransitionState.CONNECTED));
        } else {
            tasks.cancel(peerId, TaskPurpose.TRANSITION);
        }
    }

    /**
     * Marks the participant as leaving and removes it after the removal
     * delay, or at once when transitions are disabled.
     */
    public void beginRemoval(String peerId) {
        if (!participants.containsKey(peerId)) {
            return;
        }
        if (!session.isTransitionsEnabled()) {
            remove(peerId);
            return;
        }
        setTransition(peerId, TransitionState.DISCONNECTING);
        tasks.schedule(peerId, TaskPurpose.REMOVAL, properties.getRemovalDelayMs(), () -> remove(peerId));
    }

    public void remove(String peerId) {
        tasks.cancel(peerId, TaskPurpose.TRANSITION);
        tasks.cancel(peerId, TaskPurpose.REMOVAL);
        pendingUsernames.remove(peerId);
        if (participants.remove(peerId) != null) {
            log.info("[PARTICIPANT] Removed {}", peerId);
            changed();
        }
    }

    public void clear() {
        participants.keySet().forEach(id -> {
            tasks.cancel(id, TaskPurpose.TRANSITION);
            tasks.cancel(id, TaskPurpose.REMOVAL);
        });
        participants.clear();
        pendingUsernames.clear();
        changed();
    }

    public boolean isAnyoneSharing() {
        return participants.values().stream().anyMatch(Participant::isScreenSharing);
    }

    public List<String> sharingIds() {
        return participants.values().stream()
                .filter(Participant::isScreenSharing)
                .map(Participant::getId)
                .collect(Collectors.toList());
    }

    private void changed() {
        published = participants.values().stream()
                .map(Participant::toSnapshot)
                .collect(Collectors.toUnmodifiableList());
        for (Runnable listener : changeListeners) {
            listener.run();
        }
    }
}
