package com.odin.peer_mesh_service.service;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import jakarta.annotation.PostConstruct;

import org.springframework.stereotype.Service;

import com.odin.peer_mesh_service.component.LocalSession;
import com.odin.peer_mesh_service.component.SessionErrorSlot;
import com.odin.peer_mesh_service.config.PeerSessionProperties;
import com.odin.peer_mesh_service.dto.Participant;
import com.odin.peer_mesh_service.dto.signal.RequestScreenStreamMessage;
import com.odin.peer_mesh_service.dto.signal.RequestStreamUpdateMessage;
import com.odin.peer_mesh_service.enums.ConnectionPhase;
import com.odin.peer_mesh_service.enums.FailureReason;
import com.odin.peer_mesh_service.enums.SessionErrorCode;
import com.odin.peer_mesh_service.enums.TaskPurpose;
import com.odin.peer_mesh_service.enums.TransitionState;
import com.odin.peer_mesh_service.transport.MediaStream;
import com.odin.peer_mesh_service.transport.TransportAdapter;
import com.odin.peer_mesh_service.utility.ControlLoop;

import lombok.extern.slf4j.Slf4j;

/**
 * Retry policies on top of the connection lifecycle: the bounded join loop
 * towards the creator, re-calling peers whose media dropped (forcing relay
 * after repeated failures), the stream watchdog and screen recovery, and
 * camera restore re-requests.
 */
@Slf4j
@Service
public class ReconnectionService implements PeerLifecycleListener {

    private final LocalSession session;
    private final PeerConnectionService connections;
    private final ConnectionRegistryService registry;
    private final ParticipantStoreService participants;
    private final SignalMessageRouter router;
    private final ScheduledTaskTable tasks;
    private final TransportAdapter transport;
    private final SessionErrorSlot errors;
    private final ControlLoop loop;
    private final PeerSessionProperties properties;

    private final Map<String, ConnectionPhase> phases = new HashMap<>();
    private final Map<String, Integer> failures = new HashMap<>();
    private final Set<String> relayForced = new HashSet<>();
    private final Map<String, Long> cameraInactiveSince = new HashMap<>();
    private final Map<String, Long> screenInactiveSince = new HashMap<>();
    private final Map<String, ScreenRecovery> screenRecoveries = new HashMap<>();
    private final Map<String, Integer> cameraRestoreRetries = new HashMap<>();

    private String joinTarget;
    private int joinAttempts;
    private boolean joinPeerUnavailable;

    public ReconnectionService(LocalSession session,
                               PeerConnectionService connections,
                               ConnectionRegistryService registry,
                               ParticipantStoreService participants,
                               SignalMessageRouter router,
                               ScheduledTaskTable tasks,
                               TransportAdapter transport,
                               SessionErrorSlot errors,
                               ControlLoop loop,
                               PeerSessionProperties properties) {
        this.session = session;
        this.connections = connections;
        this.registry = registry;
        this.participants = participants;
        this.router = router;
        this.tasks = tasks;
        this.transport = transport;
        this.errors = errors;
        this.loop = loop;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        connections.addLifecycleListener(this);
    }

    public ConnectionPhase getPhase(String peerId) {
        return phases.getOrDefault(peerId, ConnectionPhase.IDLE);
    }

    public boolean isJoining() {
        return joinTarget != null;
    }

    // ---- initial join --------------------------------------------------

    /**
     * Starts the bounded attempt loop towards the room creator.
     */
    public void startJoin(String creatorId) {
        joinTarget = creatorId;
        joinAttempts = 0;
        joinPeerUnavailable = false;
        log.info("[JOIN] Joining via {}", creatorId);
        attemptJoin();
    }

    private void attemptJoin() {
        String target = joinTarget;
        if (target == null || !session.isOpen()) {
            return;
        }
        if (connections.hasOpenControl(target)) {
            joinSucceeded(target);
            return;
        }
        joinAttempts++;
        log.info("[JOIN] Attempt {}/{} to reach {}", joinAttempts, properties.getJoinMaxAttempts(), target);
        phases.put(target, ConnectionPhase.CONNECTING);
        registry.closeControl(target);
        registry.closeMedia(target);
        connections.establishPeerConnection(target);
        tasks.schedule(target, TaskPurpose.JOIN_RETRY, properties.getJoinRetryIntervalMs(), () -> {
            if (connections.hasOpenControl(target)) {
                joinSucceeded(target);
            } else if (joinAttempts >= properties.getJoinMaxAttempts()) {
                joinFailed(target);
            } else {
                attemptJoin();
            }
        });
    }

    private void joinSucceeded(String target) {
        if (!target.equals(joinTarget)) {
            return;
        }
        log.info("[JOIN] Reached {} after {} attempt(s)", target, joinAttempts);
        tasks.cancel(target, TaskPurpose.JOIN_RETRY);
        joinTarget = null;
    }

    private void joinFailed(String target) {
        log.error("[JOIN] Giving up on {} after {} attempts", target, joinAttempts);
        joinTarget = null;
        phases.remove(target);
        registry.remove(target);
        participants.remove(target);
        FailureReason reason = joinPeerUnavailable ? FailureReason.HOST_NOT_FOUND : FailureReason.CONNECTION_FAILED;
        String message = joinPeerUnavailable
                ? "Room host " + target + " was not found"
                : "Could not connect to room host " + target;
        errors.raise(SessionErrorCode.HOST_UNREACHABLE, reason, target, message);
    }

    /**
     * The transport reported that a peer id is not registered.
     */
    public void onPeerUnavailable(String peerId) {
        if (peerId != null && peerId.equals(joinTarget)) {
            joinPeerUnavailable = true;
        }
    }

    public void cancelJoin() {
        if (joinTarget != null) {
            tasks.cancel(joinTarget, TaskPurpose.JOIN_RETRY);
            joinTarget = null;
        }
    }

    // ---- mid-call loss -------------------------------------------------

    @Override
    public void onControlOpened(String peerId) {
        if (peerId.equals(joinTarget)) {
            joinSucceeded(peerId);
        }
    }

    @Override
    public void onControlClosed(String peerId) {
        if (peerId.equals(joinTarget)) {
            return;
        }
        connections.handlePeerDisconnection(peerId);
        if (!session.isCreator() && peerId.equals(session.getCreatorId()) && session.isOpen()) {
            log.warn("[RECONNECT] Lost control channel to creator {}, rejoining", peerId);
            startJoin(peerId);
        }
    }

    @Override
    public void onMediaStream(String peerId) {
        ConnectionPhase previous = phases.put(peerId, ConnectionPhase.CONNECTED);
        failures.remove(peerId);
        cameraInactiveSince.remove(peerId);
        tasks.cancel(peerId, TaskPurpose.RECONNECT);
        if (tasks.cancel(peerId, TaskPurpose.CAMERA_RESTORE_RETRY)) {
            log.info("[RECONNECT] Camera stream of {} restored", peerId);
        }
        cameraRestoreRetries.remove(peerId);
        if (previous == ConnectionPhase.RECONNECTING) {
            log.info("[RECONNECT] Media with {} re-established", peerId);
        }
    }

    @Override
    public void onMediaLost(String peerId) {
        if (peerId.equals(joinTarget) || !session.isOpen()) {
            return;
        }
        if (getPhase(peerId) == ConnectionPhase.RECONNECTING) {
            recordFailure(peerId);
            return;
        }
        log.warn("[RECONNECT] Media with {} lost, reconnecting in {} ms", peerId, properties.getReconnectDelayMs());
        phases.put(peerId, ConnectionPhase.RECONNECTING);
        failures.put(peerId, 0);
        participants.setTransition(peerId, TransitionState.RECONNECTING);
        scheduleReconnect(peerId);
    }

    @Override
    public void onMediaFailed(String peerId) {
        if (peerId.equals(joinTarget) || !session.isOpen()) {
            return;
        }
        phases.put(peerId, ConnectionPhase.RECONNECTING);
        recordFailure(peerId);
    }

    @Override
    public void onScreenStream(String peerId) {
        screenRecoveries.remove(peerId);
        screenInactiveSince.remove(peerId);
    }

    @Override
    public void onPeerRemoved(String peerId) {
        phases.remove(peerId);
        failures.remove(peerId);
        relayForced.remove(peerId);
        cameraInactiveSince.remove(peerId);
        screenInactiveSince.remove(peerId);
        screenRecoveries.remove(peerId);
        cameraRestoreRetries.remove(peerId);
    }

    private void recordFailure(String peerId) {
        int count = failures.merge(peerId, 1, Integer::sum);
        log.warn("[RECONNECT] Attempt to {} failed ({}/{})", peerId, count, properties.getMaxReconnectAttempts());
        if (count >= properties.getMaxReconnectAttempts()) {
            giveUp(peerId);
            return;
        }
        if (count >= properties.getRelayAfterFailures() && relayForced.add(peerId)) {
            log.warn("[RECONNECT] Forcing relay and restarting session with {}", peerId);
            transport.forceRelay(peerId);
            transport.restartSession(peerId);
        }
        scheduleReconnect(peerId);
    }

    private void scheduleReconnect(String peerId) {
        tasks.schedule(peerId, TaskPurpose.RECONNECT, properties.getReconnectDelayMs(), () -> reconnect(peerId));
    }

    private void reconnect(String peerId) {
        if (!session.isOpen() || !session.getTopology().allowsDirectConnection(session.isCreator(), peerId)) {
            phases.remove(peerId);
            return;
        }
        if (!registry.contains(peerId)) {
            log.info("[RECONNECT] {} is gone, not reconnecting", peerId);
            phases.remove(peerId);
            return;
        }
        log.info("[RECONNECT] Calling {} again", peerId);
        connections.ensureControlChannel(peerId);
        connections.callWithCamera(peerId);
    }

    private void giveUp(String peerId) {
        log.error("[RECONNECT] Giving up on {} after {} failed attempts", peerId, failures.get(peerId));
        connections.handlePeerDisconnection(peerId);
        errors.raise(SessionErrorCode.PEER_UNREACHABLE, FailureReason.RETRIES_EXHAUSTED, peerId,
                "Lost connection to " + peerId);
    }

    // ---- camera restore ------------------------------------------------

    /**
     * Re-requests a fresh camera stream from the peer until one arrives or
     * the retries run out.
     */
    public void awaitCameraRestore(String peerId) {
        cameraRestoreRetries.put(peerId, 0);
        scheduleCameraRestoreRetry(peerId);
    }

    private void scheduleCameraRestoreRetry(String peerId) {
        tasks.schedule(peerId, TaskPurpose.CAMERA_RESTORE_RETRY, properties.getCameraRestoreRetryIntervalMs(), () -> {
            MediaStream camera = participants.find(peerId).map(Participant::getCameraStream).orElse(null);
            if (camera != null && camera.isActive()) {
                cameraRestoreRetries.remove(peerId);
                return;
            }
            int retries = cameraRestoreRetries.merge(peerId, 1, Integer::sum);
            if (retries > properties.getCameraRestoreMaxRetries()) {
                log.warn("[RECONNECT] Camera stream of {} not restored after {} requests", peerId, retries - 1);
                cameraRestoreRetries.remove(peerId);
                return;
            }
            log.info("[RECONNECT] Camera of {} still missing, requesting again ({}/{})",
                    peerId, retries, properties.getCameraRestoreMaxRetries());
            router.send(peerId, new RequestStreamUpdateMessage(session.getSelfId(), true, true));
            scheduleCameraRestoreRetry(peerId);
        });
    }

    // ---- watchdog ------------------------------------------------------

    /**
     * Looks for remote streams that stopped delivering. Runs periodically on
     * the control loop.
     */
    public void checkStreams() {
        if (!session.isOpen()) {
            return;
        }
        long now = loop.now();
        for (String peerId : participants.ids()) {
            Participant participant = participants.find(peerId).orElse(null);
            if (participant == null) {
                continue;
            }
            checkCamera(peerId, participant, now);
            checkScreen(peerId, participant, now);
        }
    }

    private void checkCamera(String peerId, Participant participant, long now) {
        MediaStream camera = participant.getCameraStream();
        if (camera == null || camera.isActive() || getPhase(peerId) == ConnectionPhase.RECONNECTING) {
            cameraInactiveSince.remove(peerId);
            return;
        }
        long since = cameraInactiveSince.computeIfAbsent(peerId, id -> now);
        if (now - since < properties.getStreamInactivityGraceMs()) {
            return;
        }
        log.warn("[WATCHDOG] Camera stream of {} inactive for {} ms", peerId, now - since);
        cameraInactiveSince.remove(peerId);
        participants.clearCameraStream(peerId);
        registry.closeMedia(peerId);
        onMediaLost(peerId);
    }

    private void checkScreen(String peerId, Participant participant, long now) {
        MediaStream screen = participant.getScreenStream();
        if (!participant.isScreenSharing() || (screen != null && screen.hasLiveVideo())) {
            screenInactiveSince.remove(peerId);
            return;
        }
        long since = screenInactiveSince.computeIfAbsent(peerId, id -> now);
        if (now - since < properties.getStreamInactivityGraceMs()) {
            return;
        }
        requestScreenRecovery(peerId, now);
    }

    /**
     * Asks the sharer for a fresh screen stream, at most a few times and
     * never more often than the cooldown allows.
     */
    public boolean requestScreenRecovery(String peerId, long now) {
        ScreenRecovery recovery = screenRecoveries.computeIfAbsent(peerId, id -> new ScreenRecovery());
        if (recovery.attempts >= properties.getScreenRecoveryMaxAttempts()) {
            return false;
        }
        if (recovery.attempts > 0 && now - recovery.lastAttemptAt < properties.getScreenRecoveryCooldownMs()) {
            return false;
        }
        recovery.attempts++;
        recovery.lastAttemptAt = now;
        log.info("[WATCHDOG] Screen of {} inactive, requesting fresh stream ({}/{})",
                peerId, recovery.attempts, properties.getScreenRecoveryMaxAttempts());
        return router.send(peerId, new RequestScreenStreamMessage(session.getSelfId(), true));
    }

    public void reset() {
        cancelJoin();
        phases.clear();
        failures.clear();
        relayForced.clear();
        cameraInactiveSince.clear();
        screenInactiveSince.clear();
        screenRecoveries.clear();
        cameraRestoreRetries.clear();
    }

    private static final class ScreenRecovery {
        private int attempts;
        private long lastAttemptAt;
    }
}
