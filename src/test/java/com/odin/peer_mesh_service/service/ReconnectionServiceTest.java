package com.odin.peer_mesh_service.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.odin.peer_mesh_service.dto.SessionError;
import com.odin.peer_mesh_service.dto.signal.RequestScreenStreamMessage;
import com.odin.peer_mesh_service.enums.ConnectionPhase;
import com.odin.peer_mesh_service.enums.FailureReason;
import com.odin.peer_mesh_service.enums.SessionErrorCode;
import com.odin.peer_mesh_service.service.handler.SignalHandlerAdapter;
import com.odin.peer_mesh_service.support.ManualControlLoop;
import com.odin.peer_mesh_service.support.TestNode;
import com.odin.peer_mesh_service.transport.MediaChannel;
import com.odin.peer_mesh_service.transport.MediaStream;
import com.odin.peer_mesh_service.transport.MediaTrack;
import com.odin.peer_mesh_service.transport.local.LocalTransportHub;

class ReconnectionServiceTest {

    private ManualControlLoop loop;
    private LocalTransportHub hub;

    @BeforeEach
    void setUp() {
        loop = new ManualControlLoop();
        hub = new LocalTransportHub();
    }

    @Test
    void joinGivesUpAfterFiveAttemptsWhenCreatorIsMissing() {
        TestNode joiner = new TestNode(hub, loop);
        joiner.facade.join("ghost", false, "Bob");
        loop.runPending();
        assertThat(joiner.reconnection.isJoining()).isTrue();

        loop.advance(14_999);
        assertThat(joiner.sink.errors).isEmpty();

        loop.advance(1);
        assertThat(joiner.sink.errors).hasSize(1);
        SessionError error = joiner.sink.errors.get(0);
        assertThat(error.getCode()).isEqualTo(SessionErrorCode.HOST_UNREACHABLE);
        assertThat(error.getReason()).isEqualTo(FailureReason.HOST_NOT_FOUND);
        assertThat(error.getPeerId()).isEqualTo("ghost-creator");
        assertThat(joiner.reconnection.isJoining()).isFalse();
        assertThat(joiner.sink.lastSnapshot().getError()).isEqualTo(error);
    }

    @Test
    void lateCreatorIsReachedOnALaterAttempt() {
        TestNode joiner = new TestNode(hub, loop);
        joiner.facade.join("late", false, "Bob");
        loop.advance(4000);

        TestNode creator = new TestNode(hub, loop).join("late", true, "Alice");
        loop.advance(4000);

        assertThat(joiner.reconnection.isJoining()).isFalse();
        assertThat(joiner.sink.errors).isEmpty();
        assertThat(joiner.hasCameraFrom(creator)).isTrue();
        assertThat(creator.hasCameraFrom(joiner)).isTrue();
    }

    @Test
    void brokenDirectPathFallsBackToRelay() {
        TestNode creator = new TestNode(hub, loop).join("relay", true, "Alice");
        TestNode joiner = new TestNode(hub, loop).join("relay", false, "Bob");
        loop.advance(2000);
        assertThat(hub.isRelayForced(creator.id(), joiner.id())).isFalse();

        hub.blockLink(creator.id(), joiner.id());
        MediaChannel media = joiner.registry.getMediaChannel(creator.id());
        media.close();
        loop.runPending();
        assertThat(joiner.reconnection.getPhase(creator.id())).isEqualTo(ConnectionPhase.RECONNECTING);

        loop.advance(30_000);

        assertThat(hub.isRelayForced(creator.id(), joiner.id())).isTrue();
        assertThat(hub.getRestartCount(creator.id(), joiner.id())).isGreaterThanOrEqualTo(1);
        assertThat(joiner.reconnection.getPhase(creator.id())).isEqualTo(ConnectionPhase.CONNECTED);
        assertThat(creator.reconnection.getPhase(joiner.id())).isEqualTo(ConnectionPhase.CONNECTED);
        assertThat(joiner.registry.getMediaChannel(creator.id()).getRemoteStream()).isNotNull();
        assertThat(joiner.openMediaChannelsTo(creator)).isEqualTo(1);
        assertThat(joiner.sink.errors).isEmpty();
        assertThat(creator.sink.errors).isEmpty();
    }

    @Test
    void givesUpOnPeerAfterMaxAttempts() {
        TestNode creator = new TestNode(hub, loop);
        TestNode joiner = new TestNode(hub, loop);
        for (TestNode node : new TestNode[] {creator, joiner}) {
            node.properties.setRelayAfterFailures(10);
            node.properties.setMaxReconnectAttempts(2);
        }
        creator.join("lost", true, "Alice");
        joiner.join("lost", false, "Bob");
        loop.advance(2000);

        hub.blockLink(creator.id(), joiner.id());
        joiner.registry.getMediaChannel(creator.id()).close();
        loop.advance(30_000);

        assertThat(joiner.sink.errors)
                .extracting(SessionError::getCode, SessionError::getReason, SessionError::getPeerId)
                .contains(tuple(
                        SessionErrorCode.PEER_UNREACHABLE, FailureReason.RETRIES_EXHAUSTED, creator.id()));
        assertThat(hub.isRelayForced(creator.id(), joiner.id())).isFalse();
        assertThat(joiner.registry.contains(creator.id())).isFalse();
    }

    @Test
    void watchdogReconnectsInactiveCamera() {
        TestNode creator = new TestNode(hub, loop).join("watch", true, "Alice");
        TestNode joiner = new TestNode(hub, loop).join("watch", false, "Bob");
        loop.advance(2000);
        String joinerId = joiner.id();
        MediaStream frozen = new MediaStream("frozen",
                List.of(MediaTrack.audio("frozen-audio", (count, rate) -> new float[count])));
        frozen.stop();
        creator.participants.setCameraStream(joinerId, frozen);

        creator.reconnection.checkStreams();
        loop.advance(2999);
        creator.reconnection.checkStreams();
        assertThat(creator.reconnection.getPhase(joinerId)).isEqualTo(ConnectionPhase.CONNECTED);

        loop.advance(1);
        creator.reconnection.checkStreams();
        assertThat(creator.reconnection.getPhase(joinerId)).isEqualTo(ConnectionPhase.RECONNECTING);
        assertThat(creator.participant(joinerId).getCameraStream()).isNull();

        loop.advance(5000);

        assertThat(creator.reconnection.getPhase(joinerId)).isEqualTo(ConnectionPhase.CONNECTED);
        assertThat(creator.hasCameraFrom(joiner)).isTrue();
        assertThat(creator.participant(joinerId).getCameraStream()).isNotSameAs(frozen);
        assertThat(creator.openMediaChannelsTo(joiner)).isEqualTo(1);
        assertThat(creator.sink.errors).isEmpty();
    }

    @Test
    void screenRecoveryIsBoundedWithCooldown() {
        TestNode creator = new TestNode(hub, loop).join("screen", true, "Alice");
        TestNode joiner = new TestNode(hub, loop).join("screen", false, "Bob");
        loop.advance(2000);
        List<Long> requestedAt = new ArrayList<>();
        joiner.router.addHandler(new SignalHandlerAdapter() {
            @Override
            public void onRequestScreenStream(String fromPeerId, RequestScreenStreamMessage message) {
                requestedAt.add(loop.now());
            }
        });
        // sharing announced but no screen channel ever arrives
        creator.participants.applyScreenSharing(joiner.id(), true);
        long start = loop.now();

        for (int i = 0; i < 40; i++) {
            creator.reconnection.checkStreams();
            loop.runPending();
            loop.advance(1000);
        }

        assertThat(requestedAt).containsExactly(start + 3000, start + 8000, start + 13_000);
    }
}
