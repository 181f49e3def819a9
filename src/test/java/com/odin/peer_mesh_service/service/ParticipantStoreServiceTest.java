package com.odin.peer_mesh_service.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.odin.peer_mesh_service.component.LocalSession;
import com.odin.peer_mesh_service.config.PeerSessionProperties;
import com.odin.peer_mesh_service.dto.Participant;
import com.odin.peer_mesh_service.dto.ParticipantSnapshot;
import com.odin.peer_mesh_service.enums.StreamType;
import com.odin.peer_mesh_service.enums.TransitionState;
import com.odin.peer_mesh_service.support.ManualControlLoop;
import com.odin.peer_mesh_service.transport.MediaStream;
import com.odin.peer_mesh_service.transport.MediaTrack;

class ParticipantStoreServiceTest {

    private static final String PEER = "room-1700000000001";

    private ManualControlLoop loop;
    private LocalSession session;
    private ParticipantStoreService participants;
    private int changes;

    @BeforeEach
    void setUp() {
        loop = new ManualControlLoop();
        session = new LocalSession();
        participants = new ParticipantStoreService(session, new ScheduledTaskTable(loop), new PeerSessionProperties());
        participants.addChangeListener(() -> changes++);
    }

    @Test
    void usernameChangeTouchesNothingElse() {
        MediaStream camera = stream("cam");
        participants.setCameraStream(PEER, camera);
        ParticipantSnapshot before = participants.snapshot().get(0);

        participants.applyUsername(PEER, "Alice");

        ParticipantSnapshot after = participants.snapshot().get(0);
        assertThat(after.getUsername()).isEqualTo("Alice");
        assertThat(after.getId()).isEqualTo(before.getId());
        assertThat(after.getStream()).isSameAs(camera);
        assertThat(after.getStreamType()).isEqualTo(before.getStreamType());
        assertThat(after.isScreenSharing()).isEqualTo(before.isScreenSharing());
        assertThat(after.getTransition()).isEqualTo(before.getTransition());
    }

    @Test
    void usernameForUnknownPeerIsAppliedOnArrival() {
        participants.applyUsername(PEER, "Bob");
        assertThat(participants.contains(PEER)).isFalse();

        Participant participant = participants.ensure(PEER);

        assertThat(participant.getUsername()).isEqualTo("Bob");
    }

    @Test
    void blankUsernameIsIgnored() {
        participants.ensure(PEER);
        int before = changes;

        participants.applyUsername(PEER, "  ");

        assertThat(participants.find(PEER).get().getUsername()).isEqualTo("Guest");
        assertThat(changes).isEqualTo(before);
    }

    @Test
    void keepsArrivalOrder() {
        participants.ensure("room-3");
        participants.ensure("room-creator");
        participants.ensure("room-1");

        assertThat(participants.ids()).containsExactly("room-3", "room-creator", "room-1");
        assertThat(participants.find("room-creator").get().isCreator()).isTrue();
    }

    @Test
    void screenSharingFlipsStreamTypeAndBack() {
        MediaStream camera = stream("cam");
        MediaStream screen = stream("screen");
        participants.setCameraStream(PEER, camera);

        participants.setScreenStream(PEER, screen);
        Participant participant = participants.find(PEER).get();
        assertThat(participant.getStreamType()).isEqualTo(StreamType.SCREEN);
        assertThat(participant.getStream()).isSameAs(screen);

        participants.applyScreenSharing(PEER, false);
        assertThat(participant.getStreamType()).isEqualTo(StreamType.CAMERA);
        assertThat(participant.getScreenStream()).isNull();
        assertThat(participant.getStream()).isSameAs(camera);
    }

    @Test
    void sharingWithoutScreenStreamStillShowsCamera() {
        MediaStream camera = stream("cam");
        participants.setCameraStream(PEER, camera);

        participants.applyScreenSharing(PEER, true);

        assertThat(participants.isAnyoneSharing()).isTrue();
        assertThat(participants.sharingIds()).containsExactly(PEER);
        assertThat(participants.find(PEER).get().getStream()).isSameAs(camera);
    }

    @Test
    void removalWaitsForDelayWhenTransitionsEnabled() {
        participants.ensure(PEER);

        participants.beginRemoval(PEER);

        assertThat(participants.find(PEER).get().getTransition()).isEqualTo(TransitionState.DISCONNECTING);
        loop.advance(799);
        assertThat(participants.contains(PEER)).isTrue();
        loop.advance(1);
        assertThat(participants.contains(PEER)).isFalse();
    }

    @Test
    void removalIsImmediateWhenTransitionsDisabled() {
        session.setTransitionsEnabled(false);
        participants.ensure(PEER);

        participants.beginRemoval(PEER);

        assertThat(participants.contains(PEER)).isFalse();
    }

    @Test
    void streamArrivalCancelsPendingRemoval() {
        participants.ensure(PEER);
        participants.beginRemoval(PEER);

        participants.setCameraStream(PEER, stream("cam"));
        loop.advance(5000);

        assertThat(participants.contains(PEER)).isTrue();
    }

    @Test
    void connectingTransitionSettlesToConnected() {
        participants.ensure(PEER);

        participants.setTransition(PEER, TransitionState.CONNECTING);
        loop.advance(1000);

        assertThat(participants.find(PEER).get().getTransition()).isEqualTo(TransitionState.CONNECTED);
    }

    @Test
    void firstStreamStartsConnectingHint() {
        participants.setCameraStream(PEER, stream("cam"));

        assertThat(participants.find(PEER).get().getTransition()).isEqualTo(TransitionState.CONNECTING);
        loop.advance(1000);
        assertThat(participants.find(PEER).get().getTransition()).isEqualTo(TransitionState.CONNECTED);
    }

    @Test
    void noHintWhenTransitionsDisabled() {
        session.setTransitionsEnabled(false);

        participants.setCameraStream(PEER, stream("cam"));

        assertThat(participants.find(PEER).get().getTransition()).isNull();
    }

    @Test
    void returningPeerIsConnectedAgain() {
        participants.setCameraStream(PEER, stream("cam"));
        loop.advance(1000);
        participants.beginRemoval(PEER);

        participants.setCameraStream(PEER, stream("cam-2"));

        assertThat(participants.find(PEER).get().getTransition()).isEqualTo(TransitionState.CONNECTED);
        loop.advance(5000);
        assertThat(participants.contains(PEER)).isTrue();
    }

    @Test
    void screenFlagsForUnknownPeerAreIgnored() {
        participants.applyScreenSharing(PEER, true);
        participants.applyStreamType(PEER, StreamType.SCREEN);

        assertThat(participants.contains(PEER)).isFalse();
        assertThat(participants.isAnyoneSharing()).isFalse();
        assertThat(changes).isZero();
    }

    @Test
    void snapshotIsImmutableCopy() {
        participants.ensure(PEER);
        List<ParticipantSnapshot> published = participants.snapshot();

        participants.applyUsername(PEER, "Carol");

        assertThat(published.get(0).getUsername()).isEqualTo("Guest");
        assertThat(participants.snapshot().get(0).getUsername()).isEqualTo("Carol");
    }

    private static MediaStream stream(String id) {
        return new MediaStream(id, List.of(MediaTrack.audio(id + "-a", (count, rate) -> new float[count])));
    }
}
