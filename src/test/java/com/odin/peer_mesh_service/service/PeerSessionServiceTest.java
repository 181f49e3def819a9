package com.odin.peer_mesh_service.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.odin.peer_mesh_service.dto.ParticipantSnapshot;
import com.odin.peer_mesh_service.dto.SessionError;
import com.odin.peer_mesh_service.dto.SessionSnapshot;
import com.odin.peer_mesh_service.enums.FailureReason;
import com.odin.peer_mesh_service.enums.SessionErrorCode;
import com.odin.peer_mesh_service.support.ManualControlLoop;
import com.odin.peer_mesh_service.support.TestNode;
import com.odin.peer_mesh_service.transport.local.LocalTransportHub;

class PeerSessionServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ManualControlLoop loop;
    private LocalTransportHub hub;

    @BeforeEach
    void setUp() {
        loop = new ManualControlLoop();
        hub = new LocalTransportHub();
    }

    @Test
    void creatorJoinPublishesOpenSession() {
        TestNode alice = new TestNode(hub, loop);

        SessionSnapshot joined = alice.facade.join("weekly", true, "Alice");
        loop.runPending();

        assertThat(joined.getSelfId()).isEqualTo("weekly-creator");
        assertThat(joined.isJoined()).isTrue();
        assertThat(joined.isCreator()).isTrue();
        assertThat(alice.session.isOpen()).isTrue();
        assertThat(hub.isRegistered("weekly-creator")).isTrue();
        SessionSnapshot latest = alice.facade.getSnapshot();
        assertThat(latest.getUsername()).isEqualTo("Alice");
        assertThat(latest.isAudioEnabled()).isTrue();
        assertThat(latest.isVideoEnabled()).isTrue();
        assertThat(latest.isCanStartScreenShare()).isTrue();
        assertThat(latest.getParticipants()).isEmpty();
    }

    @Test
    void joinerIdUsesRoomAndClock() {
        TestNode alice = new TestNode(hub, loop).join("weekly", true, "Alice");
        TestNode bob = new TestNode(hub, loop).join("weekly", false, "Bob");

        assertThat(bob.id()).isEqualTo("weekly-" + (ManualControlLoop.START_MILLIS + 1));
        loop.advance(2000);
        assertThat(bob.facade.getSnapshot().getParticipants())
                .extracting(ParticipantSnapshot::getId, ParticipantSnapshot::getUsername, ParticipantSnapshot::isCreator)
                .containsExactly(tuple(alice.id(), "Alice", true));
    }

    @Test
    void blankUsernameFallsBackToGuest() {
        TestNode alice = new TestNode(hub, loop).join("weekly", true, " ");

        assertThat(alice.session.getUsername()).isEqualTo("Guest");
    }

    @Test
    void blankRoomIsRejected() {
        TestNode alice = new TestNode(hub, loop);

        assertThatThrownBy(() -> alice.facade.join("  ", true, "Alice"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(alice.session.isJoined()).isFalse();
    }

    @Test
    void joiningTwiceIsRejected() {
        TestNode alice = new TestNode(hub, loop).join("weekly", true, "Alice");

        assertThatThrownBy(() -> alice.facade.join("other", true, "Alice"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void missingDevicesLeaveSessionUnjoined() {
        TestNode alice = new TestNode(hub, loop);
        alice.devices.setCameraAvailable(false);
        alice.devices.setMicrophoneAvailable(false);

        SessionSnapshot snapshot = alice.facade.join("weekly", true, "Alice");
        loop.runPending();

        assertThat(snapshot.isJoined()).isFalse();
        assertThat(snapshot.getError().getCode()).isEqualTo(SessionErrorCode.MEDIA_UNAVAILABLE);
        assertThat(snapshot.getError().getReason()).isEqualTo(FailureReason.DEVICE_NOT_FOUND);
        assertThat(hub.isRegistered("weekly-creator")).isFalse();
    }

    @Test
    void cameraMissingFallsBackToAudioOnly() {
        TestNode alice = new TestNode(hub, loop);
        alice.devices.setCameraAvailable(false);

        SessionSnapshot snapshot = alice.facade.join("weekly", true, "Alice");

        assertThat(snapshot.isJoined()).isTrue();
        assertThat(snapshot.isAudioOnly()).isTrue();
        assertThat(snapshot.isVideoEnabled()).isFalse();
    }

    @Test
    void secondCreatorOfSameRoomGetsRoomTaken() {
        new TestNode(hub, loop).join("weekly", true, "Alice");
        TestNode impostor = new TestNode(hub, loop);

        impostor.facade.join("weekly", true, "Mallory");
        loop.runPending();

        assertThat(impostor.sink.errors).hasSize(1);
        SessionError error = impostor.sink.errors.get(0);
        assertThat(error.getCode()).isEqualTo(SessionErrorCode.ROOM_TAKEN);
        assertThat(error.getReason()).isEqualTo(FailureReason.NOT_ALLOWED);
        assertThat(impostor.session.isJoined()).isFalse();
        assertThat(impostor.facade.getSnapshot().isJoined()).isFalse();
        assertThat(impostor.facade.getSnapshot().getError()).isEqualTo(error);
    }

    @Test
    void chatMessageReachesOtherPeers() {
        TestNode alice = new TestNode(hub, loop).join("weekly", true, "Alice");
        TestNode bob = new TestNode(hub, loop).join("weekly", false, "Bob");
        loop.advance(2000);
        ObjectNode chat = mapper.createObjectNode()
                .put("type", "chat-message")
                .put("sender", "Alice")
                .put("text", "hello");

        int sent = alice.facade.sendToAll(chat);
        loop.runPending();

        assertThat(sent).isEqualTo(1);
        List<JsonNode> chats = ofType(bob, "chat-message");
        assertThat(chats).hasSize(1);
        assertThat(chats.get(0).get("text").asText()).isEqualTo("hello");
        assertThat(chats.get(0).get("timestamp").asLong()).isEqualTo(loop.now());
        assertThat(bob.sink.dataSenders).contains(alice.id());
    }

    @Test
    void customMessageTypesPassThrough() {
        TestNode alice = new TestNode(hub, loop).join("weekly", true, "Alice");
        TestNode bob = new TestNode(hub, loop).join("weekly", false, "Bob");
        loop.advance(2000);
        ObjectNode reaction = mapper.createObjectNode().put("type", "emoji-reaction").put("emoji", "clap");

        bob.facade.sendToAll(reaction);
        loop.runPending();

        List<JsonNode> reactions = ofType(alice, "emoji-reaction");
        assertThat(reactions).hasSize(1);
        assertThat(reactions.get(0).get("emoji").asText()).isEqualTo("clap");
    }

    @Test
    void sendToAllRejectsUntypedMessage() {
        TestNode alice = new TestNode(hub, loop).join("weekly", true, "Alice");

        assertThatThrownBy(() -> alice.facade.sendToAll(mapper.createObjectNode().put("text", "hi")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void renameIsSeenByPeers() {
        TestNode alice = new TestNode(hub, loop).join("weekly", true, "Alice");
        TestNode bob = new TestNode(hub, loop).join("weekly", false, "Bob");
        loop.advance(2000);

        bob.facade.setUsername("Robert");
        loop.runPending();

        assertThat(alice.participant(bob.id()).getUsername()).isEqualTo("Robert");
        assertThat(bob.facade.getSnapshot().getUsername()).isEqualTo("Robert");
    }

    @Test
    void creatorRelaysNamesBetweenJoiners() {
        TestNode alice = new TestNode(hub, loop).join("weekly", true, "Alice");
        TestNode bob = new TestNode(hub, loop).join("weekly", false, "Bob");
        TestNode carol = new TestNode(hub, loop).join("weekly", false, "Carol");
        loop.advance(2000);

        assertThat(carol.participant(bob.id()).getUsername()).isEqualTo("Bob");
        assertThat(bob.participant(carol.id()).getUsername()).isEqualTo("Carol");
        assertThat(alice.participants.ids()).containsExactly(bob.id(), carol.id());
    }

    @Test
    void toggleMuteFlipsTracks() {
        TestNode alice = new TestNode(hub, loop).join("weekly", true, "Alice");

        assertThat(alice.facade.toggleAudio()).isFalse();
        assertThat(alice.facade.toggleVideo()).isFalse();
        loop.runPending();
        assertThat(alice.facade.getSnapshot().isAudioEnabled()).isFalse();
        assertThat(alice.facade.getSnapshot().isVideoEnabled()).isFalse();

        assertThat(alice.facade.toggleAudio()).isTrue();
    }

    @Test
    void toggleBeforeJoinIsRejected() {
        TestNode alice = new TestNode(hub, loop);

        assertThatThrownBy(alice.facade::toggleAudio).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void leaveReleasesEverything() {
        TestNode alice = new TestNode(hub, loop).join("weekly", true, "Alice");
        TestNode bob = new TestNode(hub, loop).join("weekly", false, "Bob");
        loop.advance(2000);
        String bobId = bob.id();

        SessionSnapshot left = bob.facade.leave();
        loop.advance(2000);

        assertThat(left.isJoined()).isFalse();
        assertThat(left.getParticipants()).isEmpty();
        assertThat(hub.isRegistered(bobId)).isFalse();
        assertThat(bob.registry.peerIds()).isEmpty();
        assertThat(bob.tasks.size()).isZero();
        assertThat(alice.participants.ids()).isEmpty();
        assertThat(alice.registry.peerIds()).isEmpty();
    }

    @Test
    void rejoinAfterLeave() {
        TestNode alice = new TestNode(hub, loop).join("weekly", true, "Alice");
        alice.facade.leave();
        loop.runPending();

        alice.join("weekly", true, "Alice");
        loop.runPending();

        assertThat(alice.session.isOpen()).isTrue();
        assertThat(hub.isRegistered("weekly-creator")).isTrue();
    }

    @Test
    void reconnectAllAsksCreatorForPeers() {
        TestNode alice = new TestNode(hub, loop).join("weekly", true, "Alice");
        TestNode bob = new TestNode(hub, loop).join("weekly", false, "Bob");
        TestNode carol = new TestNode(hub, loop).join("weekly", false, "Carol");
        loop.advance(2000);
        bob.connections.teardownPeer(carol.id());
        loop.advance(2000);
        assertThat(bob.registry.contains(carol.id())).isFalse();

        bob.facade.reconnectAll();
        loop.advance(2000);

        assertThat(bob.hasCameraFrom(carol)).isTrue();
        assertThat(bob.hasCameraFrom(alice)).isTrue();
    }

    private static List<JsonNode> ofType(TestNode node, String type) {
        return node.sink.data.stream()
                .filter(n -> type.equals(n.path("type").asText()))
                .collect(Collectors.toList());
    }
}
