package com.odin.peer_mesh_service.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.odin.peer_mesh_service.enums.Topology;
import com.odin.peer_mesh_service.support.ManualControlLoop;
import com.odin.peer_mesh_service.support.TestNode;
import com.odin.peer_mesh_service.transport.local.LocalTransportHub;

class TopologyServiceTest {

    private ManualControlLoop loop;
    private TestNode creator;
    private TestNode bob;
    private TestNode carol;

    @BeforeEach
    void setUp() {
        loop = new ManualControlLoop();
        LocalTransportHub hub = new LocalTransportHub();
        creator = new TestNode(hub, loop).join("standup", true, "Alice");
        bob = new TestNode(hub, loop).join("standup", false, "Bob");
        carol = new TestNode(hub, loop).join("standup", false, "Carol");
        loop.advance(2000);
    }

    @Test
    void meshConnectsEveryPair() {
        assertThat(bob.registry.peerIds()).containsExactlyInAnyOrder(creator.id(), carol.id());
        assertThat(carol.registry.peerIds()).containsExactlyInAnyOrder(creator.id(), bob.id());
        assertThat(bob.hasCameraFrom(carol)).isTrue();
        assertThat(carol.hasCameraFrom(bob)).isTrue();
        assertThat(bob.openControlChannelsTo(carol)).isEqualTo(1);
        assertThat(bob.openMediaChannelsTo(carol)).isEqualTo(1);
    }

    @Test
    void switchingToStarDropsNonCreatorPeers() {
        bob.facade.setTopology(Topology.STAR);
        loop.advance(2000);

        assertThat(bob.registry.peerIds()).containsExactly(creator.id());
        assertThat(bob.participants.ids()).containsExactly(creator.id());
        assertThat(bob.openMediaChannelsTo(carol)).isZero();
        assertThat(bob.hasCameraFrom(creator)).isTrue();
        assertThat(carol.participants.contains(bob.id())).isFalse();
    }

    @Test
    void starRejectsCallsFromOtherJoiners() {
        bob.facade.setTopology(Topology.STAR);
        loop.advance(2000);

        carol.connections.establishPeerConnection(bob.id());
        loop.advance(2000);

        assertThat(bob.registry.contains(carol.id())).isFalse();
        assertThat(bob.openMediaChannelsTo(carol)).isZero();
    }

    @Test
    void backToMeshReconnectsListedPeersExactlyOnce() {
        bob.facade.setTopology(Topology.STAR);
        loop.advance(2000);

        bob.facade.setTopology(Topology.MESH);
        loop.advance(2000);

        assertThat(bob.registry.peerIds()).containsExactlyInAnyOrder(creator.id(), carol.id());
        assertThat(bob.openControlChannelsTo(carol)).isEqualTo(1);
        assertThat(bob.openMediaChannelsTo(carol)).isEqualTo(1);
        assertThat(bob.openMediaChannelsTo(creator)).isEqualTo(1);
        assertThat(bob.hasCameraFrom(carol)).isTrue();
        assertThat(carol.hasCameraFrom(bob)).isTrue();
    }

    @Test
    void creatorKeepsEveryoneUnderStar() {
        creator.facade.setTopology(Topology.STAR);
        loop.advance(2000);

        assertThat(creator.registry.peerIds()).containsExactlyInAnyOrder(bob.id(), carol.id());
    }

    @Test
    void peerListContainsCreatorFirst() {
        assertThat(creator.topology.currentMembers())
                .containsExactly(creator.id(), bob.id(), carol.id());
    }
}
