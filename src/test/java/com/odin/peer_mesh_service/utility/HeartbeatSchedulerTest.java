package com.odin.peer_mesh_service.utility;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.odin.peer_mesh_service.dto.signal.PeerListMessage;
import com.odin.peer_mesh_service.service.handler.SignalHandlerAdapter;
import com.odin.peer_mesh_service.support.ManualControlLoop;
import com.odin.peer_mesh_service.support.TestNode;
import com.odin.peer_mesh_service.transport.local.LocalTransportHub;

class HeartbeatSchedulerTest {

    private ManualControlLoop loop;
    private TestNode creator;
    private TestNode bob;
    private TestNode carol;
    private final List<List<String>> bobLists = new ArrayList<>();
    private final List<List<String>> creatorLists = new ArrayList<>();

    @BeforeEach
    void setUp() {
        loop = new ManualControlLoop();
        LocalTransportHub hub = new LocalTransportHub();
        creator = new TestNode(hub, loop).join("beat", true, "Alice");
        bob = new TestNode(hub, loop).join("beat", false, "Bob");
        carol = new TestNode(hub, loop).join("beat", false, "Carol");
        loop.advance(3000);
        bob.router.addHandler(listCollector(bobLists));
        creator.router.addHandler(listCollector(creatorLists));
    }

    @Test
    void creatorBroadcastsMembershipOnTheLoop() {
        HeartbeatScheduler scheduler = new HeartbeatScheduler(loop, creator.topology, creator.reconnection);

        scheduler.broadcastPeerList();
        assertThat(bobLists).isEmpty();
        loop.runPending();

        assertThat(bobLists).hasSize(1);
        assertThat(bobLists.get(0)).containsExactlyInAnyOrder(creator.id(), bob.id(), carol.id());
    }

    @Test
    void joinersDoNotBroadcast() {
        HeartbeatScheduler scheduler = new HeartbeatScheduler(loop, bob.topology, bob.reconnection);

        scheduler.broadcastPeerList();
        loop.advance(100);

        assertThat(creatorLists).isEmpty();
    }

    @Test
    void broadcastRestoresDroppedMeshLink() {
        bob.connections.teardownPeer(carol.id());
        carol.connections.teardownPeer(bob.id());
        loop.runPending();
        assertThat(bob.openControlChannelsTo(carol)).isZero();

        new HeartbeatScheduler(loop, creator.topology, creator.reconnection).broadcastPeerList();
        loop.advance(3000);

        assertThat(bob.openControlChannelsTo(carol) + carol.openControlChannelsTo(bob)).isPositive();
        assertThat(bob.hasCameraFrom(carol)).isTrue();
        assertThat(carol.hasCameraFrom(bob)).isTrue();
    }

    private static SignalHandlerAdapter listCollector(List<List<String>> lists) {
        return new SignalHandlerAdapter() {
            @Override
            public void onPeerList(String fromPeerId, PeerListMessage message) {
                lists.add(message.getPeers());
            }
        };
    }
}
