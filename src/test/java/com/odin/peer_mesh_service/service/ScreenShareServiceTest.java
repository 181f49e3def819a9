package com.odin.peer_mesh_service.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.odin.peer_mesh_service.dto.Participant;
import com.odin.peer_mesh_service.dto.signal.CameraStreamRestoredMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenShareStartedMessage;
import com.odin.peer_mesh_service.enums.FailureReason;
import com.odin.peer_mesh_service.enums.SessionErrorCode;
import com.odin.peer_mesh_service.enums.StreamType;
import com.odin.peer_mesh_service.service.handler.SignalHandlerAdapter;
import com.odin.peer_mesh_service.support.ManualControlLoop;
import com.odin.peer_mesh_service.support.TestNode;
import com.odin.peer_mesh_service.transport.MediaChannel;
import com.odin.peer_mesh_service.transport.local.LocalTransportHub;

class ScreenShareServiceTest {

    private ManualControlLoop loop;
    private LocalTransportHub hub;
    private TestNode alice;
    private TestNode bob;

    @BeforeEach
    void setUp() {
        loop = new ManualControlLoop();
        hub = new LocalTransportHub();
        alice = new TestNode(hub, loop).join("demo", true, "Alice");
        bob = new TestNode(hub, loop).join("demo", false, "Bob");
        loop.advance(2000);
    }

    @Test
    void receiverSeesScreenAndThenCameraAgain() {
        assertThat(alice.facade.startScreenShare()).isTrue();
        loop.advance(2000);

        Participant sharer = bob.participant(alice.id());
        assertThat(sharer.isScreenSharing()).isTrue();
        assertThat(sharer.getStreamType()).isEqualTo(StreamType.SCREEN);
        assertThat(sharer.getStream()).isSameAs(alice.session.getScreenStream());
        assertThat(bob.facade.getSnapshot().getParticipants().get(0).getStreamType()).isEqualTo(StreamType.SCREEN);

        alice.facade.stopScreenShare();
        loop.advance(6000);

        sharer = bob.participant(alice.id());
        assertThat(sharer.isScreenSharing()).isFalse();
        assertThat(sharer.getStreamType()).isEqualTo(StreamType.CAMERA);
        assertThat(sharer.getScreenStream()).isNull();
        assertThat(bob.hasCameraFrom(alice)).isTrue();
        assertThat(bob.registry.getScreenChannel(alice.id())).isNull();
        assertThat(bob.openMediaChannelsTo(alice)).isEqualTo(1);
    }

    @Test
    void primaryChannelsAreUntouchedWhileSharing() {
        MediaChannel aliceCamera = alice.registry.getMediaChannel(bob.id());
        MediaChannel bobCamera = bob.registry.getMediaChannel(alice.id());

        alice.facade.startScreenShare();
        loop.advance(2000);

        assertThat(alice.registry.getMediaChannel(bob.id())).isSameAs(aliceCamera);
        assertThat(bob.registry.getMediaChannel(alice.id())).isSameAs(bobCamera);
        assertThat(bobCamera.isOpen()).isTrue();
        assertThat(alice.registry.getScreenChannel(bob.id())).isNotNull();
        assertThat(bob.participant(alice.id()).getCameraStream()).isSameAs(alice.session.getLocalStream());
    }

    @Test
    void sharerAnnouncesStartAndRestore() {
        List<String> seen = new ArrayList<>();
        bob.router.addHandler(new SignalHandlerAdapter() {
            @Override
            public void onScreenShareStarted(String fromPeerId, ScreenShareStartedMessage message) {
                seen.add("started:" + message.getSharingPeerId());
            }

            @Override
            public void onCameraStreamRestored(String fromPeerId, CameraStreamRestoredMessage message) {
                seen.add("restored:" + message.getPeerId());
            }
        });

        alice.facade.startScreenShare();
        loop.advance(2000);
        alice.facade.stopScreenShare();
        loop.advance(2000);

        assertThat(seen).containsExactly("started:" + alice.id(), "restored:" + alice.id());
    }

    @Test
    void secondSharerIsRefused() {
        alice.facade.startScreenShare();
        loop.advance(2000);

        assertThat(bob.screenShare.canStartScreenShare()).isFalse();
        assertThat(bob.facade.startScreenShare()).isFalse();
        assertThat(bob.session.isScreenSharing()).isFalse();
    }

    @Test
    void deniedCaptureRaisesError() {
        alice.devices.setDisplayAvailable(false);

        assertThat(alice.facade.startScreenShare()).isTrue();
        loop.runPending();

        assertThat(alice.session.isScreenSharing()).isFalse();
        assertThat(alice.sink.errors).hasSize(1);
        assertThat(alice.sink.errors.get(0).getCode()).isEqualTo(SessionErrorCode.SCREEN_SHARE_FAILED);
        assertThat(alice.sink.errors.get(0).getReason()).isEqualTo(FailureReason.PERMISSION_DENIED);
        assertThat(alice.screenShare.canStartScreenShare()).isTrue();
    }

    @Test
    void endingCaptureOutsideTheAppStopsSharing() {
        alice.facade.startScreenShare();
        loop.advance(2000);

        alice.session.getScreenStream().getVideoTracks().get(0).stop();
        loop.advance(6000);

        assertThat(alice.session.getScreenStream()).isNull();
        assertThat(bob.participant(alice.id()).isScreenSharing()).isFalse();
    }

    @Test
    void lateJoinerReceivesOngoingScreen() {
        alice.facade.startScreenShare();
        loop.advance(2000);

        TestNode carol = new TestNode(hub, loop).join("demo", false, "Carol");
        loop.advance(2000);

        Participant sharer = carol.participant(alice.id());
        assertThat(sharer.isScreenSharing()).isTrue();
        assertThat(sharer.getScreenStream()).isSameAs(alice.session.getScreenStream());
        assertThat(carol.hasCameraFrom(alice)).isTrue();
    }
}
