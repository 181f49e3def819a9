package com.odin.peer_mesh_service.service.handler;

import jakarta.annotation.PostConstruct;

import org.springframework.stereotype.Component;

import com.odin.peer_mesh_service.component.LocalSession;
import com.odin.peer_mesh_service.component.SessionChangeNotifier;
import com.odin.peer_mesh_service.component.SessionEventSink;
import com.odin.peer_mesh_service.dto.signal.ApplicationDataMessage;
import com.odin.peer_mesh_service.dto.signal.CameraStreamSentMessage;
import com.odin.peer_mesh_service.dto.signal.ChatMessage;
import com.odin.peer_mesh_service.dto.signal.RecordingStatusMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenShareConfirmedMessage;
import com.odin.peer_mesh_service.dto.signal.SignalMessage;
import com.odin.peer_mesh_service.dto.signal.UsernameMessage;
import com.odin.peer_mesh_service.service.SignalMessageRouter;
import com.odin.peer_mesh_service.utility.SignalCodec;

import lombok.extern.slf4j.Slf4j;

/**
 * Hands messages the orchestrator does not consume itself over to the
 * application layer.
 */
@Slf4j
@Component
public class ApplicationDataSignalHandler extends SignalHandlerAdapter {

    private final LocalSession session;
    private final SignalMessageRouter router;
    private final SignalCodec codec;
    private final SessionEventSink sink;
    private final SessionChangeNotifier notifier;

    public ApplicationDataSignalHandler(LocalSession session,
                                        SignalMessageRouter router,
                                        SignalCodec codec,
                                        SessionEventSink sink,
                                        SessionChangeNotifier notifier) {
        this.session = session;
        this.router = router;
        this.codec = codec;
        this.sink = sink;
        this.notifier = notifier;
    }

    @PostConstruct
    public void register() {
        router.addHandler(this);
    }

    @Override
    public void onChatMessage(String fromPeerId, ChatMessage message) {
        forward(fromPeerId, message);
    }

    @Override
    public void onRecordingStatus(String fromPeerId, RecordingStatusMessage message) {
        boolean recording = Boolean.TRUE.equals(message.getRecording());
        if (session.isRemoteRecording() != recording) {
            log.info("[APP] {} {} recording", message.getHost() != null ? message.getHost() : fromPeerId,
                    recording ? "started" : "stopped");
            session.setRemoteRecording(recording);
            notifier.changed();
        }
        forward(fromPeerId, message);
    }

    @Override
    public void onUsername(String fromPeerId, UsernameMessage message) {
        forward(fromPeerId, message);
    }

    @Override
    public void onScreenShareConfirmed(String fromPeerId, ScreenShareConfirmedMessage message) {
        forward(fromPeerId, message);
    }

    @Override
    public void onCameraStreamSent(String fromPeerId, CameraStreamSentMessage message) {
        forward(fromPeerId, message);
    }

    @Override
    public void onApplicationData(String fromPeerId, ApplicationDataMessage message) {
        forward(fromPeerId, message);
    }

    private void forward(String fromPeerId, SignalMessage message) {
        sink.dataReceived(fromPeerId, codec.toNode(message));
    }
}
