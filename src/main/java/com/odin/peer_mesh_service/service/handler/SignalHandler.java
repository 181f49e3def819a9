package com.odin.peer_mesh_service.service.handler;

import com.odin.peer_mesh_service.dto.signal.ApplicationDataMessage;
import com.odin.peer_mesh_service.dto.signal.CameraStreamRestoredMessage;
import com.odin.peer_mesh_service.dto.signal.CameraStreamSentMessage;
import com.odin.peer_mesh_service.dto.signal.ChatMessage;
import com.odin.peer_mesh_service.dto.signal.NewPeerMessage;
import com.odin.peer_mesh_service.dto.signal.PeerDisconnectMessage;
import com.odin.peer_mesh_service.dto.signal.PeerListMessage;
import com.odin.peer_mesh_service.dto.signal.ReconnectAfterScreenShareMessage;
import com.odin.peer_mesh_service.dto.signal.RecordingStatusMessage;
import com.odin.peer_mesh_service.dto.signal.RequestFullReconnectMessage;
import com.odin.peer_mesh_service.dto.signal.RequestPeerListMessage;
import com.odin.peer_mesh_service.dto.signal.RequestScreenStreamMessage;
import com.odin.peer_mesh_service.dto.signal.RequestStreamUpdateMessage;
import com.odin.peer_mesh_service.dto.signal.RequestUsernameMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenShareConfirmedMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenShareRetryNeededMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenShareStartedMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenSharingStatusMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenSharingStreamMessage;
import com.odin.peer_mesh_service.dto.signal.StreamMetadataMessage;
import com.odin.peer_mesh_service.dto.signal.UsernameMessage;

/**
 * One method per control-message type. The router offers every decoded
 * message to every registered handler; a handler acts on the types it cares
 * about and ignores the rest. Adding a message type adds a method here, so
 * every handler has to decide about it.
 */
public interface SignalHandler {

    void onUsername(String fromPeerId, UsernameMessage message);

    void onRequestUsername(String fromPeerId, RequestUsernameMessage message);

    void onPeerList(String fromPeerId, PeerListMessage message);

    void onRequestPeerList(String fromPeerId, RequestPeerListMessage message);

    void onNewPeer(String fromPeerId, NewPeerMessage message);

    void onPeerDisconnect(String fromPeerId, PeerDisconnectMessage message);

    void onScreenSharingStatus(String fromPeerId, ScreenSharingStatusMessage message);

    void onScreenSharingStream(String fromPeerId, ScreenSharingStreamMessage message);

    void onScreenShareStarted(String fromPeerId, ScreenShareStartedMessage message);

    void onScreenShareRetryNeeded(String fromPeerId, ScreenShareRetryNeededMessage message);

    void onScreenShareConfirmed(String fromPeerId, ScreenShareConfirmedMessage message);

    void onStreamMetadata(String fromPeerId, StreamMetadataMessage message);

    void onRequestScreenStream(String fromPeerId, RequestScreenStreamMessage message);

    void onRequestStreamUpdate(String fromPeerId, RequestStreamUpdateMessage message);

    void onCameraStreamRestored(String fromPeerId, CameraStreamRestoredMessage message);

    void onCameraStreamSent(String fromPeerId, CameraStreamSentMessage message);

    void onReconnectAfterScreenShare(String fromPeerId, ReconnectAfterScreenShareMessage message);

    void onRequestFullReconnect(String fromPeerId, RequestFullReconnectMessage message);

    void onChatMessage(String fromPeerId, ChatMessage message);

    void onRecordingStatus(String fromPeerId, RecordingStatusMessage message);

    void onApplicationData(String fromPeerId, ApplicationDataMessage message);
}
