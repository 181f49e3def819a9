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
 * No-op base for handlers that only care about a few message types.
 */
public abstract class SignalHandlerAdapter implements SignalHandler {

    @Override
    public void onUsername(String fromPeerId, UsernameMessage message) {
    }

    @Override
    public void onRequestUsername(String fromPeerId, RequestUsernameMessage message) {
    }

    @Override
    public void onPeerList(String fromPeerId, PeerListMessage message) {
    }

    @Override
    public void onRequestPeerList(String fromPeerId, RequestPeerListMessage message) {
    }

    @Override
    public void onNewPeer(String fromPeerId, NewPeerMessage message) {
    }

    @Override
    public void onPeerDisconnect(String fromPeerId, PeerDisconnectMessage message) {
    }

    @Override
    public void onScreenSharingStatus(String fromPeerId, ScreenSharingStatusMessage message) {
    }

    @Override
    public void onScreenSharingStream(String fromPeerId, ScreenSharingStreamMessage message) {
    }

    @Override
    public void onScreenShareStarted(String fromPeerId, ScreenShareStartedMessage message) {
    }

    @Override
    public void onScreenShareRetryNeeded(String fromPeerId, ScreenShareRetryNeededMessage message) {
    }

    @Override
    public void onScreenShareConfirmed(String fromPeerId, ScreenShareConfirmedMessage message) {
    }

    @Override
    public void onStreamMetadata(String fromPeerId, StreamMetadataMessage message) {
    }

    @Override
    public void onRequestScreenStream(String fromPeerId, RequestScreenStreamMessage message) {
    }

    @Override
    public void onRequestStreamUpdate(String fromPeerId, RequestStreamUpdateMessage message) {
    }

    @Override
    public void onCameraStreamRestored(String fromPeerId, CameraStreamRestoredMessage message) {
    }

    @Override
    public void onCameraStreamSent(String fromPeerId, CameraStreamSentMessage message) {
    }

    @Override
    public void onReconnectAfterScreenShare(String fromPeerId, ReconnectAfterScreenShareMessage message) {
    }

    @Override
    public void onRequestFullReconnect(String fromPeerId, RequestFullReconnectMessage message) {
    }

    @Override
    public void onChatMessage(String fromPeerId, ChatMessage message) {
    }

    @Override
    public void onRecordingStatus(String fromPeerId, RecordingStatusMessage message) {
    }

    @Override
    public void onApplicationData(String fromPeerId, ApplicationDataMessage message) {
    }
}
