package com.odin.peer_mesh_service.utility;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.odin.peer_mesh_service.constants.ApplicationConstants;
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
import com.odin.peer_mesh_service.dto.signal.SignalMessage;
import com.odin.peer_mesh_service.dto.signal.StreamMetadataMessage;
import com.odin.peer_mesh_service.dto.signal.UsernameMessage;

import lombok.extern.slf4j.Slf4j;

/**
 * JSON codec for control-channel messages. Known types decode into their
 * {@link SignalMessage} subclass, anything else into an
 * {@link ApplicationDataMessage} carrying the raw tree.
 */
@Slf4j
@Component
public class SignalCodec {

    private static final Map<String, Class<? extends SignalMessage>> TYPES = new HashMap<>();

    static {
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_USERNAME, UsernameMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_REQUEST_USERNAME, RequestUsernameMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_PEER_LIST, PeerListMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_REQUEST_PEER_LIST, RequestPeerListMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_NEW_PEER, NewPeerMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_PEER_DISCONNECT, PeerDisconnectMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_SCREEN_SHARING_STATUS, ScreenSharingStatusMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_SCREEN_SHARING_STREAM, ScreenSharingStreamMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_SCREEN_SHARE_STARTED, ScreenShareStartedMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_SCREEN_SHARE_RETRY_NEEDED, ScreenShareRetryNeededMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_SCREEN_SHARE_CONFIRMED, ScreenShareConfirmedMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_STREAM_METADATA, StreamMetadataMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_REQUEST_SCREEN_STREAM, RequestScreenStreamMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_REQUEST_STREAM_UPDATE, RequestStreamUpdateMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_CAMERA_STREAM_RESTORED, CameraStreamRestoredMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_CAMERA_STREAM_SENT, CameraStreamSentMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_RECONNECT_AFTER_SCREEN_SHARE, ReconnectAfterScreenShareMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_REQUEST_FULL_RECONNECT, RequestFullReconnectMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_CHAT, ChatMessage.class);
        TYPES.put(ApplicationConstants.MESSAGE_TYPE_RECORDING_STATUS, RecordingStatusMessage.class);
    }

    private final ObjectMapper mapper;

    public SignalCodec() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public static boolean isKnownType(String type) {
        return TYPES.containsKey(type);
    }

    /**
     * @throws IOException when the payload is not a JSON object with a
     *                     textual {@code type}, or a known type is malformed
     */
    public SignalMessage decode(String payload) throws IOException {
        JsonNode node = mapper.readTree(payload);
        return fromNode(node);
    }

    public SignalMessage fromNode(JsonNode node) throws IOException {
        if (node == null || !node.isObject()) {
            throw new IOException("Control message is not a JSON object");
        }
        JsonNode typeNode = node.get(ApplicationConstants.FIELD_TYPE);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new IOException("Control message has no type");
        }
        String type = typeNode.asText();
        Class<? extends SignalMessage> target = TYPES.get(type);
        SignalMessage message;
        if (target == null) {
            message = new ApplicationDataMessage(type, node);
        } else {
            message = mapper.treeToValue(node, target);
        }
        JsonNode timestamp = node.get(ApplicationConstants.FIELD_TIMESTAMP);
        if (timestamp != null && timestamp.canConvertToLong()) {
            message.setTimestamp(timestamp.asLong());
        }
        return message;
    }

    public String encode(SignalMessage message) {
        try {
            return mapper.writeValueAsString(toNode(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode " + message.getType() + " message", e);
        }
    }

    public JsonNode toNode(SignalMessage message) {
        if (message instanceof ApplicationDataMessage) {
            ObjectNode node = ((ApplicationDataMessage) message).getPayload().deepCopy();
            node.put(ApplicationConstants.FIELD_TYPE, message.getType());
            if (message.getTimestamp() != null) {
                node.put(ApplicationConstants.FIELD_TIMESTAMP, message.getTimestamp());
            }
            return node;
        }
        return mapper.valueToTree(message);
    }

    public ObjectMapper getMapper() {
        return mapper;
    }
}
