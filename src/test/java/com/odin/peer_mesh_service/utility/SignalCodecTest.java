package com.odin.peer_mesh_service.utility;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.odin.peer_mesh_service.dto.signal.ApplicationDataMessage;
import com.odin.peer_mesh_service.dto.signal.PeerListMessage;
import com.odin.peer_mesh_service.dto.signal.RecordingStatusMessage;
import com.odin.peer_mesh_service.dto.signal.ScreenSharingStatusMessage;
import com.odin.peer_mesh_service.dto.signal.SignalMessage;
import com.odin.peer_mesh_service.enums.StreamType;

class SignalCodecTest {

    private final SignalCodec codec = new SignalCodec();

    @Test
    void decodesKnownTypeIntoItsMessageClass() throws IOException {
        SignalMessage message = codec.decode(
                "{\"type\":\"screen-sharing-status\",\"peerId\":\"room-1\",\"isSharing\":true,"
                        + "\"streamType\":\"screen\",\"timestamp\":42}");

        assertThat(message).isInstanceOf(ScreenSharingStatusMessage.class);
        ScreenSharingStatusMessage status = (ScreenSharingStatusMessage) message;
        assertThat(status.getPeerId()).isEqualTo("room-1");
        assertThat(status.getSharing()).isTrue();
        assertThat(status.getStreamType()).isEqualTo(StreamType.SCREEN);
        assertThat(status.getTimestamp()).isEqualTo(42L);
    }

    @Test
    void encodesWireFieldNames() {
        JsonNode node = codec.toNode(new RecordingStatusMessage(true, "Alice"));

        assertThat(node.get("type").asText()).isEqualTo("recording-status");
        assertThat(node.get("isRecording").asBoolean()).isTrue();
        assertThat(node.get("host").asText()).isEqualTo("Alice");
        assertThat(node.has("timestamp")).isFalse();
    }

    @Test
    void peerListKeepsOrder() throws IOException {
        String payload = codec.encode(new PeerListMessage(List.of("r-creator", "r-2", "r-1")));

        PeerListMessage decoded = (PeerListMessage) codec.decode(payload);

        assertThat(decoded.getPeers()).containsExactly("r-creator", "r-2", "r-1");
    }

    @Test
    void unknownTypeIsKeptAsApplicationData() throws IOException {
        SignalMessage message = codec.decode("{\"type\":\"emoji-reaction\",\"emoji\":\"wave\"}");

        assertThat(message).isInstanceOf(ApplicationDataMessage.class);
        JsonNode node = codec.toNode(message);
        assertThat(node.get("type").asText()).isEqualTo("emoji-reaction");
        assertThat(node.get("emoji").asText()).isEqualTo("wave");
    }

    @Test
    void unknownFieldsOnKnownTypesAreIgnored() throws IOException {
        SignalMessage message = codec.decode("{\"type\":\"new-peer\",\"peerId\":\"r-9\",\"extra\":1}");

        assertThat(message.getType()).isEqualTo("new-peer");
    }

    @Test
    void rejectsPayloadWithoutType() {
        assertThatThrownBy(() -> codec.decode("{\"peerId\":\"r-1\"}"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no type");
    }

    @Test
    void rejectsNonObjectPayload() {
        assertThatThrownBy(() -> codec.decode("[1,2]")).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> codec.decode("not json")).isInstanceOf(IOException.class);
    }
}
