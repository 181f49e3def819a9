package com.odin.peer_mesh_service.controller;

import java.nio.file.Path;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.JsonNode;
import com.odin.peer_mesh_service.constants.ApplicationConstants;
import com.odin.peer_mesh_service.dto.JoinRequest;
import com.odin.peer_mesh_service.dto.ResponseDTO;
import com.odin.peer_mesh_service.dto.SessionSnapshot;
import com.odin.peer_mesh_service.dto.UsernameRequest;
import com.odin.peer_mesh_service.enums.Topology;
import com.odin.peer_mesh_service.exception.RecordingException;
import com.odin.peer_mesh_service.service.PeerSessionService;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping(ApplicationConstants.API_VERSION + ApplicationConstants.SESSION)
public class SessionController {

    private final PeerSessionService peerSessionService;

    public SessionController(PeerSessionService peerSessionService) {
        this.peerSessionService = peerSessionService;
    }

    /**
     * POST /v1/session/join
     * Registers the local participant in a room, as its creator or as a joiner.
     * A missing camera or microphone shows up as an error in the returned snapshot.
     */
    @PostMapping(ApplicationConstants.JOIN)
    public ResponseEntity<ResponseDTO> join(@RequestBody JoinRequest request) {
        log.info("API /join called roomId={}, creator={}", request.getRoomId(), request.isCreator());
        SessionSnapshot snapshot = peerSessionService.join(request.getRoomId(), request.isCreator(), request.getUsername());
        return ResponseEntity.ok(ResponseDTO.ok("Joining room " + request.getRoomId(), snapshot));
    }

    @PostMapping(ApplicationConstants.LEAVE)
    public ResponseEntity<ResponseDTO> leave() {
        log.info("API /leave called");
        return ResponseEntity.ok(ResponseDTO.ok("Left the room", peerSessionService.leave()));
    }

    @GetMapping(ApplicationConstants.SNAPSHOT)
    public ResponseEntity<ResponseDTO> snapshot() {
        return ResponseEntity.ok(ResponseDTO.ok("Current session", peerSessionService.getSnapshot()));
    }

    @PostMapping(ApplicationConstants.TOPOLOGY + "/{mode}")
    public ResponseEntity<ResponseDTO> setTopology(@PathVariable("mode") String mode) {
        Topology topology = Topology.fromValue(mode);
        log.info("API /topology called mode={}", topology);
        peerSessionService.setTopology(topology);
        return ResponseEntity.ok(ResponseDTO.ok("Topology set to " + topology.getValue(), null));
    }

    @PostMapping(ApplicationConstants.AUDIO_TOGGLE)
    public ResponseEntity<ResponseDTO> toggleAudio() {
        boolean enabled = peerSessionService.toggleAudio();
        return ResponseEntity.ok(ResponseDTO.ok(enabled ? "Audio enabled" : "Audio disabled", Map.of("enabled", enabled)));
    }

    @PostMapping(ApplicationConstants.VIDEO_TOGGLE)
    public ResponseEntity<ResponseDTO> toggleVideo() {
        boolean enabled = peerSessionService.toggleVideo();
        return ResponseEntity.ok(ResponseDTO.ok(enabled ? "Video enabled" : "Video disabled", Map.of("enabled", enabled)));
    }

    @PostMapping(ApplicationConstants.SCREEN_SHARE_START)
    public ResponseEntity<ResponseDTO> startScreenShare() {
        if (!peerSessionService.startScreenShare()) {
            throw new IllegalStateException("Screen share is not available right now");
        }
        return ResponseEntity.ok(ResponseDTO.ok("Screen share requested", null));
    }

    @PostMapping(ApplicationConstants.SCREEN_SHARE_STOP)
    public ResponseEntity<ResponseDTO> stopScreenShare() {
        peerSessionService.stopScreenShare();
        return ResponseEntity.ok(ResponseDTO.ok("Screen share stopped", null));
    }

    @PostMapping(ApplicationConstants.USERNAME)
    public ResponseEntity<ResponseDTO> setUsername(@RequestBody UsernameRequest request) {
        peerSessionService.setUsername(request.getUsername());
        return ResponseEntity.ok(ResponseDTO.ok("Username updated", null));
    }

    /**
     * POST /v1/session/broadcast
     * Sends any JSON object carrying a {@code type} to every connected peer.
     */
    @PostMapping(ApplicationConstants.BROADCAST)
    public ResponseEntity<ResponseDTO> broadcast(@RequestBody JsonNode message) {
        int sent = peerSessionService.sendToAll(message);
        log.info("API /broadcast type={} sent to {} peers", message.path(ApplicationConstants.FIELD_TYPE).asText(), sent);
        return ResponseEntity.ok(ResponseDTO.ok("Sent to " + sent + " peers", Map.of("peers", sent)));
    }

    @PostMapping(ApplicationConstants.RECONNECT)
    public ResponseEntity<ResponseDTO> reconnect() {
        peerSessionService.reconnectAll();
        return ResponseEntity.ok(ResponseDTO.ok("Reconnecting", null));
    }

    @PostMapping(ApplicationConstants.TRANSITIONS + "/{enabled}")
    public ResponseEntity<ResponseDTO> setTransitions(@PathVariable("enabled") boolean enabled) {
        peerSessionService.setTransitionsEnabled(enabled);
        return ResponseEntity.ok(ResponseDTO.ok("Transitions " + (enabled ? "enabled" : "disabled"), null));
    }

    @PostMapping(ApplicationConstants.RECORDING_START)
    public ResponseEntity<ResponseDTO> startRecording() throws RecordingException {
        peerSessionService.startRecording();
        return ResponseEntity.ok(ResponseDTO.ok("Recording started", null));
    }

    @PostMapping(ApplicationConstants.RECORDING_STOP)
    public ResponseEntity<ResponseDTO> stopRecording() throws RecordingException {
        Path file = peerSessionService.stopRecording();
        return ResponseEntity.ok(ResponseDTO.ok("Recording saved", Map.of("file", file.toString())));
    }
}
