package com.odin.peer_mesh_service.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.odin.peer_mesh_service.component.RecordingChunk;
import com.odin.peer_mesh_service.enums.FailureReason;
import com.odin.peer_mesh_service.enums.SessionErrorCode;
import com.odin.peer_mesh_service.exception.RecordingException;
import com.odin.peer_mesh_service.support.ManualControlLoop;
import com.odin.peer_mesh_service.support.TestNode;
import com.odin.peer_mesh_service.transport.local.LocalTransportHub;

class RecordingServiceTest {

    @TempDir
    Path outputDir;

    private ManualControlLoop loop;
    private LocalTransportHub hub;
    private TestNode alice;

    @BeforeEach
    void setUp() {
        loop = new ManualControlLoop();
        hub = new LocalTransportHub();
        alice = new TestNode(hub, loop);
        alice.properties.getRecording().setOutputDir(outputDir.toString());
        alice.join("review", true, "Alice");
    }

    @AfterEach
    void tearDown() {
        alice.recording.discard();
    }

    @Test
    void joinerCannotRecord() {
        TestNode bob = new TestNode(hub, loop).join("review", false, "Bob");
        loop.advance(2000);

        assertThatThrownBy(bob.recording::startRecording)
                .isInstanceOf(RecordingException.class)
                .extracting("reason").isEqualTo(FailureReason.NOT_ALLOWED);
    }

    @Test
    void emptyRoomCannotBeRecorded() {
        assertThatThrownBy(alice.recording::startRecording)
                .isInstanceOf(RecordingException.class)
                .extracting("reason").isEqualTo(FailureReason.NO_PARTICIPANTS);
        assertThat(alice.recording.isRecording()).isFalse();
    }

    @Test
    void secondStartIsRefused() throws RecordingException {
        new TestNode(hub, loop).join("review", false, "Bob");
        loop.advance(2000);

        alice.recording.startRecording();

        assertThatThrownBy(alice.recording::startRecording)
                .isInstanceOf(RecordingException.class)
                .extracting("reason").isEqualTo(FailureReason.NOT_ALLOWED);
        assertThat(alice.recording.isRecording()).isTrue();
    }

    @Test
    void stopWithoutStartIsRefused() {
        assertThatThrownBy(alice.recording::stopRecording)
                .isInstanceOf(RecordingException.class)
                .extracting("reason").isEqualTo(FailureReason.NOT_ALLOWED);
    }

    @Test
    void tooSmallOutputIsNotWritten() throws RecordingException, IOException {
        new TestNode(hub, loop).join("review", false, "Bob");
        loop.advance(2000);
        alice.properties.getRecording().setMinBytes(50_000_000);

        alice.recording.startRecording();

        assertThatThrownBy(alice.recording::stopRecording)
                .isInstanceOf(RecordingException.class)
                .extracting("reason").isEqualTo(FailureReason.EMPTY_OUTPUT);
        assertThat(alice.recording.isRecording()).isFalse();
        try (var files = Files.list(outputDir)) {
            assertThat(files).isEmpty();
        }
        verify(alice.transcoder, never()).concat(anyList(), any(Path.class), any(Path.class));
    }

    @Test
    void recordingIsWrittenAndAnnounced() throws Exception {
        TestNode bob = new TestNode(hub, loop).join("review", false, "Bob");
        loop.advance(2000);
        long startedAt = loop.now();

        alice.recording.startRecording();
        loop.runPending();
        assertThat(bob.session.isRemoteRecording()).isTrue();
        assertThat(alice.facade.getSnapshot().isRecording()).isTrue();

        for (int i = 0; i < 3; i++) {
            loop.advance(500);
            alice.recording.captureFrame();
        }
        Path file = alice.recording.stopRecording();
        loop.runPending();

        assertThat(file.getFileName().toString()).isEqualTo("recording-review-" + startedAt + ".webm");
        assertThat(file.getParent()).isEqualTo(outputDir);
        verify(alice.transcoder, times(2)).encodeChunk(any(RecordingChunk.class), any(Path.class));
        assertThat(Files.size(file)).isEqualTo(2L * TestNode.SEGMENT_BYTES);
        try (var files = Files.list(outputDir)) {
            assertThat(files).containsExactly(file);
        }
        assertThat(bob.session.isRemoteRecording()).isFalse();
        assertThat(bob.sink.data)
                .filteredOn(n -> "recording-status".equals(n.path("type").asText()))
                .hasSize(2);
    }

    @Test
    void chunkIsSpooledWithOneAudioFilePerSource() throws Exception {
        new TestNode(hub, loop).join("review", false, "Bob");
        loop.advance(2000);
        List<Integer> audioFiles = new ArrayList<>();
        List<Integer> frames = new ArrayList<>();
        List<Path> dirs = new ArrayList<>();
        doAnswer(invocation -> {
            RecordingChunk chunk = invocation.getArgument(0);
            frames.add(chunk.getFrames());
            audioFiles.add(chunk.getAudioFiles().size());
            dirs.add(chunk.getDir());
            Files.write(invocation.getArgument(1, Path.class), new byte[TestNode.SEGMENT_BYTES]);
            return null;
        }).when(alice.transcoder).encodeChunk(any(RecordingChunk.class), any(Path.class));

        alice.recording.startRecording();
        alice.recording.captureFrame();
        alice.recording.stopRecording();

        assertThat(frames).hasSize(1);
        assertThat(frames.get(0)).isPositive();
        // local stream and Bob's camera
        assertThat(audioFiles).containsExactly(2);
        assertThat(dirs.get(0)).startsWith(outputDir).doesNotExist();
    }

    @Test
    void failedEncodingLeavesNothingToSave() throws Exception {
        new TestNode(hub, loop).join("review", false, "Bob");
        loop.advance(2000);
        doThrow(new IOException("ffmpeg exited with 1"))
                .when(alice.transcoder).encodeChunk(any(RecordingChunk.class), any(Path.class));

        alice.recording.startRecording();
        alice.recording.captureFrame();

        assertThatThrownBy(alice.recording::stopRecording)
                .isInstanceOf(RecordingException.class)
                .extracting("reason").isEqualTo(FailureReason.EMPTY_OUTPUT);
        try (var files = Files.list(outputDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void discardDropsRunningRecording() throws Exception {
        new TestNode(hub, loop).join("review", false, "Bob");
        loop.advance(2000);
        alice.recording.startRecording();
        alice.recording.captureFrame();

        alice.recording.discard();

        assertThat(alice.recording.isRecording()).isFalse();
        try (var files = Files.list(outputDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void facadeReportsRecordingFailure() {
        assertThatThrownBy(alice.facade::startRecording).isInstanceOf(RecordingException.class);

        assertThat(alice.sink.errors).hasSize(1);
        assertThat(alice.sink.errors.get(0).getCode()).isEqualTo(SessionErrorCode.RECORDING_FAILED);
        assertThat(alice.sink.errors.get(0).getReason()).isEqualTo(FailureReason.NO_PARTICIPANTS);
    }
}
