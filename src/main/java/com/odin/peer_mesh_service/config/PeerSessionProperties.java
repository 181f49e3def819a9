package com.odin.peer_mesh_service.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Timing and recording settings of the peer session orchestrator.
 *
 * All values are externalized in application.properties under
 * {@code peer.session}. Delays are in milliseconds.
 */
@Data
@ConfigurationProperties(prefix = "peer.session")
public class PeerSessionProperties {

    /**
     * Interval between attempts to reach the room creator while joining.
     *
     * Default: 3000
     */
    private long joinRetryIntervalMs = 3000;

    /**
     * Attempts to reach the room creator before the join fails with
     * HOST_UNREACHABLE.
     *
     * Default: 5
     */
    private int joinMaxAttempts = 5;

    /**
     * Time a connecting/reconnecting hint stays before it flips to connected.
     *
     * Default: 1000
     */
    private long transitionDelayMs = 1000;

    /**
     * Time a disconnecting participant stays visible before removal.
     *
     * Default: 800
     */
    private long removalDelayMs = 800;

    /**
     * Pause between the sharing status broadcast and the first screen channel.
     *
     * Default: 300
     */
    private long screenStatusDelayMs = 300;

    /**
     * Stagger between screen channels to different peers.
     *
     * Default: 200
     */
    private long screenChannelStaggerMs = 200;

    /**
     * Stagger between per-peer camera repairs after a share stops.
     *
     * Default: 150
     */
    private long cameraRepairStaggerMs = 150;

    /**
     * Pause between a share stopping and the camera repair round.
     *
     * Default: 300
     */
    private long cameraRestoreDelayMs = 300;

    /**
     * Delay before a sharer calls a late joiner with its screen.
     *
     * Default: 500
     */
    private long lateJoinerScreenDelayMs = 500;

    private long streamUpdateUrgentDelayMs = 50;

    private long streamUpdateDelayMs = 100;

    private long fullReconnectDelayMs = 100;

    private long reconnectAfterScreenShareDelayMs = 200;

    private long screenShareStartedRefreshDelayMs = 300;

    private long screenShareStartedConnectDelayMs = 200;

    /**
     * Interval between camera refresh requests while a restored camera
     * stream has not arrived.
     *
     * Default: 2000
     */
    private long cameraRestoreRetryIntervalMs = 2000;

    private int cameraRestoreMaxRetries = 3;

    /**
     * Delay before re-establishing a lost media channel.
     *
     * Default: 1000
     */
    private long reconnectDelayMs = 1000;

    /**
     * Time an outbound primary media channel may take to deliver a stream.
     *
     * Default: 10000
     */
    private long connectTimeoutMs = 10000;

    /**
     * Failed reconnect attempts after which relay is forced and the session
     * restarted.
     *
     * Default: 2
     */
    private int relayAfterFailures = 2;

    /**
     * Failed reconnect attempts after which the peer is given up.
     *
     * Default: 5
     */
    private int maxReconnectAttempts = 5;

    private long streamInactivityGraceMs = 3000;

    private long watchdogIntervalMs = 1000;

    /**
     * Screen refresh requests sent before screen recovery pauses.
     *
     * Default: 3
     */
    private int screenRecoveryMaxAttempts = 3;

    private long screenRecoveryCooldownMs = 5000;

    /**
     * Interval of the creator's authoritative peer-list broadcast.
     *
     * Default: 10000
     */
    private long peerListBroadcastIntervalMs = 10000;

    /**
     * Stagger between connections opened by one reconcile pass.
     *
     * Default: 150
     */
    private long establishStaggerMs = 150;

    private Recording recording = new Recording();

    @Data
    public static class Recording {

        private int width = 1280;

        private int height = 720;

        private int frameRate = 15;

        /**
         * Period after which the spooled frames and audio are closed as a
         * chunk and handed to ffmpeg.
         *
         * Default: 1000
         */
        private long chunkIntervalMs = 1000;

        private int sampleRate = 48000;

        /**
         * Recordings smaller than this are reported as empty.
         *
         * Default: 1024
         */
        private long minBytes = 1024;

        /**
         * Directory recordings are written to.
         *
         * Default: ./recordings
         */
        private String outputDir = "./recordings";

        /**
         * ffmpeg binary, a name on the PATH or an absolute path.
         *
         * Default: ffmpeg
         */
        private String ffmpegPath = "ffmpeg";

        /**
         * Container of chunks and of the final file; also the file extension.
         *
         * Default: webm
         */
        private String container = "webm";

        private String videoCodec = "libvpx";

        private String audioCodec = "libopus";

        /**
         * How long stopping waits for chunks still being encoded.
         *
         * Default: 60000
         */
        private long encodeTimeoutMs = 60000;
    }
}
