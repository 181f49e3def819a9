package com.odin.peer_mesh_service.transport;

import java.util.Map;

/**
 * One audio/video call leg to a peer. Outbound channels are answered by the
 * remote side; inbound channels must be answered locally.
 */
public interface MediaChannel {

    String getChannelId();

    String getPeerId();

    boolean isOutbound();

    Map<String, String> getMetadata();

    MediaStream getLocalStream();

    /**
     * @return the remote stream, or {@code null} before it has arrived
     */
    MediaStream getRemoteStream();

    boolean isOpen();

    /**
     * Accepts an inbound channel. A {@code null} stream answers receive-only.
     */
    void answer(MediaStream localStream);

    void close();

    void setListener(MediaChannelListener listener);
}
