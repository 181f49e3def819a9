package com.odin.peer_mesh_service.service;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.springframework.stereotype.Service;

import com.odin.peer_mesh_service.dto.signal.SignalMessage;
import com.odin.peer_mesh_service.service.handler.SignalHandler;
import com.odin.peer_mesh_service.transport.ControlChannel;
import com.odin.peer_mesh_service.utility.ControlLoop;
import com.odin.peer_mesh_service.utility.SignalCodec;

import lombok.extern.slf4j.Slf4j;

/**
 * Decodes inbound control messages and offers each one to every registered
 * handler, in registration order. Also the single place outbound messages
 * are stamped and sent.
 */
@Slf4j
@Service
public class SignalMessageRouter {

    private final SignalCodec codec;
    private final ConnectionRegistryService registry;
    private final ControlLoop loop;
    private final List<SignalHandler> handlers = new CopyOnWriteArrayList<>();

    public SignalMessageRouter(SignalCodec codec, ConnectionRegistryService registry, ControlLoop loop) {
        this.codec = codec;
        this.registry = registry;
        this.loop = loop;
    }

    public void addHandler(SignalHandler handler) {
        handlers.add(handler);
    }

    public void dispatch(String fromPeerId, String payload) {
        SignalMessage message;
        try {
            message = codec.decode(payload);
        } catch (IOException e) {
            log.warn("[SIGNAL] Dropping undecodable message from {}: {}", fromPeerId, e.getMessage());
            return;
        }
        dispatch(fromPeerId, message);
    }

    public void dispatch(String fromPeerId, SignalMessage message) {
        log.debug("[SIGNAL] {} <- {}", message.getType(), fromPeerId);
        registry.touch(fromPeerId);
        for (SignalHandler handler : handlers) {
            try {
                message.accept(handler, fromPeerId);
            } catch (RuntimeException e) {
                log.error("[SIGNAL] {} failed on {} from {}: {}", handler.getClass().getSimpleName(),
                        message.getType(), fromPeerId, e.getMessage(), e);
            }
        }
    }

    /**
     * @return true when the message was handed to an open control channel
     */
    public boolean send(String peerId, SignalMessage message) {
        ControlChannel channel = registry.getControlChannel(peerId);
        if (channel == null || !channel.isOpen()) {
            log.debug("[SIGNAL] No open control channel to {}, {} not sent", peerId, message.getType());
            return false;
        }
        send(channel, message);
        return true;
    }

    public void send(ControlChannel channel, SignalMessage message) {
        stamp(message);
        channel.send(codec.encode(message));
        log.debug("[SIGNAL] {} -> {}", message.getType(), channel.getPeerId());
    }

    public int sendToAll(SignalMessage message) {
        return sendToAllExcept(null, message);
    }

    public int sendToAllExcept(String excludedPeerId, SignalMessage message) {
        stamp(message);
        String payload = codec.encode(message);
        int sent = 0;
        for (ControlChannel channel : registry.openControlChannels()) {
            if (channel.getPeerId().equals(excludedPeerId)) {
                continue;
            }
            channel.send(payload);
            sent++;
        }
        log.debug("[SIGNAL] {} broadcast to {} peers", message.getType(), sent);
        return sent;
    }

    private void stamp(SignalMessage message) {
        if (message.getTimestamp() == null) {
            message.setTimestamp(loop.now());
        }
    }
}
