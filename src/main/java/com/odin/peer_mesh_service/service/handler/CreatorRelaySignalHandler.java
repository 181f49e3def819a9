package com.odin.peer_mesh_service.service.handler;

import jakarta.annotation.PostConstruct;

import org.springframework.stereotype.Component;

import com.odin.peer_mesh_service.component.LocalSession;
import com.odin.peer_mesh_service.dto.signal.UsernameMessage;
import com.odin.peer_mesh_service.service.SignalMessageRouter;

import lombok.extern.slf4j.Slf4j;

/**
 * On the creator, fans username updates out to every other peer so that
 * nodes without a direct connection (star topology) still learn the name.
 */
@Slf4j
@Component
public class CreatorRelaySignalHandler extends SignalHandlerAdapter {

    private final LocalSession session;
    private final SignalMessageRouter router;

    public CreatorRelaySignalHandler(LocalSession session, SignalMessageRouter router) {
        this.session = session;
        this.router = router;
    }

    @PostConstruct
    public void register() {
        router.addHandler(this);
    }

    @Override
    public void onUsername(String fromPeerId, UsernameMessage message) {
        if (!session.isCreator() || message.getUsername() == null) {
            return;
        }
        String subject = message.getPeerId() != null ? message.getPeerId() : fromPeerId;
        if (session.isSelf(subject)) {
            return;
        }
        int sent = router.sendToAllExcept(fromPeerId, new UsernameMessage(message.getUsername(), subject));
        log.debug("[RELAY] Username of {} forwarded to {} peers", subject, sent);
    }
}
