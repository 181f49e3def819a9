package com.odin.peer_mesh_service.component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.springframework.stereotype.Component;

/**
 * Fan-out for "local session state changed" so that a fresh snapshot gets
 * published. Called on the control loop.
 */
@Component
public class SessionChangeNotifier {

    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void addListener(Runnable listener) {
        listeners.add(listener);
    }

    public void changed() {
        listeners.forEach(Runnable::run);
    }
}
