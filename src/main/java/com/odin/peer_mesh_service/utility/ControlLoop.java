package com.odin.peer_mesh_service.utility;

import java.time.Duration;

/**
 * Single logical actor that owns all orchestrator state. Every mutation of
 * the registry, the participant store and the task table happens inside a
 * task run by the loop, one task at a time.
 */
public interface ControlLoop {

    void execute(Runnable task);

    Handle schedule(Runnable task, Duration delay);

    /**
     * Current time in epoch milliseconds as seen by the loop.
     */
    long now();

    /**
     * Id attached to log lines produced by loop tasks.
     */
    default void setContextId(String contextId) {
    }

    /**
     * Whether the calling thread is the one running loop tasks.
     */
    boolean inLoop();

    interface Handle {

        void cancel();

        boolean isCancelled();
    }
}
