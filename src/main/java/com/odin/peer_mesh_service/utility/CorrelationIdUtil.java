package com.odin.peer_mesh_service.utility;

import org.slf4j.MDC;

import com.odin.peer_mesh_service.constants.ApplicationConstants;

public class CorrelationIdUtil {

    private CorrelationIdUtil() {
    }

    // Local peer id currently in the MDC
    public static String getPeerId() {
        return MDC.get(ApplicationConstants.MDC_PEER_ID);
    }

    public static void setPeerId(String peerId) {
        if (peerId == null) {
            clear();
            return;
        }
        MDC.put(ApplicationConstants.MDC_PEER_ID, peerId);
    }

    /**
     * Wraps a task so that it runs with the given peer id in the MDC.
     */
    public static Runnable wrap(String peerId, Runnable task) {
        return () -> {
            setPeerId(peerId);
            try {
                task.run();
            } finally {
                clear();
            }
        };
    }

    public static void clear() {
        MDC.remove(ApplicationConstants.MDC_PEER_ID);
    }
}
