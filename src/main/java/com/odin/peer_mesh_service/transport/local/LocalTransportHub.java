package com.odin.peer_mesh_service.transport.local;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import com.odin.peer_mesh_service.utility.ControlLoop;

import lombok.extern.slf4j.Slf4j;

/**
 * In-process rendezvous for {@link LocalTransportAdapter}s. Every node that
 * shares a hub can reach every other registered node. Links can be blocked
 * to emulate a broken direct path; a blocked link still carries traffic once
 * either side has forced relay for it.
 */
@Slf4j
public class LocalTransportHub {

    private final Map<String, LocalTransportAdapter> nodes = new ConcurrentHashMap<>();
    private final Set<String> blockedLinks = ConcurrentHashMap.newKeySet();
    private final Set<String> relayedLinks = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> restarts = new ConcurrentHashMap<>();
    private final AtomicLong channelSequence = new AtomicLong();

    public LocalTransportAdapter createAdapter(ControlLoop loop) {
        return new LocalTransportAdapter(this, loop);
    }

    boolean register(String peerId, LocalTransportAdapter adapter) {
        LocalTransportAdapter existing = nodes.putIfAbsent(peerId, adapter);
        if (existing != null && existing != adapter) {
            log.warn("[HUB] Peer id {} is already registered", peerId);
            return false;
        }
        log.info("[HUB] Registered {}", peerId);
        return true;
    }

    void unregister(String peerId, LocalTransportAdapter adapter) {
        if (nodes.remove(peerId, adapter)) {
            log.info("[HUB] Unregistered {}", peerId);
        }
    }

    LocalTransportAdapter find(String peerId) {
        return peerId == null ? null : nodes.get(peerId);
    }

    String nextChannelId(String prefix) {
        return prefix + "-" + channelSequence.incrementAndGet();
    }

    public boolean isRegistered(String peerId) {
        return nodes.containsKey(peerId);
    }

    /**
     * Blocks the direct path between two nodes. New channels over the link
     * stay pending until relay is forced; open channels are unaffected.
     */
    public void blockLink(String a, String b) {
        blockedLinks.add(linkKey(a, b));
        log.info("[HUB] Link {} <-> {} blocked", a, b);
    }

    public void unblockLink(String a, String b) {
        blockedLinks.remove(linkKey(a, b));
        log.info("[HUB] Link {} <-> {} unblocked", a, b);
    }

    /**
     * Blocks the link and closes every channel currently carried by it.
     */
    public void dropLink(String a, String b) {
        blockLink(a, b);
        LocalTransportAdapter left = find(a);
        if (left != null) {
            left.closeChannelsTo(b);
        }
        LocalTransportAdapter right = find(b);
        if (right != null) {
            right.closeChannelsTo(a);
        }
    }

    void forceRelay(String a, String b) {
        relayedLinks.add(linkKey(a, b));
    }

    void countRestart(String a, String b) {
        restarts.computeIfAbsent(linkKey(a, b), k -> new AtomicInteger()).incrementAndGet();
    }

    public boolean isRelayForced(String a, String b) {
        return relayedLinks.contains(linkKey(a, b));
    }

    public int getRestartCount(String a, String b) {
        AtomicInteger count = restarts.get(linkKey(a, b));
        return count == null ? 0 : count.get();
    }

    boolean isPassable(String a, String b) {
        String key = linkKey(a, b);
        return !blockedLinks.contains(key) || relayedLinks.contains(key);
    }

    private static String linkKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }
}
