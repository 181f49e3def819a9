package com.odin.peer_mesh_service.service;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

import com.odin.peer_mesh_service.enums.TaskPurpose;
import com.odin.peer_mesh_service.utility.ControlLoop;

import lombok.extern.slf4j.Slf4j;

/**
 * Delayed tasks keyed by (peer, purpose). Scheduling under a key that already
 * holds a task cancels the older one, and a task whose entry was superseded
 * or cancelled never runs. Only touched from the control loop.
 */
@Slf4j
public class ScheduledTaskTable {

    private final ControlLoop loop;
    private final Map<TaskKey, Entry> entries = new HashMap<>();
    private long sequence;

    public ScheduledTaskTable(ControlLoop loop) {
        this.loop = loop;
    }

    public void schedule(String peerId, TaskPurpose purpose, Duration delay, Runnable task) {
        TaskKey key = new TaskKey(peerId, purpose);
        Entry previous = entries.remove(key);
        if (previous != null) {
            previous.handle.cancel();
            log.debug("Superseded task {} for {}", purpose, peerId);
        }
        long id = ++sequence;
        Entry entry = new Entry(id);
        entries.put(key, entry);
        entry.handle = loop.schedule(() -> fire(key, id, task), delay);
    }

    public void schedule(String peerId, TaskPurpose purpose, long delayMs, Runnable task) {
        schedule(peerId, purpose, Duration.ofMillis(delayMs), task);
    }

    private void fire(TaskKey key, long id, Runnable task) {
        Entry current = entries.get(key);
        if (current == null || current.id != id) {
            return;
        }
        entries.remove(key);
        task.run();
    }

    public boolean cancel(String peerId, TaskPurpose purpose) {
        Entry entry = entries.remove(new TaskKey(peerId, purpose));
        if (entry == null) {
            return false;
        }
        entry.handle.cancel();
        return true;
    }

    public void cancelAll(String peerId) {
        Iterator<Map.Entry<TaskKey, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<TaskKey, Entry> e = it.next();
            if (Objects.equals(e.getKey().peerId, peerId)) {
                e.getValue().handle.cancel();
                it.remove();
            }
        }
    }

    public void cancelEverything() {
        entries.values().forEach(e -> e.handle.cancel());
        entries.clear();
    }

    public boolean isScheduled(String peerId, TaskPurpose purpose) {
        return entries.containsKey(new TaskKey(peerId, purpose));
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry {
        private final long id;
        private ControlLoop.Handle handle;

        private Entry(long id) {
            this.id = id;
        }
    }

    private static final class TaskKey {
        private final String peerId;
        private final TaskPurpose purpose;

        private TaskKey(String peerId, TaskPurpose purpose) {
            this.peerId = peerId;
            this.purpose = purpose;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof TaskKey)) return false;
            TaskKey other = (TaskKey) o;
            return Objects.equals(peerId, other.peerId) && purpose == other.purpose;
        }

        @Override
        public int hashCode() {
            return Objects.hash(peerId, purpose);
        }
    }
}
