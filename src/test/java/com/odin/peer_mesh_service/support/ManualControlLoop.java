package com.odin.peer_mesh_service.support;

import java.time.Duration;
import java.util.PriorityQueue;

import com.odin.peer_mesh_service.utility.ControlLoop;

/**
 * Deterministic {@link ControlLoop} for tests. Nothing runs until the test
 * calls {@link #runPending()} or {@link #advance(long)}; time only moves in
 * {@code advance}.
 */
public class ManualControlLoop implements ControlLoop {

    public static final long START_MILLIS = 1_700_000_000_000L;
    private static final int MAX_TASKS_PER_STEP = 100_000;

    private final PriorityQueue<Task> queue = new PriorityQueue<>();
    private long now = START_MILLIS;
    private long sequence;

    @Override
    public void execute(Runnable task) {
        queue.add(new Task(now, sequence++, task));
    }

    @Override
    public Handle schedule(Runnable task, Duration delay) {
        Task scheduled = new Task(now + Math.max(0, delay.toMillis()), sequence++, task);
        queue.add(scheduled);
        return scheduled;
    }

    @Override
    public long now() {
        return now;
    }

    @Override
    public boolean inLoop() {
        return true;
    }

    /**
     * Runs every task that is due, including tasks those tasks enqueue.
     */
    public void runPending() {
        int ran = 0;
        while (!queue.isEmpty() && queue.peek().dueAt <= now) {
            Task task = queue.poll();
            if (task.cancelled) {
                continue;
            }
            task.runnable.run();
            if (++ran > MAX_TASKS_PER_STEP) {
                throw new IllegalStateException("Control loop does not settle");
            }
        }
    }

    /**
     * Moves the clock forward, running due tasks in time order on the way.
     */
    public void advance(long millis) {
        long target = now + millis;
        runPending();
        while (!queue.isEmpty() && queue.peek().dueAt <= target) {
            now = Math.max(now, queue.peek().dueAt);
            runPending();
        }
        now = target;
        runPending();
    }

    public int pendingCount() {
        return (int) queue.stream().filter(t -> !t.cancelled).count();
    }

    private static final class Task implements Comparable<Task>, Handle {

        private final long dueAt;
        private final long seq;
        private final Runnable runnable;
        private boolean cancelled;

        private Task(long dueAt, long seq, Runnable runnable) {
            this.dueAt = dueAt;
            this.seq = seq;
            this.runnable = runnable;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public int compareTo(Task other) {
            int byTime = Long.compare(dueAt, other.dueAt);
            return byTime != 0 ? byTime : Long.compare(seq, other.seq);
        }
    }
}
