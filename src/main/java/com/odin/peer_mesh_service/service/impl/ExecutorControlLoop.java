package com.odin.peer_mesh_service.service.impl;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import com.odin.peer_mesh_service.utility.ControlLoop;
import com.odin.peer_mesh_service.utility.CorrelationIdUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link ControlLoop} backed by a single-threaded scheduled executor.
 */
@Slf4j
public class ExecutorControlLoop implements ControlLoop {

    private final ScheduledExecutorService executor;
    private volatile String contextId;
    private volatile Thread loopThread;

    public ExecutorControlLoop(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        if (executor.isShutdown()) {
            log.warn("Control loop is shut down, dropping task");
            return;
        }
        executor.execute(guard(task));
    }

    @Override
    public Handle schedule(Runnable task, Duration delay) {
        if (executor.isShutdown()) {
            log.warn("Control loop is shut down, dropping scheduled task");
            return new FutureHandle(null);
        }
        ScheduledFuture<?> future = executor.schedule(guard(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return new FutureHandle(future);
    }

    @Override
    public long now() {
        return System.currentTimeMillis();
    }

    @Override
    public void setContextId(String contextId) {
        this.contextId = contextId;
    }

    @Override
    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    public void shutdown() {
        log.info("Shutting down control loop");
        executor.shutdownNow();
    }

    private Runnable guard(Runnable task) {
        return () -> CorrelationIdUtil.wrap(contextId, () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Control loop task failed: {}", e.getMessage(), e);
            }
        }).run();
    }

    private static final class FutureHandle implements Handle {

        private final ScheduledFuture<?> future;
        private volatile boolean cancelled;

        private FutureHandle(ScheduledFuture<?> future) {
            this.future = future;
            this.cancelled = future == null;
        }

        @Override
        public void cancel() {
            cancelled = true;
            if (future != null) {
                future.cancel(false);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
