package com.mediconnect.room;

import lombok.extern.slf4j.Slf4j;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serial delivery path of one room. Tasks run one at a time, in submission order, on a pool
 * shared by every room; at most one pool thread works on a given room at any moment, so rooms
 * proceed in parallel without a thread of their own.
 */
@Slf4j
public class RoomDispatcher {

    private static final int MAX_BATCH = 64;

    private final String roomId;
    private final Executor executor;
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private volatile boolean shutdown;

    public RoomDispatcher(String roomId, Executor executor) {
        this.roomId = roomId;
        this.executor = executor;
    }

    /**
     * @return false once the dispatcher has been shut down
     */
    public boolean submit(Runnable task) {
        if (shutdown) {
            return false;
        }
        queue.offer(task);
        schedule();
        return true;
    }

    /**
     * Stops accepting tasks. Tasks already queued, such as a room-closed notice, still run.
     */
    public void shutdown() {
        shutdown = true;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    int pending() {
        return queue.size();
    }

    private void schedule() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.error("Relay pool rejected work for room {}; {} task(s) left queued", roomId, queue.size());
        }
    }

    private void drain() {
        try {
            int ran = 0;
            Runnable task;
            while (ran < MAX_BATCH && (task = queue.poll()) != null) {
                ran++;
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Delivery task failed in room {}: {}", roomId, e.getMessage(), e);
                }
            }
        } finally {
            draining.set(false);
            if (!queue.isEmpty()) {
                schedule();
            }
        }
    }
}
