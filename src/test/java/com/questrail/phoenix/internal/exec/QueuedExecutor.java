package com.questrail.phoenix.internal.exec;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;

/**
 * Deterministic single-worker executor for tests.
 *
 * Tasks are queued FIFO and run ONLY when {@link #runAll()} or
 * {@link #step()} is called, on the calling thread.
 */
public final class QueuedExecutor implements Executor {

    private final Deque<Runnable> queue = new ArrayDeque<>();

    @Override
    public void execute(Runnable command) {
        queue.addLast(command);
    }

    /**
     * Run exactly one queued task, if present.
     */
    public boolean step() {
        Runnable next = queue.pollFirst();
        if (next == null) {
            return false;
        }
        next.run();
        return true;
    }

    /**
     * Run until the queue is empty, including tasks enqueued while running.
     */
    public void runAll() {
        while (step()) {
            // Intentionally empty.
        }
    }

    public int queuedCount() {
        return queue.size();
    }
}
