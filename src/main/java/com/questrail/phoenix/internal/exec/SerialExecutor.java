package com.questrail.phoenix.internal.exec;

import com.questrail.phoenix.internal.time.WallClock;
import com.questrail.phoenix.observability.PhoenixErrorEvent;
import com.questrail.phoenix.observability.PhoenixObservabilitySink;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * SerialExecutor
 * =============================================================================
 * The socket's serialized context: a single-worker FIFO queue.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Tasks run one at a time, in submission order, on one worker</li>
 *   <li>A task that throws fails alone; the failure is reported to the
 *       observability sink and the next task runs normally</li>
 *   <li>Submission never blocks the caller (transport IO thread, timer thread)</li>
 * </ul>
 *
 * <p>The wrapped {@link Executor} must itself be single-worker and FIFO, e.g.
 * {@link Executors#newSingleThreadExecutor()}. This class adds failure isolation,
 * not ordering.</p>
 */
public final class SerialExecutor
{
    private final Executor worker;
    private final PhoenixObservabilitySink sink;
    private final WallClock wallClock;

    public SerialExecutor(Executor worker, PhoenixObservabilitySink sink, WallClock wallClock)
    {
        this.worker = Objects.requireNonNull(worker, "worker");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Creates the production worker: one daemon thread with the given name.
     */
    public static ExecutorService newWorker(String threadName)
    {
        Objects.requireNonNull(threadName, "threadName");
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Enqueue a task.
     *
     * @param label short description used when reporting a failure
     * @return {@code false} if the worker has been shut down and rejected the task
     */
    public boolean submit(String label, Runnable task)
    {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(task, "task");

        try {
            worker.execute(() -> runIsolated(label, task));
            return true;
        } catch (RejectedExecutionException e) {
            sink.onError(new PhoenixErrorEvent(wallClock.now(), "Task rejected after shutdown: " + label, e));
            return false;
        }
    }

    private void runIsolated(String label, Runnable task)
    {
        try {
            task.run();
        } catch (RuntimeException e) {
            sink.onError(new PhoenixErrorEvent(wallClock.now(), "Task failed: " + label, e));
        }
    }
}
