package com.lumen.session;

import com.lumen.debug.Debug;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-session FIFO of tasks, executed one at a time on a shared executor.
 *
 * The queue state is an immutable {@link TaskQueue} swapped by compare-and-set, so
 * submitting never blocks. The head of the queue is the task that is running (or about
 * to run). Whoever moves the queue from empty to non-empty schedules the head; when a
 * task finishes, its runner pops it and schedules the next head, if any.
 *
 * Closing swaps the state to null for good: queued tasks are discarded, and so is
 * anything submitted afterwards.
 */
public final class SessionQueue {

    private static final String TAG = "SessionQueue";

    private final String sessionId;
    private final Executor executor;
    private final AtomicReference<TaskQueue<Task>> queue = new AtomicReference<>(TaskQueue.empty());

    public SessionQueue(String sessionId, Executor executor) {
        if (executor == null) throw new IllegalArgumentException("executor is null");
        this.sessionId = sessionId;
        this.executor = executor;
    }

    /** Enqueue and return immediately. On a closed queue the task is discarded. */
    public void submit(Task task) {
        if (task == null) throw new IllegalArgumentException("task is null");
        while (true) {
            TaskQueue<Task> q = queue.get();
            if (q == null) {
                task.discard();
                return;
            }
            if (queue.compareAndSet(q, q.enqueue(task))) {
                if (q.isEmpty()) schedule(task);
                return;
            }
        }
    }

    /**
     * Stop executing: every task that has not started is discarded. The running task, if
     * any, is left alone. Returns the number of tasks discarded.
     */
    public int close() {
        TaskQueue<Task> dropped = queue.getAndSet(null);
        if (dropped == null) return 0;
        int n = discardAll(dropped);
        if (n > 0) Debug.get().d(TAG, "discarded " + n + " queued task(s) of closed session " + sessionId);
        return n;
    }

    public boolean isClosed() {
        return queue.get() == null;
    }

    /** Tasks queued including the one executing. */
    public int pending() {
        TaskQueue<Task> q = queue.get();
        return (q == null) ? 0 : q.size();
    }

    public boolean isIdle() {
        TaskQueue<Task> q = queue.get();
        return q == null || q.isEmpty();
    }

    private void schedule(Task task) {
        try {
            executor.execute(() -> runAndAdvance(task));
        } catch (RejectedExecutionException e) {
            Debug.get().w(TAG, "executor rejected " + task + "; dropping queued work for session " + sessionId, e);
            abandon();
        }
    }

    private void runAndAdvance(Task task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "task " + task + " failed", e);
        } finally {
            advance();
        }
    }

    private void advance() {
        while (true) {
            TaskQueue<Task> q = queue.get();
            if (q == null) return;
            TaskQueue<Task> next = q.pop();
            if (queue.compareAndSet(q, next)) {
                if (!next.isEmpty()) schedule(next.peek());
                return;
            }
        }
    }

    // The executor is gone (shutdown); nothing queued here can ever run.
    private void abandon() {
        while (true) {
            TaskQueue<Task> q = queue.get();
            if (q == null) return;
            if (queue.compareAndSet(q, TaskQueue.empty())) {
                int n = discardAll(q);
                if (n > 0) Debug.get().w(TAG, "abandoned " + n + " task(s) for session " + sessionId);
                return;
            }
        }
    }

    private static int discardAll(TaskQueue<Task> tasks) {
        int n = 0;
        for (TaskQueue<Task> q = tasks; !q.isEmpty(); q = q.pop()) {
            if (q.peek().discard()) n++;
        }
        return n;
    }
}
