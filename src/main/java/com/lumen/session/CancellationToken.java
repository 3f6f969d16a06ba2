package com.lumen.session;

import com.lumen.script.EvaluationCancelledException;

/**
 * Cancellation signal of one running task.
 *
 * Cancelling sets the flag and interrupts the worker thread the task runs on, so blocking
 * waits inside the evaluation wake up. Once the task is detached the thread belongs to the
 * pool again and is never interrupted on this token's behalf.
 */
public final class CancellationToken {

    private volatile boolean cancelled;
    private Thread thread;

    CancellationToken(Thread thread) {
        this.thread = thread;
    }

    /** A token nobody can cancel, for evaluations that run outside a session queue. */
    public static CancellationToken none() {
        return new CancellationToken(null);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) throw new EvaluationCancelledException();
    }

    /**
     * Run {@code action} unless the token is cancelled. Cancelling waits for a running
     * action, so once {@link InterruptSlot#interrupt(String)} returns no further action runs.
     */
    public synchronized boolean runUnlessCancelled(Runnable action) {
        if (cancelled) return false;
        action.run();
        return true;
    }

    synchronized void cancel() {
        cancelled = true;
        if (thread != null) thread.interrupt();
    }

    /** Called on the task's own thread when it ends; clears any interrupt this token delivered. */
    synchronized void detach() {
        if (thread == Thread.currentThread() && cancelled) {
            Thread.interrupted();
        }
        thread = null;
    }
}
