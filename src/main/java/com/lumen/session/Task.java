package com.lumen.session;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * One queued unit of work for a session.
 *
 * {@code body} is the evaluation itself and receives the task's cancellation token; {@code ack} runs afterwards (on the same worker)
 * only when the body was not interrupted. The task id is the id of the request that
 * produced it and is what interrupt requests are matched against.
 *
 * A task that never gets to run because its session was closed is discarded instead:
 * {@code discarded} runs exactly once in its place.
 */
public final class Task implements Runnable {

    private static final int NEW = 0;
    private static final int RUNNING = 1;
    private static final int DISCARDED = 2;

    private final String id;
    private final Session session;
    private final Consumer<CancellationToken> body;
    private final Runnable ack;
    private final Runnable discarded;
    private final AtomicInteger state = new AtomicInteger(NEW);

    public Task(String id, Session session, Consumer<CancellationToken> body, Runnable ack) {
        this(id, session, body, ack, null);
    }

    public Task(String id, Session session, Consumer<CancellationToken> body, Runnable ack, Runnable discarded) {
        if (session == null) throw new IllegalArgumentException("session is null");
        if (body == null) throw new IllegalArgumentException("body is null");
        this.id = id;
        this.session = session;
        this.body = body;
        this.ack = ack;
        this.discarded = discarded;
    }

    public String id() { return id; }
    public Session session() { return session; }

    /**
     * Runs the body inside the session's interrupt slot, then the ack unless the slot
     * reports the task was interrupted. Runs at most once; a discarded task does nothing.
     */
    @Override
    public void run() {
        if (!state.compareAndSet(NEW, RUNNING)) {
            if (state.get() == DISCARDED) return;
            throw new IllegalStateException("task " + id + " already ran");
        }
        InterruptSlot slot = session.interruptSlot();
        CancellationToken token = slot.begin(id);
        // Closing marks the queue before interrupting, so a task that misses the mark is
        // already in the slot when the interrupt arrives.
        boolean closed = session.queue().isClosed();
        boolean interrupted;
        try {
            if (!closed) body.accept(token);
        } finally {
            interrupted = slot.end();
        }
        if (interrupted) return;
        if (closed) {
            if (discarded != null) discarded.run();
        } else if (ack != null) {
            ack.run();
        }
    }

    /** Give up on a task that has not started. Returns false if it already ran or was discarded. */
    boolean discard() {
        if (!state.compareAndSet(NEW, DISCARDED)) return false;
        if (discarded != null) discarded.run();
        return true;
    }

    @Override
    public String toString() {
        return "Task[" + id + "@" + session.id() + "]";
    }
}
