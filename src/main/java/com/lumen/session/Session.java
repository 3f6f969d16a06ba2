package com.lumen.session;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A persistent evaluation context: one binding snapshot, one execution queue, one
 * interrupt slot, the session's output writers and its input buffer.
 *
 * The binding snapshot is read at the start of a task and replaced at its end; the queue
 * guarantees those two steps never interleave with another task of the same session.
 */
public final class Session {

    private final String id;
    private final AtomicReference<BindingSnapshot> bindings;
    private final SessionQueue queue;
    private final InterruptSlot interruptSlot = new InterruptSlot();
    private final TransportWriter out = new TransportWriter("out");
    private final TransportWriter err = new TransportWriter("err");
    private final SessionInput in = new SessionInput();

    public Session(String id, BindingSnapshot initial, Executor executor) {
        if (id == null || id.isEmpty()) throw new IllegalArgumentException("session id required");
        this.id = id;
        this.queue = new SessionQueue(id, executor);
        this.bindings = new AtomicReference<>(
                (initial == null ? BindingSnapshot.empty() : initial)
                        .with(BindingSnapshot.OUT, out)
                        .with(BindingSnapshot.ERR, err)
                        .with(BindingSnapshot.IN, in));
    }

    public String id() { return id; }

    public BindingSnapshot bindings() { return bindings.get(); }

    public void setBindings(BindingSnapshot snapshot) {
        if (snapshot == null) throw new IllegalArgumentException("snapshot is null");
        bindings.set(snapshot);
    }

    public SessionQueue queue() { return queue; }

    public InterruptSlot interruptSlot() { return interruptSlot; }

    public TransportWriter out() { return out; }

    public TransportWriter err() { return err; }

    public SessionInput in() { return in; }

    /**
     * Stop this session: discard the tasks waiting in its queue, then interrupt the one
     * running, if any. Later submissions are discarded too.
     */
    public InterruptOutcome close() {
        queue.close();
        return interruptSlot.interrupt(null);
    }

    /** Queue {@code task} behind whatever this session is already doing. */
    public void submit(Task task) {
        if (task.session() != this) throw new IllegalArgumentException(task + " belongs to another session");
        queue.submit(task);
    }

    @Override
    public String toString() { return "Session[" + id + "]"; }
}
