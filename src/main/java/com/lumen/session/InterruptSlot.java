package com.lumen.session;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-session record of the task currently executing and its cancellation token.
 *
 * The whole record lives in one atomic reference. {@link #interrupt(String)} marks the
 * record by compare-and-set, so it can only succeed while the task is still active, and
 * {@link #end()} learns from the same record whether an interrupt won.
 */
public final class InterruptSlot {

    private static final class Active {
        final String taskId;
        final CancellationToken token;
        final boolean interrupted;

        Active(String taskId, CancellationToken token, boolean interrupted) {
            this.taskId = taskId;
            this.token = token;
            this.interrupted = interrupted;
        }
    }

    private final AtomicReference<Active> slot = new AtomicReference<>();

    /**
     * Record {@code taskId} as executing on the calling thread.
     *
     * @throws IllegalStateException if another task is still recorded (the session queue
     *         never lets that happen)
     */
    public CancellationToken begin(String taskId) {
        CancellationToken token = new CancellationToken(Thread.currentThread());
        if (!slot.compareAndSet(null, new Active(taskId, token, false))) {
            throw new IllegalStateException("session already has an active task: " + slot.get().taskId);
        }
        return token;
    }

    /**
     * Clear the slot. Returns true when the ending task had been interrupted, in which case
     * the interrupt path owns the task's terminal notification.
     */
    public boolean end() {
        Active a = slot.getAndSet(null);
        if (a == null) return false;
        a.token.detach();
        return a.interrupted;
    }

    /**
     * Try to interrupt the active task.
     *
     * @param requestedId id the caller wants interrupted; null matches whatever is running
     */
    public InterruptOutcome interrupt(String requestedId) {
        while (true) {
            Active a = slot.get();
            // An already-interrupted task has had its terminal notification.
            if (a == null || a.interrupted) return InterruptOutcome.idle();
            if (requestedId != null && !requestedId.equals(a.taskId)) return InterruptOutcome.noMatch();

            if (slot.compareAndSet(a, new Active(a.taskId, a.token, true))) {
                a.token.cancel();
                return InterruptOutcome.interrupted(a.taskId);
            }
        }
    }

    /** Id of the executing task; null when idle or when the task has no id. */
    public String activeId() {
        Active a = slot.get();
        return (a == null) ? null : a.taskId;
    }

    public boolean isActive() {
        return slot.get() != null;
    }
}
