package com.lumen.session;

/** Result of {@link InterruptSlot#interrupt(String)}. */
public final class InterruptOutcome {

    public enum Kind {
        /** The session is running a task with a different id. */
        NO_MATCH,
        /** The session is not running anything. */
        IDLE,
        /** The running task was signalled; {@link #taskId()} names it. */
        INTERRUPTED
    }

    private static final InterruptOutcome NO_MATCH = new InterruptOutcome(Kind.NO_MATCH, null);
    private static final InterruptOutcome IDLE = new InterruptOutcome(Kind.IDLE, null);

    private final Kind kind;
    private final String taskId;

    private InterruptOutcome(Kind kind, String taskId) {
        this.kind = kind;
        this.taskId = taskId;
    }

    public static InterruptOutcome noMatch() { return NO_MATCH; }
    public static InterruptOutcome idle() { return IDLE; }
    public static InterruptOutcome interrupted(String taskId) { return new InterruptOutcome(Kind.INTERRUPTED, taskId); }

    public Kind kind() { return kind; }
    public String taskId() { return taskId; }

    @Override
    public String toString() {
        return (kind == Kind.INTERRUPTED) ? "INTERRUPTED(" + taskId + ")" : kind.name();
    }
}
