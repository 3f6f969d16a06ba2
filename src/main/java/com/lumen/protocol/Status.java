package com.lumen.protocol;

/** Status keywords carried in the {@code status} field of responses. */
public final class Status {

    public static final String DONE = "done";
    public static final String ERROR = "error";
    public static final String EVAL_ERROR = "eval-error";
    public static final String INTERRUPTED = "interrupted";
    public static final String NEED_INPUT = "need-input";
    public static final String SESSION_IDLE = "session-idle";
    public static final String SESSION_CLOSED = "session-closed";
    public static final String INTERRUPT_ID_MISMATCH = "interrupt-id-mismatch";
    public static final String NAMESPACE_NOT_FOUND = "namespace-not-found";
    public static final String EVAL_NOT_FOUND = "eval-not-found";
    public static final String NO_CODE = "no-code";
    public static final String UNKNOWN_OP = "unknown-op";
    public static final String UNKNOWN_SESSION = "unknown-session";
    public static final String MIDDLEWARE_CONFIGURATION_ERROR = "middleware-configuration-error";

    private Status() {}
}
