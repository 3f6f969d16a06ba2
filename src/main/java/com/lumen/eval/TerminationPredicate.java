package com.lumen.eval;

import java.util.concurrent.CancellationException;

/**
 * Decides which throwables end an evaluation silently (no value, no error report).
 * Cancellation is always one of them; hosts can widen the set.
 */
@FunctionalInterface
public interface TerminationPredicate {

    boolean isSilent(Throwable t);

    /** Matches when the throwable or any of its causes is a cancellation or thread interrupt. */
    static TerminationPredicate cancellation() {
        return t -> {
            for (Throwable c = t; c != null; c = (c.getCause() == c) ? null : c.getCause()) {
                if (c instanceof CancellationException || c instanceof InterruptedException) return true;
            }
            return false;
        };
    }

    default TerminationPredicate or(TerminationPredicate other) {
        return t -> isSilent(t) || other.isSilent(t);
    }
}
