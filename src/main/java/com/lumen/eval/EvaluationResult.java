package com.lumen.eval;

import com.lumen.session.BindingSnapshot;

/**
 * Outcome of one evaluation run: the bindings the session continues with, and whether
 * the engine already sent the request's terminal ({@code done}) response itself.
 */
public final class EvaluationResult {
    private final BindingSnapshot bindings;
    private final boolean terminalSent;

    public EvaluationResult(BindingSnapshot bindings, boolean terminalSent) {
        this.bindings = bindings;
        this.terminalSent = terminalSent;
    }

    public BindingSnapshot bindings() { return bindings; }

    public boolean terminalSent() { return terminalSent; }
}
