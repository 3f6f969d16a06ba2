package com.lumen.script;

import java.util.concurrent.CancellationException;

/** Raised at a safe point once the running evaluation has been asked to stop. */
public class EvaluationCancelledException extends CancellationException {
    public EvaluationCancelledException() {
        super("evaluation interrupted");
    }
}
