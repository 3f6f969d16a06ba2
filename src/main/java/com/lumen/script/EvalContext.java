package com.lumen.script;

import java.io.Writer;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Dynamic context of one evaluation run: the current namespace (changed by {@code in-ns}),
 * the dynamic vars visible to code, the output writers, the input source and the
 * cancellation check.
 */
public final class EvalContext {
    private final ScriptRuntime runtime;
    private final Map<String, Object> dynamicVars;
    private final Writer out;
    private final Writer err;
    private final InputSource in;
    private final BooleanSupplier cancelled;
    private Namespace ns;

    public EvalContext(ScriptRuntime runtime, Namespace ns, Map<String, Object> dynamicVars,
                       Writer out, Writer err, BooleanSupplier cancelled) {
        this(runtime, ns, dynamicVars, out, err, null, cancelled);
    }

    public EvalContext(ScriptRuntime runtime, Namespace ns, Map<String, Object> dynamicVars,
                       Writer out, Writer err, InputSource in, BooleanSupplier cancelled) {
        if (runtime == null) throw new IllegalArgumentException("runtime is null");
        if (ns == null) throw new IllegalArgumentException("ns is null");
        this.runtime = runtime;
        this.ns = ns;
        this.dynamicVars = dynamicVars;
        this.out = out;
        this.err = err;
        this.in = in;
        this.cancelled = (cancelled == null) ? () -> false : cancelled;
    }

    public ScriptRuntime runtime() { return runtime; }
    public Namespace ns() { return ns; }
    public void setNs(Namespace ns) { this.ns = ns; }
    public Writer out() { return out; }
    public Writer err() { return err; }

    /** Null when the evaluation has no input attached. */
    public InputSource in() { return in; }

    /** Value of a dynamic var such as {@code *1}; null when unbound. */
    public Object dynamicVar(String name) {
        return (dynamicVars == null) ? null : dynamicVars.get(name);
    }

    public boolean hasDynamicVar(String name) {
        return dynamicVars != null && dynamicVars.containsKey(name);
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }

    /** Safe point. */
    public void checkCancelled() {
        if (cancelled.getAsBoolean()) throw new EvaluationCancelledException();
    }
}
