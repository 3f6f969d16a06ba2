package com.lumen.eval;

import com.lumen.debug.Debug;
import com.lumen.protocol.Message;
import com.lumen.protocol.Responses;
import com.lumen.protocol.Status;
import com.lumen.protocol.Transport;
import com.lumen.script.EvalContext;
import com.lumen.script.Fn;
import com.lumen.script.FormReader;
import com.lumen.script.InputSource;
import com.lumen.script.Namespace;
import com.lumen.script.ScriptRuntime;
import com.lumen.script.Var;
import com.lumen.session.BindingSnapshot;
import com.lumen.session.CancellationToken;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates the code of one {@code eval} request form by form.
 *
 * Every evaluated form produces a {@code {value, ns}} response; the first failing form
 * produces {@code {status: [eval-error], ex, root-ex}}, a report on {@code *err*}, and
 * ends the run. Cancellation ends the run without any response. The session's output
 * writers are flushed after every form and once more when the run ends.
 *
 * Fields read from the request: {@code code} (string, or list of pre-read forms),
 * {@code ns}, {@code eval}, {@code file}, {@code line}, {@code column}.
 */
public final class EvaluationEngine {

    private static final String TAG = "EvaluationEngine";

    private final ScriptRuntime runtime;
    private final TerminationPredicate silent;

    public EvaluationEngine(ScriptRuntime runtime) {
        this(runtime, TerminationPredicate.cancellation());
    }

    public EvaluationEngine(ScriptRuntime runtime, TerminationPredicate silent) {
        if (runtime == null) throw new IllegalArgumentException("runtime is null");
        this.runtime = runtime;
        this.silent = TerminationPredicate.cancellation().or(silent == null ? t -> false : silent);
    }

    public ScriptRuntime runtime() { return runtime; }

    /**
     * Run {@code msg}'s code starting from {@code bindings}, sending responses on
     * {@code transport}. Always returns the bindings the session continues with; an
     * explicit {@code ns} in the request applies to this run only.
     */
    public EvaluationResult evaluate(BindingSnapshot bindings, Message msg, Transport transport, CancellationToken token) {
        if (token == null) token = CancellationToken.none();

        String explicitNsName = msg.getString("ns");
        Namespace explicitNs = runtime.findNamespace(explicitNsName);
        if (explicitNsName != null && explicitNs == null) {
            send(transport, Responses.responseFor(msg)
                    .put(Message.STATUS, Responses.status(Status.ERROR, Status.NAMESPACE_NOT_FOUND, Status.DONE))
                    .put("ns", explicitNsName)
                    .build());
            return new EvaluationResult(bindings, true);
        }

        Fn evalFn = null;
        String evalName = msg.getString("eval");
        if (evalName != null) {
            Var v = runtime.findVar(evalName);
            if (v == null || !(v.get() instanceof Fn)) {
                send(transport, Responses.responseFor(msg)
                        .put(Message.STATUS, Responses.status(Status.ERROR, Status.EVAL_NOT_FOUND, Status.DONE))
                        .put("eval", evalName)
                        .build());
                return new EvaluationResult(bindings, true);
            }
            evalFn = (Fn) v.get();
        }

        String originalNs = bindings.ns();
        BindingSnapshot current = bindings;
        if (explicitNs != null) current = current.with(BindingSnapshot.NS, explicitNs.name);
        if (msg.has("file")) current = current.with(BindingSnapshot.FILE, msg.getString("file"));
        if (current.ns() == null) current = current.with(BindingSnapshot.NS, ScriptRuntime.USER_NS);

        Writer out = writer(current, BindingSnapshot.OUT);
        Writer err = writer(current, BindingSnapshot.ERR);
        try {
            Iterator<Object> forms = forms(msg);
            while (!token.isCancelled()) {
                EvalContext ctx = context(current, out, err, token);
                Object value;
                try {
                    if (!forms.hasNext()) break;
                    Object form = forms.next();
                    value = (evalFn != null)
                            ? evalFn.invoke(ctx, Collections.singletonList(form))
                            : runtime.eval(form, ctx);
                } catch (RuntimeException | StackOverflowError e) {
                    if (token.isCancelled() || silent.isSilent(e)) break;
                    current = current.with(BindingSnapshot.LAST_ERROR, e).with(BindingSnapshot.NS, ctx.ns().name);
                    reportError(msg, transport, out, err, e);
                    break;
                }

                current = current.pushResult(value).with(BindingSnapshot.NS, ctx.ns().name);
                flush(out);
                flush(err);
                Message response = Responses.responseFor(msg)
                        .put("value", runtime.print(value))
                        .put("ns", ctx.ns().name)
                        .build();
                // An interrupt that has returned has already announced the end of this run.
                if (!token.runUnlessCancelled(() -> send(transport, response))) break;
            }
        } finally {
            flushQuietly(out);
            flushQuietly(err);
        }

        if (explicitNs != null) current = current.with(BindingSnapshot.NS, originalNs);
        return new EvaluationResult(current, false);
    }

    private void reportError(Message msg, Transport transport, Writer out, Writer err, Throwable e) {
        Throwable root = rootCause(e);
        flush(out);
        flush(err);
        send(transport, Responses.responseFor(msg)
                .put(Message.STATUS, Responses.status(Status.EVAL_ERROR))
                .put("ex", e.getClass().getName())
                .put("root-ex", root.getClass().getName())
                .build());
        Debug.get().d(TAG, "eval error in " + msg.id() + ": " + e);
        try {
            err.write("Execution error (" + root.getClass().getSimpleName() + "): " + root.getMessage() + "\n");
            err.flush();
        } catch (IOException io) {
            throw new UncheckedIOException(io);
        }
    }

    private EvalContext context(BindingSnapshot current, Writer out, Writer err, CancellationToken token) {
        Map<String, Object> dynamic = new LinkedHashMap<>();
        for (String name : new String[] {
                BindingSnapshot.RESULT_1, BindingSnapshot.RESULT_2, BindingSnapshot.RESULT_3,
                BindingSnapshot.LAST_ERROR, BindingSnapshot.FILE }) {
            dynamic.put(name, current.get(name));
        }
        Namespace ns = runtime.findOrCreateNamespace(current.ns());
        Object in = current.get(BindingSnapshot.IN);
        return new EvalContext(runtime, ns, dynamic, out, err,
                (in instanceof InputSource) ? (InputSource) in : null, token::isCancelled);
    }

    private Iterator<Object> forms(Message msg) {
        Object code = msg.get("code");
        if (code instanceof List) {
            Iterator<?> items = ((List<?>) code).iterator();
            return new Iterator<>() {
                @Override public boolean hasNext() { return items.hasNext(); }
                @Override public Object next() {
                    Object item = items.next();
                    return (item instanceof String) ? runtime.readOne((String) item) : item;
                }
            };
        }
        FormReader reader = runtime.reader(code == null ? "" : String.valueOf(code),
                position(msg, "line"), position(msg, "column"));
        return new Iterator<>() {
            private Object next;
            private boolean buffered;

            @Override public boolean hasNext() {
                if (!buffered) {
                    next = reader.read();
                    buffered = true;
                }
                return next != FormReader.EOF;
            }

            @Override public Object next() {
                hasNext();
                buffered = false;
                return next;
            }
        };
    }

    // Provenance only affects error positions; a malformed value falls back to 1.
    private static int position(Message msg, String key) {
        try {
            Integer v = msg.getInteger(key);
            return (v == null) ? 1 : v;
        } catch (IllegalArgumentException e) {
            Debug.get().d(TAG, "ignoring malformed " + key + ": " + msg.get(key));
            return 1;
        }
    }

    static Throwable rootCause(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) root = root.getCause();
        return root;
    }

    private static Writer writer(BindingSnapshot bindings, String name) {
        Object w = bindings.get(name);
        return (w instanceof Writer) ? (Writer) w : Writer.nullWriter();
    }

    private static void send(Transport transport, Message response) {
        try {
            transport.send(response);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void flush(Writer w) {
        try {
            w.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void flushQuietly(Writer w) {
        try {
            w.flush();
        } catch (IOException e) {
            Debug.get().w(TAG, "failed to flush session output: " + e.getMessage());
        }
    }
}
