package com.lumen.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable, ordered map of dynamic var name to value: the evaluation context a session
 * carries from one task to the next (current namespace, result history, last error,
 * current file, output writers).
 *
 * Updates return a new snapshot; a snapshot handed to a task is never changed under it.
 */
public final class BindingSnapshot {

    public static final String NS = "*ns*";
    public static final String RESULT_1 = "*1";
    public static final String RESULT_2 = "*2";
    public static final String RESULT_3 = "*3";
    public static final String LAST_ERROR = "*e";
    public static final String FILE = "*file*";
    public static final String OUT = "*out*";
    public static final String ERR = "*err*";
    public static final String IN = "*in*";

    private static final BindingSnapshot EMPTY = new BindingSnapshot(new LinkedHashMap<>());

    private final Map<String, Object> bindings;

    private BindingSnapshot(Map<String, Object> bindings) {
        this.bindings = Collections.unmodifiableMap(bindings);
    }

    public static BindingSnapshot empty() {
        return EMPTY;
    }

    /** Fresh-session defaults: namespace {@code ns}, empty history. */
    public static BindingSnapshot initial(String ns) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(NS, ns);
        m.put(RESULT_1, null);
        m.put(RESULT_2, null);
        m.put(RESULT_3, null);
        m.put(LAST_ERROR, null);
        m.put(FILE, null);
        return new BindingSnapshot(m);
    }

    public Object get(String name) { return bindings.get(name); }

    public boolean contains(String name) { return bindings.containsKey(name); }

    public String ns() {
        Object v = bindings.get(NS);
        return (v == null) ? null : String.valueOf(v);
    }

    public BindingSnapshot with(String name, Object value) {
        Map<String, Object> m = new LinkedHashMap<>(bindings);
        m.put(name, value);
        return new BindingSnapshot(m);
    }

    public BindingSnapshot withAll(Map<String, ?> values) {
        Map<String, Object> m = new LinkedHashMap<>(bindings);
        m.putAll(values);
        return new BindingSnapshot(m);
    }

    /** Shift the result history: {@code *3 <- *2 <- *1 <- value}. */
    public BindingSnapshot pushResult(Object value) {
        Map<String, Object> m = new LinkedHashMap<>(bindings);
        m.put(RESULT_3, bindings.get(RESULT_2));
        m.put(RESULT_2, bindings.get(RESULT_1));
        m.put(RESULT_1, value);
        return new BindingSnapshot(m);
    }

    /** Unmodifiable view in binding order. */
    public Map<String, Object> asMap() { return bindings; }

    @Override
    public String toString() { return "BindingSnapshot" + bindings; }
}
