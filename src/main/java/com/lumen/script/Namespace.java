package com.lumen.script;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

public final class Namespace {
    public final String name;
    private final Map<String, Var> mappings = new ConcurrentHashMap<>();

    Namespace(String name) {
        this.name = name;
    }

    /** Create or re-root the var {@code name} in this namespace. */
    public Var intern(String varName, Object value) {
        Var v = mappings.computeIfAbsent(varName, n -> new Var(this, n, null));
        v.set(value);
        return v;
    }

    public Var find(String varName) {
        return mappings.get(varName);
    }

    /** Sorted snapshot of the var names, for diagnostics. */
    public Map<String, Var> mappings() {
        return Collections.unmodifiableMap(new TreeMap<>(mappings));
    }

    @Override
    public String toString() { return "#namespace[" + name + "]"; }
}
