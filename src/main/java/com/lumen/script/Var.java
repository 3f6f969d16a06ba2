package com.lumen.script;

/** A named, namespace-owned mutable root binding created by {@code def}. */
public final class Var {
    public final Namespace ns;
    public final String name;
    private volatile Object root;

    Var(Namespace ns, String name, Object root) {
        this.ns = ns;
        this.name = name;
        this.root = root;
    }

    public Object get() { return root; }

    void set(Object value) { this.root = value; }

    @Override
    public String toString() { return "#'" + ns.name + "/" + name; }
}
