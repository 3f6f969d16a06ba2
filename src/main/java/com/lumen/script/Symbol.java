package com.lumen.script;

import java.util.Objects;

/** A possibly namespace-qualified name: {@code x} or {@code lumen.core/inc}. */
public final class Symbol {
    public final String ns;
    public final String name;

    private Symbol(String ns, String name) {
        this.ns = ns;
        this.name = name;
    }

    public static Symbol of(String ns, String name) {
        return new Symbol(ns, name);
    }

    /** Split on the first '/' unless the whole text is "/" (the division function). */
    public static Symbol parse(String text) {
        int slash = text.indexOf('/');
        if (slash <= 0 || slash == text.length() - 1) return new Symbol(null, text);
        return new Symbol(text.substring(0, slash), text.substring(slash + 1));
    }

    public boolean isQualified() { return ns != null; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Symbol)) return false;
        Symbol s = (Symbol) o;
        return Objects.equals(ns, s.ns) && name.equals(s.name);
    }

    @Override
    public int hashCode() { return Objects.hash(ns, name); }

    @Override
    public String toString() { return (ns == null) ? name : ns + "/" + name; }
}
