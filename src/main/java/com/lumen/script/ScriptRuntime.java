package com.lumen.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The language runtime a REPL server drives: namespaces, reader, evaluator and printer.
 *
 * One instance is shared by all sessions of a server. Namespaces are global to the
 * runtime; what differs per session is the current namespace and the result history,
 * which callers pass in through {@link EvalContext}.
 */
public class ScriptRuntime {

    public static final String CORE_NS = "lumen.core";
    public static final String USER_NS = "user";

    /** Name under which the current namespace is visible to code. */
    public static final String NS_VAR = "*ns*";

    private final Map<String, Namespace> namespaces = new ConcurrentHashMap<>();
    private final Interpreter interpreter;

    public ScriptRuntime() {
        this.interpreter = new Interpreter(this);
        Builtins.register(findOrCreateNamespace(CORE_NS));
        findOrCreateNamespace(USER_NS);
    }

    public Namespace findNamespace(String name) {
        return (name == null) ? null : namespaces.get(name);
    }

    public Namespace findOrCreateNamespace(String name) {
        if (name == null || name.trim().isEmpty()) throw new IllegalArgumentException("namespace name required");
        return namespaces.computeIfAbsent(name.trim(), Namespace::new);
    }

    public List<String> namespaceNames() {
        List<String> names = new ArrayList<>(namespaces.keySet());
        Collections.sort(names);
        return names;
    }

    /** Register a host function; handy for embedding and tests. */
    public Var define(String nsName, String name, Fn fn) {
        return findOrCreateNamespace(nsName).intern(name, fn);
    }

    /**
     * Resolve a symbol to a var: qualified symbols look only in their namespace,
     * unqualified ones in {@code current} and then in {@code lumen.core}.
     */
    public Var resolveVar(Symbol sym, Namespace current) {
        if (sym.isQualified()) {
            Namespace ns = namespaces.get(sym.ns);
            return (ns == null) ? null : ns.find(sym.name);
        }
        Var v = (current == null) ? null : current.find(sym.name);
        if (v != null) return v;
        return namespaces.get(CORE_NS).find(sym.name);
    }

    /** Resolve a fully qualified {@code ns/name} string; null when either part is missing. */
    public Var findVar(String qualifiedName) {
        if (qualifiedName == null) return null;
        Symbol sym = Symbol.parse(qualifiedName.trim());
        if (!sym.isQualified()) return null;
        return resolveVar(sym, null);
    }

    public FormReader reader(String code, int line, int column) {
        return new FormReader(code, line, column);
    }

    /** Read a single form from text; used for pre-parsed expression lists. */
    public Object readOne(String text) {
        Object form = new FormReader(text).read();
        if (form == FormReader.EOF) throw new ReaderException("No form in: " + text, 1, 1);
        return form;
    }

    public Object eval(Object form, EvalContext ctx) {
        return interpreter.eval(form, ctx);
    }

    public String print(Object value) {
        return Printer.print(value);
    }
}
