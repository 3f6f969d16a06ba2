package com.lumen.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tree-walking evaluator for forms produced by {@link FormReader}.
 *
 * Special forms: quote, def, if, do, let, fn, throw. Everything else in call position
 * is evaluated and invoked as an {@link Fn}. Each list evaluation is a cancellation
 * safe point.
 */
public class Interpreter {

    private final ScriptRuntime runtime;

    Interpreter(ScriptRuntime runtime) {
        this.runtime = runtime;
    }

    public Object eval(Object form, EvalContext ctx) {
        return eval(form, Collections.<String, Object>emptyMap(), ctx);
    }

    @SuppressWarnings("unchecked")
    Object eval(Object form, Map<String, Object> locals, EvalContext ctx) {
        if (form instanceof Symbol) return resolve((Symbol) form, locals, ctx);
        if (form instanceof Vec) {
            List<Object> out = new ArrayList<>();
            for (Object item : ((Vec) form).items) out.add(eval(item, locals, ctx));
            return new Vec(out);
        }
        if (form instanceof List) {
            ctx.checkCancelled();
            return evalList((List<Object>) form, locals, ctx);
        }
        return form;
    }

    private Object evalList(List<Object> list, Map<String, Object> locals, EvalContext ctx) {
        if (list.isEmpty()) return list;

        Object head = list.get(0);
        if (head instanceof Symbol && !((Symbol) head).isQualified()) {
            switch (((Symbol) head).name) {
                case "quote":
                    expectArgs(list, 1, "quote");
                    return list.get(1);
                case "def":
                    return evalDef(list, locals, ctx);
                case "if":
                    return evalIf(list, locals, ctx);
                case "do":
                    return evalBody(list.subList(1, list.size()), locals, ctx);
                case "let":
                    return evalLet(list, locals, ctx);
                case "fn":
                    return evalFn(list, locals);
                case "throw":
                    return evalThrow(list, locals, ctx);
                default:
                    break;
            }
        }

        Object target = eval(head, locals, ctx);
        if (!(target instanceof Fn)) {
            throw new ScriptException(Printer.print(target) + " cannot be cast to a function");
        }
        List<Object> args = new ArrayList<>(list.size() - 1);
        for (int i = 1; i < list.size(); i++) args.add(eval(list.get(i), locals, ctx));
        return ((Fn) target).invoke(ctx, args);
    }

    private Object evalDef(List<Object> list, Map<String, Object> locals, EvalContext ctx) {
        if (list.size() < 2 || list.size() > 3 || !(list.get(1) instanceof Symbol)) {
            throw new ScriptException("def expects a symbol and an optional init");
        }
        Symbol name = (Symbol) list.get(1);
        if (name.isQualified()) throw new ScriptException("Can't def a qualified symbol: " + name);
        Object value = (list.size() == 3) ? eval(list.get(2), locals, ctx) : null;
        return ctx.ns().intern(name.name, value);
    }

    private Object evalIf(List<Object> list, Map<String, Object> locals, EvalContext ctx) {
        if (list.size() < 3 || list.size() > 4) throw new ScriptException("if expects 2 or 3 arguments");
        Object test = eval(list.get(1), locals, ctx);
        if (truthy(test)) return eval(list.get(2), locals, ctx);
        return (list.size() == 4) ? eval(list.get(3), locals, ctx) : null;
    }

    private Object evalLet(List<Object> list, Map<String, Object> locals, EvalContext ctx) {
        if (list.size() < 2 || !(list.get(1) instanceof Vec)) throw new ScriptException("let expects a binding vector");
        List<Object> bindings = ((Vec) list.get(1)).items;
        if (bindings.size() % 2 != 0) throw new ScriptException("let requires an even number of binding forms");

        Map<String, Object> scope = new LinkedHashMap<>(locals);
        for (int i = 0; i < bindings.size(); i += 2) {
            Object name = bindings.get(i);
            if (!(name instanceof Symbol)) throw new ScriptException("Bad binding form: " + Printer.print(name));
            scope.put(((Symbol) name).name, eval(bindings.get(i + 1), scope, ctx));
        }
        return evalBody(list.subList(2, list.size()), scope, ctx);
    }

    private Object evalFn(List<Object> list, Map<String, Object> locals) {
        if (list.size() < 2 || !(list.get(1) instanceof Vec)) throw new ScriptException("fn expects a parameter vector");
        List<Symbol> params = new ArrayList<>();
        for (Object p : ((Vec) list.get(1)).items) {
            if (!(p instanceof Symbol)) throw new ScriptException("fn params must be symbols");
            params.add((Symbol) p);
        }
        List<Object> body = new ArrayList<>(list.subList(2, list.size()));
        return new Closure(params, body, new LinkedHashMap<>(locals), this);
    }

    private Object evalThrow(List<Object> list, Map<String, Object> locals, EvalContext ctx) {
        expectArgs(list, 1, "throw");
        Object v = eval(list.get(1), locals, ctx);
        if (v instanceof RuntimeException) throw (RuntimeException) v;
        if (v instanceof Error) throw (Error) v;
        if (v instanceof Throwable) throw new ScriptException(((Throwable) v).getMessage(), (Throwable) v);
        throw new ScriptException(Printer.print(v) + " cannot be cast to a Throwable");
    }

    private Object evalBody(List<Object> body, Map<String, Object> locals, EvalContext ctx) {
        Object result = null;
        for (Object form : body) result = eval(form, locals, ctx);
        return result;
    }

    private Object resolve(Symbol sym, Map<String, Object> locals, EvalContext ctx) {
        if (!sym.isQualified()) {
            if (locals.containsKey(sym.name)) return locals.get(sym.name);
            if (ctx.hasDynamicVar(sym.name)) return ctx.dynamicVar(sym.name);
            if (ScriptRuntime.NS_VAR.equals(sym.name)) return ctx.ns();
        }
        Var v = runtime.resolveVar(sym, ctx.ns());
        if (v == null) throw new ScriptException("Unable to resolve symbol: " + sym + " in this context");
        return v.get();
    }

    static boolean truthy(Object v) {
        return v != null && !Boolean.FALSE.equals(v);
    }

    private static void expectArgs(List<Object> list, int n, String what) {
        if (list.size() != n + 1) {
            throw new ScriptException("Wrong number of args (" + (list.size() - 1) + ") passed to " + what);
        }
    }
}
