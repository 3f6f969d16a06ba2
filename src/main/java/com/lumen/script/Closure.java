package com.lumen.script;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** User function created by {@code (fn [params] body...)}; captures the enclosing locals. */
final class Closure implements Fn {
    private final List<Symbol> params;
    private final List<Object> body;
    private final Map<String, Object> captured;
    private final Interpreter interpreter;

    Closure(List<Symbol> params, List<Object> body, Map<String, Object> captured, Interpreter interpreter) {
        this.params = params;
        this.body = body;
        this.captured = captured;
        this.interpreter = interpreter;
    }

    @Override
    public Object invoke(EvalContext ctx, List<Object> args) {
        if (args.size() != params.size()) {
            throw new ScriptException("Wrong number of args (" + args.size() + ") passed to fn of arity " + params.size());
        }
        Map<String, Object> locals = new LinkedHashMap<>(captured);
        for (int i = 0; i < params.size(); i++) {
            locals.put(params.get(i).name, args.get(i));
        }
        Object result = null;
        for (Object form : body) {
            result = interpreter.eval(form, locals, ctx);
        }
        return result;
    }

    @Override
    public String toString() { return "#fn[" + params + "]"; }
}
