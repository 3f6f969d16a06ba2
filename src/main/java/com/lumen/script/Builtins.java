package com.lumen.script;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Core functions interned into {@code lumen.core}. */
final class Builtins {

    private Builtins() {}

    static void register(Namespace core) {
        core.intern("+", (Fn) (ctx, args) -> arith(args, '+'));
        core.intern("-", (Fn) (ctx, args) -> arith(args, '-'));
        core.intern("*", (Fn) (ctx, args) -> arith(args, '*'));
        core.intern("/", (Fn) (ctx, args) -> arith(args, '/'));
        core.intern("inc", (Fn) (ctx, args) -> arith(List.of(arity(args, 1, "inc").get(0), 1L), '+'));
        core.intern("dec", (Fn) (ctx, args) -> arith(List.of(arity(args, 1, "dec").get(0), 1L), '-'));

        core.intern("=", (Fn) (ctx, args) -> {
            for (int i = 1; i < args.size(); i++) {
                if (!equiv(args.get(i - 1), args.get(i))) return Boolean.FALSE;
            }
            return Boolean.TRUE;
        });
        core.intern("<", (Fn) (ctx, args) -> compareChain(args, "<"));
        core.intern(">", (Fn) (ctx, args) -> compareChain(args, ">"));
        core.intern("<=", (Fn) (ctx, args) -> compareChain(args, "<="));
        core.intern(">=", (Fn) (ctx, args) -> compareChain(args, ">="));
        core.intern("not", (Fn) (ctx, args) -> !Interpreter.truthy(arity(args, 1, "not").get(0)));

        core.intern("identity", (Fn) (ctx, args) -> arity(args, 1, "identity").get(0));
        core.intern("str", (Fn) (ctx, args) -> {
            StringBuilder sb = new StringBuilder();
            for (Object a : args) sb.append(Printer.display(a));
            return sb.toString();
        });
        core.intern("pr-str", (Fn) (ctx, args) -> joinPrinted(args));
        core.intern("print", (Fn) (ctx, args) -> {
            write(ctx.out(), joinDisplayed(args));
            return null;
        });
        core.intern("println", (Fn) (ctx, args) -> {
            write(ctx.out(), joinDisplayed(args) + "\n");
            return null;
        });

        core.intern("list", (Fn) (ctx, args) -> Collections.unmodifiableList(new ArrayList<>(args)));
        core.intern("vector", (Fn) (ctx, args) -> new Vec(args));
        core.intern("count", (Fn) (ctx, args) -> (long) items(arity(args, 1, "count").get(0)).size());
        core.intern("first", (Fn) (ctx, args) -> {
            List<Object> xs = items(arity(args, 1, "first").get(0));
            return xs.isEmpty() ? null : xs.get(0);
        });
        core.intern("rest", (Fn) (ctx, args) -> {
            List<Object> xs = items(arity(args, 1, "rest").get(0));
            return xs.isEmpty() ? xs : Collections.unmodifiableList(new ArrayList<>(xs.subList(1, xs.size())));
        });

        core.intern("ex-info", (Fn) (ctx, args) -> {
            if (args.isEmpty() || args.size() > 3) throw new ScriptException("ex-info expects (msg), (msg data) or (msg data cause)");
            Map<Object, Object> data = new LinkedHashMap<>();
            if (args.size() > 1 && args.get(1) instanceof Map) {
                for (Map.Entry<?, ?> e : ((Map<?, ?>) args.get(1)).entrySet()) data.put(e.getKey(), e.getValue());
            }
            Throwable cause = (args.size() == 3 && args.get(2) instanceof Throwable) ? (Throwable) args.get(2) : null;
            return new ScriptException(Printer.display(args.get(0)), data, cause);
        });
        core.intern("ex-message", (Fn) (ctx, args) -> {
            Object t = arity(args, 1, "ex-message").get(0);
            return (t instanceof Throwable) ? ((Throwable) t).getMessage() : null;
        });

        core.intern("in-ns", (Fn) (ctx, args) -> {
            Object name = arity(args, 1, "in-ns").get(0);
            String nsName = (name instanceof Symbol) ? ((Symbol) name).toString() : Printer.display(name);
            if (nsName.isEmpty()) throw new ScriptException("in-ns expects a namespace name");
            Namespace ns = ctx.runtime().findOrCreateNamespace(nsName);
            ctx.setNs(ns);
            return ns;
        });

        // (read-line) blocks until the session has a line of input; nil at end of input.
        core.intern("read-line", (Fn) (ctx, args) -> {
            arity(args, 0, "read-line");
            ctx.checkCancelled();
            InputSource in = ctx.in();
            if (in == null) return null;
            try {
                if (ctx.out() != null) ctx.out().flush();
                return in.readLine();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EvaluationCancelledException();
            } catch (IOException e) {
                throw new ScriptException("read-line failed: " + e.getMessage(), e);
            }
        });

        // (sleep ms) blocks interruptibly; an interrupt surfaces as cancellation.
        core.intern("sleep", (Fn) (ctx, args) -> {
            long ms = toNumber(arity(args, 1, "sleep").get(0)).longValue();
            ctx.checkCancelled();
            try {
                Thread.sleep(ms);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EvaluationCancelledException();
            }
            ctx.checkCancelled();
            return null;
        });
    }

    private static List<Object> arity(List<Object> args, int n, String fn) {
        if (args.size() != n) {
            throw new ScriptException("Wrong number of args (" + args.size() + ") passed to " + fn);
        }
        return args;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> items(Object v) {
        if (v == null) return Collections.emptyList();
        if (v instanceof Vec) return ((Vec) v).items;
        if (v instanceof List) return (List<Object>) v;
        if (v instanceof String) {
            List<Object> chars = new ArrayList<>();
            for (char c : ((String) v).toCharArray()) chars.add(String.valueOf(c));
            return chars;
        }
        throw new ScriptException("Don't know how to create a sequence from: " + Printer.print(v));
    }

    private static Number toNumber(Object v) {
        if (v instanceof Long || v instanceof Double) return (Number) v;
        if (v instanceof Number) return ((Number) v).longValue();
        throw new ScriptException(Printer.print(v) + " is not a number");
    }

    static Object arith(List<Object> args, char op) {
        if (args.isEmpty()) {
            if (op == '+') return 0L;
            if (op == '*') return 1L;
            throw new ScriptException("Wrong number of args (0) passed to " + op);
        }
        Number acc = toNumber(args.get(0));
        if (args.size() == 1) {
            if (op == '-') return (acc instanceof Double) ? (Object) (-acc.doubleValue()) : (Object) (-acc.longValue());
            if (op == '/') return divide(1L, acc);
            return acc;
        }
        for (int i = 1; i < args.size(); i++) {
            Number n = toNumber(args.get(i));
            if (op == '/') {
                acc = divide(acc, n);
            } else if (acc instanceof Double || n instanceof Double) {
                double a = acc.doubleValue(), b = n.doubleValue();
                acc = (op == '+') ? a + b : (op == '-') ? a - b : a * b;
            } else {
                long a = acc.longValue(), b = n.longValue();
                acc = (op == '+') ? Math.addExact(a, b) : (op == '-') ? Math.subtractExact(a, b) : Math.multiplyExact(a, b);
            }
        }
        return acc;
    }

    private static Number divide(Number a, Number b) {
        if (a instanceof Double || b instanceof Double) return a.doubleValue() / b.doubleValue();
        long x = a.longValue(), y = b.longValue();
        if (y == 0) throw new ArithmeticException("Divide by zero");
        if (x % y == 0) return x / y;
        return (double) x / (double) y;
    }

    private static boolean equiv(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            if (a instanceof Double || b instanceof Double) {
                return ((Number) a).doubleValue() == ((Number) b).doubleValue();
            }
            return ((Number) a).longValue() == ((Number) b).longValue();
        }
        if ((a instanceof Vec || a instanceof List) && (b instanceof Vec || b instanceof List)) {
            return items(a).equals(items(b));
        }
        return (a == null) ? b == null : a.equals(b);
    }

    private static Boolean compareChain(List<Object> args, String op) {
        if (args.isEmpty()) throw new ScriptException("Wrong number of args (0) passed to " + op);
        for (int i = 1; i < args.size(); i++) {
            double a = toNumber(args.get(i - 1)).doubleValue();
            double b = toNumber(args.get(i)).doubleValue();
            boolean ok;
            switch (op) {
                case "<": ok = a < b; break;
                case ">": ok = a > b; break;
                case "<=": ok = a <= b; break;
                default: ok = a >= b; break;
            }
            if (!ok) return Boolean.FALSE;
        }
        return Boolean.TRUE;
    }

    private static String joinDisplayed(List<Object> args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(Printer.display(args.get(i)));
        }
        return sb.toString();
    }

    private static String joinPrinted(List<Object> args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(Printer.print(args.get(i)));
        }
        return sb.toString();
    }

    private static void write(Writer w, String s) {
        if (w == null) return;
        try {
            w.write(s);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
