package com.lumen.script;

import java.util.List;

/** Anything callable from code: builtins and closures. */
@FunctionalInterface
public interface Fn {
    Object invoke(EvalContext ctx, List<Object> args);
}
