package com.lumen.middleware;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Immutable result of composition: the ordered middleware and the folded handler. */
public final class ComposedPipeline {

    private final List<Middleware> middleware;
    private final Handler handler;
    private final Map<String, OpDoc> ops;

    ComposedPipeline(List<Middleware> middleware, Handler handler) {
        this.middleware = Collections.unmodifiableList(new ArrayList<>(middleware));
        this.handler = handler;
        this.ops = Collections.unmodifiableMap(MiddlewareComposer.ops(this.middleware));
    }

    public List<Middleware> middleware() { return middleware; }

    public List<String> names() {
        List<String> out = new ArrayList<>(middleware.size());
        for (Middleware m : middleware) out.add(m.name());
        return out;
    }

    public Map<String, OpDoc> ops() { return ops; }

    public Handler handler() { return handler; }

    /** Run {@code request} through this pipeline; the request carries this snapshot along. */
    public void handle(Request request) {
        handler.handle(request.withPipeline(this));
    }
}
