package com.lumen.middleware;

import com.lumen.eval.EvaluationEngine;
import com.lumen.session.SessionRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Middleware instances a server can install, looked up by name. */
public final class MiddlewareCatalog {

    public static final List<String> DEFAULT_STACK = Collections.unmodifiableList(Arrays.asList(
            SessionMiddleware.NAME,
            InterruptibleEvalMiddleware.NAME,
            AddStdinMiddleware.NAME,
            LoadFileMiddleware.NAME,
            DescribeMiddleware.NAME,
            DynamicLoaderMiddleware.NAME));

    private final Map<String, Middleware> entries = new LinkedHashMap<>();

    /**
     * The built-in middleware wired to {@code registry}, {@code engine} and the
     * {@code pipeline} the dynamic loader swaps.
     */
    public static MiddlewareCatalog standard(SessionRegistry registry, EvaluationEngine engine, Pipeline pipeline) {
        MiddlewareCatalog catalog = new MiddlewareCatalog();
        catalog.register(new SessionMiddleware(registry));
        catalog.register(new InterruptibleEvalMiddleware(engine));
        catalog.register(new AddStdinMiddleware());
        catalog.register(new LoadFileMiddleware());
        catalog.register(new DescribeMiddleware());
        catalog.register(new DynamicLoaderMiddleware(catalog, pipeline));
        return catalog;
    }

    public synchronized MiddlewareCatalog register(Middleware m) {
        if (m == null) throw new IllegalArgumentException("middleware is null");
        entries.put(m.name(), m);
        return this;
    }

    public synchronized Middleware get(String name) {
        return entries.get(name);
    }

    /** Look up every name, in order; unknown names fail the whole lookup. */
    public synchronized List<Middleware> resolve(List<String> names) {
        List<Middleware> out = new ArrayList<>(names.size());
        List<String> missing = new ArrayList<>();
        for (String name : names) {
            Middleware m = entries.get(name);
            if (m == null) missing.add(name);
            else out.add(m);
        }
        if (!missing.isEmpty()) {
            throw new MiddlewareConfigurationException("Unknown middleware " + missing + "; available: " + entries.keySet());
        }
        return out;
    }

    public synchronized List<String> names() {
        return new ArrayList<>(entries.keySet());
    }
}
