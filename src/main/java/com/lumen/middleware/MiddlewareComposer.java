package com.lumen.middleware;

import com.lumen.debug.Debug;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Orders a set of middleware by their declared capability dependencies and folds them
 * into one handler.
 *
 * A {@code requires} edge puts the provider strictly earlier; {@code expects} only checks
 * presence. Ties are broken by the order the middleware were given in, so the same input
 * always composes the same way.
 */
public final class MiddlewareComposer {

    private static final String TAG = "MiddlewareComposer";

    private MiddlewareComposer() {}

    public static ComposedPipeline compose(List<? extends Middleware> middleware) {
        if (middleware == null) throw new IllegalArgumentException("middleware is null");
        List<Middleware> stack = new ArrayList<>(middleware);
        int n = stack.size();

        List<Descriptor> descriptors = new ArrayList<>(n);
        Set<String> names = new HashSet<>();
        for (Middleware m : stack) {
            Descriptor d = m.descriptor();
            if (!names.add(d.name())) {
                throw new MiddlewareConfigurationException("Duplicate middleware: " + d.name());
            }
            descriptors.add(d);
        }

        // capability -> indices of middleware providing it
        Map<String, List<Integer>> providers = new HashMap<>();
        for (int i = 0; i < n; i++) {
            for (String cap : descriptors.get(i).provides()) {
                providers.computeIfAbsent(cap, k -> new ArrayList<>()).add(i);
            }
        }
        for (Map.Entry<String, List<Integer>> e : providers.entrySet()) {
            if (e.getValue().size() > 1) {
                Debug.get().w(TAG, "op '" + e.getKey() + "' is handled by " + namesOf(descriptors, e.getValue())
                        + "; the earliest one wins");
            }
        }

        List<List<Integer>> successors = new ArrayList<>(n);
        int[] inDegree = new int[n];
        for (int i = 0; i < n; i++) successors.add(new ArrayList<>());

        for (int i = 0; i < n; i++) {
            Descriptor d = descriptors.get(i);
            for (String cap : d.requires()) {
                int p = soleProvider(providers, descriptors, d, cap, "requires");
                if (p == i) {
                    throw new MiddlewareConfigurationException(d.name() + " requires its own capability '" + cap + "'");
                }
                successors.get(p).add(i);
                inDegree[i]++;
            }
            for (String cap : d.expects()) {
                soleProvider(providers, descriptors, d, cap, "expects");
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) ready.add(i);
        }
        List<Middleware> ordered = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            int i = ready.poll();
            ordered.add(stack.get(i));
            for (int s : successors.get(i)) {
                if (--inDegree[s] == 0) ready.add(s);
            }
        }
        if (ordered.size() < n) {
            List<Integer> stuck = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                if (inDegree[i] > 0) stuck.add(i);
            }
            throw new MiddlewareConfigurationException("Middleware dependency cycle among " + namesOf(descriptors, stuck));
        }

        Handler handler = UnknownOpHandler.INSTANCE;
        for (int i = ordered.size() - 1; i >= 0; i--) {
            handler = ordered.get(i).wrap(handler);
        }
        return new ComposedPipeline(ordered, handler);
    }

    private static int soleProvider(Map<String, List<Integer>> providers, List<Descriptor> descriptors,
                                    Descriptor d, String cap, String relation) {
        List<Integer> p = providers.get(cap);
        if (p == null || p.isEmpty()) {
            throw new MiddlewareConfigurationException(d.name() + " " + relation + " '" + cap + "' but nothing provides it");
        }
        if (p.size() > 1) {
            throw new MiddlewareConfigurationException(d.name() + " " + relation + " '" + cap
                    + "' which is provided by more than one middleware: " + namesOf(descriptors, p));
        }
        return p.get(0);
    }

    private static List<String> namesOf(List<Descriptor> descriptors, List<Integer> indices) {
        List<String> out = new ArrayList<>(indices.size());
        for (int i : indices) out.add(descriptors.get(i).name());
        return out;
    }

    /** Ops of a composed stack with their docs, first provider wins. */
    static Map<String, OpDoc> ops(List<Middleware> ordered) {
        Map<String, OpDoc> out = new LinkedHashMap<>();
        for (Middleware m : ordered) {
            for (Map.Entry<String, OpDoc> e : m.descriptor().handles().entrySet()) {
                out.putIfAbsent(e.getKey(), e.getValue());
            }
        }
        return out;
    }
}
