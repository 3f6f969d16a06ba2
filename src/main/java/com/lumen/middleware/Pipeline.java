package com.lumen.middleware;

import com.lumen.debug.Debug;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The active request-handling pipeline, held in one atomic reference.
 *
 * Each dispatch reads the reference once and runs entirely against that snapshot;
 * {@link #install(List)} composes a complete new pipeline before swapping it in, so no
 * dispatch ever sees a partly built one.
 */
public final class Pipeline {

    private static final String TAG = "Pipeline";

    private final AtomicReference<ComposedPipeline> current;

    /** An empty pipeline that answers every op as unknown until {@link #install(List)}. */
    public Pipeline() {
        this(Collections.<Middleware>emptyList());
    }

    public Pipeline(List<? extends Middleware> middleware) {
        this.current = new AtomicReference<>(MiddlewareComposer.compose(middleware));
        Debug.get().i(TAG, "installed " + current.get().names());
    }

    public ComposedPipeline current() {
        return current.get();
    }

    public void dispatch(Request request) {
        current.get().handle(request);
    }

    /**
     * Compose and swap in a new pipeline. On a composition error the current pipeline
     * stays installed and the exception propagates.
     */
    public ComposedPipeline install(List<? extends Middleware> middleware) {
        ComposedPipeline next;
        try {
            next = MiddlewareComposer.compose(middleware);
        } catch (MiddlewareConfigurationException e) {
            Debug.get().e(TAG, "rejected pipeline: " + e.getMessage());
            throw e;
        }
        current.set(next);
        Debug.get().i(TAG, "installed " + next.names());
        return next;
    }
}
