package com.lumen.middleware;

/**
 * A composable request handler. {@link #wrap(Handler)} returns a handler that serves the
 * ops this middleware owns and hands every other request to {@code next}.
 */
public interface Middleware {

    Descriptor descriptor();

    Handler wrap(Handler next);

    default String name() {
        return descriptor().name();
    }
}
