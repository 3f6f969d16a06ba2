package com.lumen.middleware;

/** Handles one request: answers it on its transport, or passes it on. */
@FunctionalInterface
public interface Handler {
    void handle(Request request);
}
